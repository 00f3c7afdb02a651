package com.infraops.orchestrator.workflow.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepOutcome(boolean success, JsonNode result, String error, Instant timestamp) {

  public static StepOutcome success(JsonNode result, Instant timestamp) {
    return new StepOutcome(true, result, null, timestamp);
  }

  public static StepOutcome failure(String error, Instant timestamp) {
    return new StepOutcome(false, null, error, timestamp);
  }
}
