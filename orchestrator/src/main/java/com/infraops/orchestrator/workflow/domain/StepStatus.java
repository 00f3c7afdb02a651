package com.infraops.orchestrator.workflow.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum StepStatus {
  COMPLETED,
  FAILED;

  public static StepStatus of(boolean success) {
    return success ? COMPLETED : FAILED;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
