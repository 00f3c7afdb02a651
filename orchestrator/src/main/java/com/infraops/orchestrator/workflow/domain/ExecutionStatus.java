package com.infraops.orchestrator.workflow.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExecutionStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
