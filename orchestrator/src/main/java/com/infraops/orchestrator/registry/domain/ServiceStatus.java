package com.infraops.orchestrator.registry.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ServiceStatus {
  DISCOVERING,
  RUNNING,
  UNREACHABLE,
  /** Taken out of rotation by an operator; ignored by recovery sweeps until started again. */
  UNAVAILABLE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
