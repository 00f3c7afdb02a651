package com.infraops.orchestrator.workflow.domain;

public enum StepKind {
  /** Deterministic computation inside the orchestrator. */
  INTERNAL,
  /** Tool call on a registered backend through the registry. */
  EXTERNAL_SERVICE
}
