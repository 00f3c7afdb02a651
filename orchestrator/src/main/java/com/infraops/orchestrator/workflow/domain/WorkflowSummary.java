package com.infraops.orchestrator.workflow.domain;

public record WorkflowSummary(String id, String name, String description, int steps) {

  public static WorkflowSummary of(WorkflowDefinition definition) {
    return new WorkflowSummary(
        definition.id(), definition.name(), definition.description(), definition.steps().size());
  }
}
