package com.infraops.orchestrator.workflow.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.util.StringUtils;

public record WorkflowDefinition(
    String id, String name, String description, List<StepDefinition> steps) {

  public WorkflowDefinition {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("Workflow id must not be blank");
    }
    steps = steps != null ? List.copyOf(steps) : List.of();
    Set<String> stepIds = new HashSet<>();
    for (StepDefinition step : steps) {
      if (!stepIds.add(step.id())) {
        throw new IllegalArgumentException("Duplicate step " + step.id() + " in workflow " + id);
      }
    }
  }
}
