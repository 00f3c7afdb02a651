package com.infraops.orchestrator.workflow.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * One step of a workflow. {@code bindings} map a parameter name to {@code stepId.field} of an
 * earlier step's result; {@code condition} is checked against this step's own outcome and stops
 * the run when false.
 */
public record StepDefinition(
    String id,
    String name,
    StepKind kind,
    String action,
    String serviceId,
    String toolName,
    Map<String, Object> parameters,
    Map<String, String> bindings,
    String condition) {

  public StepDefinition {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("Step id must not be blank");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Step " + id + " has no kind");
    }
    if (kind == StepKind.INTERNAL && !StringUtils.hasText(action)) {
      throw new IllegalArgumentException("Internal step " + id + " must name an action");
    }
    if (kind == StepKind.EXTERNAL_SERVICE
        && (!StringUtils.hasText(serviceId) || !StringUtils.hasText(toolName))) {
      throw new IllegalArgumentException("Service step " + id + " must name a service and a tool");
    }
    name = StringUtils.hasText(name) ? name : id;
    parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    bindings = bindings != null ? Map.copyOf(bindings) : Map.of();
  }

  public static StepDefinition internal(String id, String name, String action) {
    return new StepDefinition(id, name, StepKind.INTERNAL, action, null, null, null, null, null);
  }

  public static StepDefinition external(
      String id, String name, String serviceId, String toolName, Map<String, Object> parameters) {
    return new StepDefinition(
        id, name, StepKind.EXTERNAL_SERVICE, null, serviceId, toolName, parameters, null, null);
  }

  public StepDefinition withCondition(String condition) {
    return new StepDefinition(
        id, name, kind, action, serviceId, toolName, parameters, bindings, condition);
  }

  public StepDefinition withBinding(String parameter, String source) {
    Map<String, String> merged = new LinkedHashMap<>(bindings);
    merged.put(parameter, source);
    return new StepDefinition(
        id, name, kind, action, serviceId, toolName, parameters, merged, condition);
  }

  public boolean hasCondition() {
    return StringUtils.hasText(condition);
  }
}
