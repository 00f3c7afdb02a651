package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Map;

/**
 * @param previousResult result of the step just before this one, or a missing node for the first
 *     step or after a failed step
 */
public record InternalActionContext(
    String workflowId, Map<String, Object> parameters, JsonNode previousResult) {

  public InternalActionContext {
    parameters = parameters != null ? parameters : Map.of();
    previousResult = previousResult != null ? previousResult : MissingNode.getInstance();
  }
}
