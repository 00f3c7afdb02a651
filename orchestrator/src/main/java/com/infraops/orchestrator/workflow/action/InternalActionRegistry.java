package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.infraops.orchestrator.workflow.exception.UnknownToolException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class InternalActionRegistry {

  private final Map<String, InternalAction> actions = new LinkedHashMap<>();

  public InternalActionRegistry(List<InternalAction> actions) {
    for (InternalAction action : actions) {
      if (this.actions.putIfAbsent(action.name(), action) != null) {
        throw new IllegalStateException("Duplicate internal action " + action.name());
      }
    }
  }

  public static InternalActionRegistry withBuiltIns() {
    return new InternalActionRegistry(
        List.of(
            new AnalyzeNetworkIssuesAction(),
            new FormatConfigurationsAction(),
            new GenerateDocumentationAction()));
  }

  public JsonNode run(String action, InternalActionContext context) {
    InternalAction internalAction = actions.get(action);
    if (internalAction == null) {
      throw new UnknownToolException(action);
    }
    return internalAction.apply(context);
  }

  public boolean contains(String action) {
    return action != null && actions.containsKey(action);
  }

  public Set<String> names() {
    return actions.keySet();
  }
}
