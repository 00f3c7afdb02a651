package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;

/** A deterministic step computed inside the orchestrator from earlier step results. */
public interface InternalAction {

  String name();

  JsonNode apply(InternalActionContext context);
}
