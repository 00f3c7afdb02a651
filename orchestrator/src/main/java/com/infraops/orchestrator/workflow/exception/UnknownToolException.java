package com.infraops.orchestrator.workflow.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

/** A step referenced an internal action that does not exist. */
public class UnknownToolException extends OrchestratorException {

  private final String action;

  public UnknownToolException(String action) {
    super("Unknown internal action: " + action);
    this.action = action;
    detail("tool", action);
  }

  public String getAction() {
    return action;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.NOT_FOUND;
  }

  @Override
  public String title() {
    return "Unknown tool";
  }
}
