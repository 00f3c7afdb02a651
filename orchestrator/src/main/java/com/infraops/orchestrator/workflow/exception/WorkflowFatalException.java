package com.infraops.orchestrator.workflow.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

/** Aborts the whole execution, e.g. a malformed step definition or an unknown strict condition. */
public class WorkflowFatalException extends OrchestratorException {

  public WorkflowFatalException(String workflowId, String message) {
    super(message);
    detail("workflowId", workflowId);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  @Override
  public String title() {
    return "Workflow aborted";
  }
}
