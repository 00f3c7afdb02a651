package com.infraops.orchestrator.workflow.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

public class UnknownWorkflowException extends OrchestratorException {

  private final String workflowId;

  public UnknownWorkflowException(String workflowId) {
    super("Workflow " + workflowId + " not found");
    this.workflowId = workflowId;
    detail("workflowId", workflowId);
  }

  public String getWorkflowId() {
    return workflowId;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.NOT_FOUND;
  }

  @Override
  public String title() {
    return "Unknown workflow";
  }
}
