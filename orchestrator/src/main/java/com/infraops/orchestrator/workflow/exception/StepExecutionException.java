package com.infraops.orchestrator.workflow.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

/**
 * Failure of one workflow step. The engine records it in the step result and moves on; it never
 * escapes {@code execute}.
 */
public class StepExecutionException extends OrchestratorException {

  private final String stepId;

  public StepExecutionException(String stepId, String message, Throwable cause) {
    super(message, cause);
    this.stepId = stepId;
    detail("stepId", stepId);
  }

  public String getStepId() {
    return stepId;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_GATEWAY;
  }

  @Override
  public String title() {
    return "Workflow step failed";
  }
}
