package com.infraops.orchestrator.workflow.pipeline;

import com.infraops.orchestrator.workflow.domain.ExecutionResult;
import com.infraops.orchestrator.workflow.domain.WorkflowExecution;

/**
 * Dedicated handler for a workflow whose control flow does not fit the linear step model. The
 * engine marks the execution completed or failed from {@link ExecutionResult#isSuccess()}.
 */
public interface WorkflowPipeline {

  String workflowId();

  ExecutionResult run(WorkflowExecution execution, StepRecorder recorder);
}
