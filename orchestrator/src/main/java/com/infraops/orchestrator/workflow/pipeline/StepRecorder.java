package com.infraops.orchestrator.workflow.pipeline;

import com.infraops.orchestrator.workflow.domain.StepResult;

/** Appends a step to the running execution and announces it. */
@FunctionalInterface
public interface StepRecorder {

  void record(StepResult step);
}
