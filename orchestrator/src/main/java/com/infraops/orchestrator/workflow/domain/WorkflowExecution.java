package com.infraops.orchestrator.workflow.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One run of a workflow. Steps are append-only and the execution leaves {@code RUNNING} at most
 * once; afterwards every mutator is rejected.
 */
public class WorkflowExecution {

  private final String id;
  private final long sequence;
  private final String workflowId;
  private final Map<String, Object> parameters;
  private final Instant startTime;
  private final List<StepResult> steps = new ArrayList<>();

  private ExecutionStatus status = ExecutionStatus.RUNNING;
  private Instant endTime;
  private ExecutionResult result;

  public WorkflowExecution(
      long sequence, String workflowId, Map<String, Object> parameters, Instant startTime) {
    this.sequence = sequence;
    this.id = "exec_" + sequence;
    this.workflowId = workflowId;
    this.parameters =
        parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
            : Map.of();
    this.startTime = startTime;
  }

  public String getId() {
    return id;
  }

  public long sequence() {
    return sequence;
  }

  public String getWorkflowId() {
    return workflowId;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public synchronized ExecutionStatus getStatus() {
    return status;
  }

  public synchronized Instant getEndTime() {
    return endTime;
  }

  public synchronized ExecutionResult getResult() {
    return result;
  }

  public synchronized List<StepResult> getSteps() {
    return List.copyOf(steps);
  }

  public synchronized void appendStep(StepResult step) {
    ensureRunning();
    steps.add(step);
  }

  public synchronized void complete(ExecutionResult result, Instant endTime) {
    finish(ExecutionStatus.COMPLETED, result, endTime);
  }

  public synchronized void fail(ExecutionResult result, Instant endTime) {
    finish(ExecutionStatus.FAILED, result, endTime);
  }

  public synchronized boolean endedBefore(Instant cutoff) {
    return status.isTerminal() && endTime != null && endTime.isBefore(cutoff);
  }

  private void finish(ExecutionStatus terminal, ExecutionResult result, Instant endTime) {
    ensureRunning();
    this.status = terminal;
    this.result = result;
    this.endTime = endTime;
  }

  private void ensureRunning() {
    if (status.isTerminal()) {
      throw new IllegalStateException("Execution " + id + " is already " + status.value());
    }
  }
}
