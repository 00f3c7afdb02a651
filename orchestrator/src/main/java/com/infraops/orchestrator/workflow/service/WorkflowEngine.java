package com.infraops.orchestrator.workflow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.events.EventTopic;
import com.infraops.orchestrator.events.OrchestratorEvent;
import com.infraops.orchestrator.registry.service.ToolInvoker;
import com.infraops.orchestrator.workflow.action.InternalActionContext;
import com.infraops.orchestrator.workflow.action.InternalActionRegistry;
import com.infraops.orchestrator.workflow.config.WorkflowProperties;
import com.infraops.orchestrator.workflow.domain.ExecutionResult;
import com.infraops.orchestrator.workflow.domain.StepDefinition;
import com.infraops.orchestrator.workflow.domain.StepKind;
import com.infraops.orchestrator.workflow.domain.StepOutcome;
import com.infraops.orchestrator.workflow.domain.StepResult;
import com.infraops.orchestrator.workflow.domain.StepStatus;
import com.infraops.orchestrator.workflow.domain.WorkflowDefinition;
import com.infraops.orchestrator.workflow.domain.WorkflowExecution;
import com.infraops.orchestrator.workflow.domain.WorkflowSummary;
import com.infraops.orchestrator.workflow.exception.StepExecutionException;
import com.infraops.orchestrator.workflow.exception.UnknownToolException;
import com.infraops.orchestrator.workflow.exception.UnknownWorkflowException;
import com.infraops.orchestrator.workflow.exception.WorkflowFatalException;
import com.infraops.orchestrator.workflow.pipeline.StepRecorder;
import com.infraops.orchestrator.workflow.pipeline.WorkflowPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs workflows step by step on the caller's thread and keeps the in-memory execution history.
 * Step failures are recorded and the run continues; only {@link WorkflowFatalException} or an
 * unexpected engine error marks the run failed.
 */
public class WorkflowEngine {

  private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

  private static final Comparator<WorkflowExecution> NEWEST_FIRST =
      Comparator.comparing(WorkflowExecution::getStartTime)
          .thenComparingLong(WorkflowExecution::sequence)
          .reversed();

  private final WorkflowCatalog catalog;
  private final Map<String, WorkflowPipeline> pipelines = new HashMap<>();
  private final InternalActionRegistry actions;
  private final StepConditions conditions;
  private final ToolInvoker toolInvoker;
  private final EventBus eventBus;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final WorkflowProperties properties;
  private final ObjectMapper objectMapper;

  private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
  private final AtomicLong executionSequence = new AtomicLong();

  public WorkflowEngine(
      WorkflowCatalog catalog,
      List<WorkflowPipeline> pipelines,
      InternalActionRegistry actions,
      StepConditions conditions,
      ToolInvoker toolInvoker,
      EventBus eventBus,
      MeterRegistry meterRegistry,
      Clock clock,
      WorkflowProperties properties,
      ObjectMapper objectMapper) {
    this.catalog = catalog;
    this.actions = actions;
    this.conditions = conditions;
    this.toolInvoker = toolInvoker;
    this.eventBus = eventBus;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.properties = properties;
    this.objectMapper = objectMapper;
    for (WorkflowPipeline pipeline : pipelines) {
      this.pipelines.put(pipeline.workflowId(), pipeline);
    }
  }

  public List<WorkflowSummary> listWorkflows() {
    return catalog.summaries();
  }

  public WorkflowExecution execute(String workflowId, Map<String, Object> parameters) {
    WorkflowDefinition definition =
        catalog.find(workflowId).orElseThrow(() -> new UnknownWorkflowException(workflowId));
    requireKnownActions(definition);

    WorkflowExecution execution =
        new WorkflowExecution(
            executionSequence.incrementAndGet(), workflowId, parameters, clock.instant());
    executions.put(execution.getId(), execution);
    log.info("Starting workflow execution: {} - {}", execution.getId(), definition.name());
    publish(
        "workflow_started",
        Map.of(
            "executionId", execution.getId(),
            "workflowId", workflowId,
            "parameters", execution.getParameters()));

    long started = System.nanoTime();
    StepRecorder recorder = step -> recordStep(execution, step);
    try {
      WorkflowPipeline pipeline = pipelines.get(workflowId);
      if (pipeline != null) {
        ExecutionResult result = pipeline.run(execution, recorder);
        if (result.isSuccess()) {
          execution.complete(result, clock.instant());
        } else {
          execution.fail(result, clock.instant());
        }
      } else {
        runSteps(definition, execution, recorder);
        execution.complete(
            ExecutionResult.success("Workflow completed successfully"), clock.instant());
      }
      log.info("Workflow execution {}: {}", execution.getStatus().value(), execution.getId());
    } catch (RuntimeException ex) {
      log.error("Workflow execution failed: {}", execution.getId(), ex);
      execution.fail(ExecutionResult.failure(ex.getMessage()), clock.instant());
    } finally {
      meterRegistry
          .timer("workflow.execution", "workflow", workflowId, "status", execution.getStatus().value())
          .record(Duration.ofNanos(System.nanoTime() - started));
    }

    Map<String, Object> completed = new LinkedHashMap<>();
    completed.put("executionId", execution.getId());
    completed.put("workflowId", workflowId);
    completed.put("status", execution.getStatus());
    completed.put("result", execution.getResult());
    publish("workflow_completed", completed);
    return execution;
  }

  public Optional<WorkflowExecution> getExecution(String executionId) {
    return Optional.ofNullable(executionId).map(executions::get);
  }

  public List<WorkflowExecution> getHistory(Integer limit) {
    int effectiveLimit =
        limit != null && limit > 0 ? limit : properties.getDefaultHistoryLimit();
    return executions.values().stream().sorted(NEWEST_FIRST).limit(effectiveLimit).toList();
  }

  /** Drops finished executions that ended before the retention window. */
  public int pruneHistory() {
    Instant cutoff = clock.instant().minus(properties.getHistoryRetention());
    AtomicInteger removed = new AtomicInteger();
    executions
        .values()
        .removeIf(
            execution -> {
              boolean expired = execution.endedBefore(cutoff);
              if (expired) {
                removed.incrementAndGet();
              }
              return expired;
            });
    if (removed.get() > 0) {
      log.info("Pruned {} workflow execution(s) that ended before {}", removed.get(), cutoff);
    }
    return removed.get();
  }

  private void requireKnownActions(WorkflowDefinition definition) {
    for (StepDefinition step : definition.steps()) {
      if (step.kind() == StepKind.INTERNAL && !actions.contains(step.action())) {
        log.warn(
            "Workflow {} step {} names unknown internal action {}",
            definition.id(),
            step.id(),
            step.action());
        throw new UnknownToolException(step.action());
      }
    }
  }

  private void runSteps(
      WorkflowDefinition definition, WorkflowExecution execution, StepRecorder recorder) {
    Map<String, JsonNode> results = new HashMap<>();
    JsonNode previous = MissingNode.getInstance();
    List<StepDefinition> steps = definition.steps();
    for (int position = 0; position < steps.size(); position++) {
      StepDefinition step = steps.get(position);
      StepOutcome outcome = runStep(definition, position, step, execution, results, previous);
      recorder.record(
          new StepResult(
              step.id(), step.name(), StepStatus.of(outcome.success()), outcome, outcome.timestamp()));
      if (outcome.success()) {
        results.put(step.id(), outcome.result());
        previous = outcome.result();
      } else {
        previous = MissingNode.getInstance();
      }

      if (step.hasCondition()
          && !conditions.evaluate(
              definition.id(), step.condition(), outcome, execution.getParameters())) {
        log.info(
            "Workflow {} stopped due to condition: {}", execution.getId(), step.condition());
        break;
      }
    }
  }

  private StepOutcome runStep(
      WorkflowDefinition definition,
      int position,
      StepDefinition step,
      WorkflowExecution execution,
      Map<String, JsonNode> results,
      JsonNode previous) {
    log.info("Executing step: {} ({})", step.name(), step.id());
    Map<String, Object> parameters =
        resolveParameters(definition, position, step, execution.getParameters(), results);
    try {
      JsonNode result =
          switch (step.kind()) {
            case INTERNAL -> actions.run(
                step.action(),
                new InternalActionContext(definition.id(), execution.getParameters(), previous));
            case EXTERNAL_SERVICE -> toolInvoker
                .invoke(step.serviceId(), step.toolName(), parameters)
                .result();
          };
      return StepOutcome.success(result, clock.instant());
    } catch (WorkflowFatalException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      StepExecutionException failure = new StepExecutionException(step.id(), ex.getMessage(), ex);
      log.error("Step execution failed: {} ({})", step.name(), failure.getMessage());
      meterRegistry
          .counter("workflow.step.failures", "workflow", definition.id(), "step", step.id())
          .increment();
      return StepOutcome.failure(failure.getMessage(), clock.instant());
    }
  }

  /**
   * Static parameters, then values bound from earlier step results, then workflow parameters that
   * share a name with either.
   */
  Map<String, Object> resolveParameters(
      WorkflowDefinition definition,
      int position,
      StepDefinition step,
      Map<String, Object> workflowParameters,
      Map<String, JsonNode> results) {
    Map<String, Object> resolved = new LinkedHashMap<>(step.parameters());
    step.bindings()
        .forEach(
            (parameter, source) -> {
              int dot = source.indexOf('.');
              if (dot <= 0 || dot == source.length() - 1) {
                throw new WorkflowFatalException(
                    definition.id(),
                    "Step " + step.id() + " has a malformed binding for " + parameter + ": " + source);
              }
              String sourceStep = source.substring(0, dot);
              String field = source.substring(dot + 1);
              int sourcePosition = indexOf(definition, sourceStep);
              if (sourcePosition < 0 || sourcePosition >= position) {
                throw new WorkflowFatalException(
                    definition.id(),
                    "Step " + step.id() + " binds " + parameter + " to " + sourceStep
                        + ", which is not an earlier step");
              }
              JsonNode sourceResult = results.get(sourceStep);
              JsonNode value = sourceResult != null ? sourceResult.get(field) : null;
              if (value != null && !value.isNull()) {
                resolved.put(parameter, objectMapper.convertValue(value, Object.class));
              }
            });
    for (String name : List.copyOf(resolved.keySet())) {
      if (workflowParameters.containsKey(name)) {
        resolved.put(name, workflowParameters.get(name));
      }
    }
    for (String name : step.bindings().keySet()) {
      if (!resolved.containsKey(name) && workflowParameters.containsKey(name)) {
        resolved.put(name, workflowParameters.get(name));
      }
    }
    return resolved;
  }

  private static int indexOf(WorkflowDefinition definition, String stepId) {
    List<StepDefinition> steps = definition.steps();
    for (int i = 0; i < steps.size(); i++) {
      if (steps.get(i).id().equals(stepId)) {
        return i;
      }
    }
    return -1;
  }

  private void recordStep(WorkflowExecution execution, StepResult step) {
    execution.appendStep(step);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("executionId", execution.getId());
    data.put("workflowId", execution.getWorkflowId());
    data.put("stepId", step.id());
    data.put("status", step.status());
    publish("workflow_step_completed", data);
  }

  private void publish(String type, Map<String, Object> data) {
    eventBus.publish(OrchestratorEvent.of(EventTopic.AUTOMATION, type, data));
  }
}
