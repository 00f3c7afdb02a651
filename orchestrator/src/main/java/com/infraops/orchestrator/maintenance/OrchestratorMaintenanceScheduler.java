package com.infraops.orchestrator.maintenance;

import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.events.OrchestratorEvent;
import com.infraops.orchestrator.registry.domain.HealthSweepSummary;
import com.infraops.orchestrator.registry.service.ServiceRegistry;
import com.infraops.orchestrator.workflow.service.WorkflowEngine;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OrchestratorMaintenanceScheduler {

  private static final Logger log = LoggerFactory.getLogger(OrchestratorMaintenanceScheduler.class);

  private final ServiceRegistry serviceRegistry;
  private final WorkflowEngine workflowEngine;
  private final EventBus eventBus;

  public OrchestratorMaintenanceScheduler(
      ServiceRegistry serviceRegistry, WorkflowEngine workflowEngine, EventBus eventBus) {
    this.serviceRegistry = serviceRegistry;
    this.workflowEngine = workflowEngine;
    this.eventBus = eventBus;
  }

  @Scheduled(
      initialDelayString = "${app.maintenance.health-sweep-delay:PT2M}",
      fixedDelayString = "${app.maintenance.health-sweep-delay:PT2M}")
  public void recoverUnreachableServices() {
    try {
      HealthSweepSummary summary = serviceRegistry.recoverUnreachable();
      if (!summary.recovered().isEmpty()) {
        log.info("Health sweep recovered {}", summary.recovered());
      }
      log.debug(
          "Health sweep finished: {}/{} reachable", summary.reachable(), summary.total());
    } catch (RuntimeException ex) {
      log.error("Health sweep failed", ex);
    }
  }

  @Scheduled(
      initialDelayString = "${app.maintenance.history-prune-delay:PT1H}",
      fixedDelayString = "${app.maintenance.history-prune-delay:PT1H}")
  public void pruneExecutionHistory() {
    try {
      workflowEngine.pruneHistory();
    } catch (RuntimeException ex) {
      log.error("Execution history pruning failed", ex);
    }
  }

  /** Keeps idle SSE connections open through proxies and flushes out dead subscribers. */
  @Scheduled(fixedDelayString = "${app.events.heartbeat-interval:PT30S}")
  public void heartbeat() {
    if (eventBus.subscriberCount() > 0) {
      eventBus.publish(
          OrchestratorEvent.of(null, "heartbeat", Map.of("subscribers", eventBus.subscriberCount())));
    }
  }
}
