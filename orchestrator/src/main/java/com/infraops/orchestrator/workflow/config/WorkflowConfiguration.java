package com.infraops.orchestrator.workflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.registry.service.ToolInvoker;
import com.infraops.orchestrator.workflow.action.InternalActionRegistry;
import com.infraops.orchestrator.workflow.pipeline.ConfigBackupPipeline;
import com.infraops.orchestrator.workflow.pipeline.WorkflowPipeline;
import com.infraops.orchestrator.workflow.service.StepConditions;
import com.infraops.orchestrator.workflow.service.WorkflowCatalog;
import com.infraops.orchestrator.workflow.service.WorkflowEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowConfiguration {

  @Bean
  public WorkflowCatalog workflowCatalog() {
    return WorkflowCatalog.withBuiltIns();
  }

  @Bean
  public InternalActionRegistry internalActionRegistry() {
    return InternalActionRegistry.withBuiltIns();
  }

  @Bean
  public StepConditions stepConditions(WorkflowProperties properties) {
    return new StepConditions(properties.isStrictConditions());
  }

  @Bean
  public ConfigBackupPipeline configBackupPipeline(
      ToolInvoker toolInvoker, WorkflowProperties properties, Clock clock) {
    return new ConfigBackupPipeline(toolInvoker, properties.getConfigBackup(), clock);
  }

  @Bean
  public WorkflowEngine workflowEngine(
      WorkflowCatalog workflowCatalog,
      List<WorkflowPipeline> pipelines,
      InternalActionRegistry internalActionRegistry,
      StepConditions stepConditions,
      ToolInvoker toolInvoker,
      EventBus eventBus,
      MeterRegistry meterRegistry,
      Clock clock,
      WorkflowProperties properties,
      ObjectMapper objectMapper) {
    return new WorkflowEngine(
        workflowCatalog,
        pipelines,
        internalActionRegistry,
        stepConditions,
        toolInvoker,
        eventBus,
        meterRegistry,
        clock,
        properties,
        objectMapper);
  }
}
