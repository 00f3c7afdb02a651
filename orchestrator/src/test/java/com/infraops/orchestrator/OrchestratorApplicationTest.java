package com.infraops.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import com.infraops.orchestrator.registry.service.ServiceRegistry;
import com.infraops.orchestrator.workflow.domain.WorkflowSummary;
import com.infraops.orchestrator.workflow.service.WorkflowEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "app.registry.discover-on-startup=false",
      "app.maintenance.health-sweep-delay=PT1H"
    })
class OrchestratorApplicationTest {

  @Autowired private ServiceRegistry serviceRegistry;

  @Autowired private WorkflowEngine workflowEngine;

  @Test
  void contextLoadsWithConfiguredBackends() {
    assertThat(serviceRegistry.descriptors()).hasSize(15);
    assertThat(serviceRegistry.snapshots()).isEmpty();
    assertThat(workflowEngine.listWorkflows())
        .extracting(WorkflowSummary::id)
        .containsExactly(
            "network_issue_resolution", "config_backup", "update_documentation", "config_snapshot");
  }
}
