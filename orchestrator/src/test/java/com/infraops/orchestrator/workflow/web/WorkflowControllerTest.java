package com.infraops.orchestrator.workflow.web;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.infraops.orchestrator.workflow.domain.ExecutionResult;
import com.infraops.orchestrator.workflow.domain.StepResult;
import com.infraops.orchestrator.workflow.domain.StepStatus;
import com.infraops.orchestrator.workflow.domain.WorkflowExecution;
import com.infraops.orchestrator.workflow.domain.WorkflowSummary;
import com.infraops.orchestrator.workflow.exception.UnknownWorkflowException;
import com.infraops.orchestrator.workflow.service.WorkflowEngine;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockBean private WorkflowEngine workflowEngine;

  @Test
  void listsWorkflows() throws Exception {
    given(workflowEngine.listWorkflows())
        .willReturn(List.of(new WorkflowSummary("config_backup", "Config Backup", "Back up", 4)));

    mockMvc
        .perform(get("/api/automation/workflows"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id", equalTo("config_backup")))
        .andExpect(jsonPath("$[0].steps", equalTo(4)));
  }

  @Test
  void executesWorkflowWithEmptyParametersByDefault() throws Exception {
    given(workflowEngine.execute("config_backup", Map.of())).willReturn(completedExecution());

    mockMvc
        .perform(
            post("/api/automation/workflow")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow\":\"config_backup\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id", equalTo("exec_7")))
        .andExpect(jsonPath("$.status", equalTo("completed")))
        .andExpect(jsonPath("$.steps[0].status", equalTo("completed")))
        .andExpect(jsonPath("$.result.success", equalTo(true)))
        .andExpect(jsonPath("$.result.files[0]", equalTo("router-01.cfg")));
  }

  @Test
  void unknownWorkflowIsNotFound() throws Exception {
    given(workflowEngine.execute("nope", Map.of())).willThrow(new UnknownWorkflowException("nope"));

    mockMvc
        .perform(
            post("/api/automation/workflow")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow\":\"nope\",\"parameters\":{}}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail", equalTo("Workflow nope not found")));
  }

  @Test
  void missingBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(post("/api/automation/workflow").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title", equalTo("Invalid request")));
  }

  @Test
  void returnsHistoryWithLimit() throws Exception {
    given(workflowEngine.getHistory(1)).willReturn(List.of(completedExecution()));

    mockMvc
        .perform(get("/api/automation/executions").param("limit", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].workflowId", equalTo("config_backup")));
  }

  @Test
  void unknownExecutionIsNotFound() throws Exception {
    given(workflowEngine.getExecution("exec_99")).willReturn(Optional.empty());

    mockMvc
        .perform(get("/api/automation/executions/exec_99"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail", equalTo("Execution exec_99 not found")));
  }

  private static WorkflowExecution completedExecution() {
    WorkflowExecution execution = new WorkflowExecution(7L, "config_backup", Map.of(), NOW);
    execution.appendStep(
        new StepResult(
            "ansible_backup", "Run Ansible backup-config", StepStatus.COMPLETED, Map.of(), NOW));
    execution.complete(
        ExecutionResult.success("Backed up 1 device config(s) to fileserver and repo")
            .with("files", List.of("router-01.cfg")),
        NOW.plusSeconds(5));
    return execution;
  }
}
