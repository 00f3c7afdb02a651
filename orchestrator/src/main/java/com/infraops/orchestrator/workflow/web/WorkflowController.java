package com.infraops.orchestrator.workflow.web;

import com.infraops.orchestrator.workflow.domain.WorkflowExecution;
import com.infraops.orchestrator.workflow.domain.WorkflowSummary;
import com.infraops.orchestrator.workflow.service.WorkflowEngine;
import com.infraops.orchestrator.workflow.web.dto.WorkflowExecutionRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/automation")
public class WorkflowController {

  private final WorkflowEngine workflowEngine;

  public WorkflowController(WorkflowEngine workflowEngine) {
    this.workflowEngine = workflowEngine;
  }

  @GetMapping("/workflows")
  public List<WorkflowSummary> workflows() {
    return workflowEngine.listWorkflows();
  }

  @PostMapping("/workflow")
  public WorkflowExecution execute(@Valid @RequestBody WorkflowExecutionRequest request) {
    Map<String, Object> parameters =
        request.parameters() != null ? request.parameters() : Map.of();
    return workflowEngine.execute(request.workflow(), parameters);
  }

  @GetMapping("/executions")
  public List<WorkflowExecution> history(
      @RequestParam(name = "limit", required = false) Integer limit) {
    return workflowEngine.getHistory(limit);
  }

  @GetMapping("/executions/{executionId}")
  public WorkflowExecution execution(@PathVariable String executionId) {
    return workflowEngine
        .getExecution(executionId)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Execution " + executionId + " not found"));
  }
}
