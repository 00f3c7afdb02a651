package com.infraops.orchestrator.workflow.web.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record WorkflowExecutionRequest(@NotBlank String workflow, Map<String, Object> parameters) {}
