package com.infraops.orchestrator.registry.web.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record ToolExecutionRequest(
    @NotBlank String server, @NotBlank String tool, Map<String, Object> arguments) {}
