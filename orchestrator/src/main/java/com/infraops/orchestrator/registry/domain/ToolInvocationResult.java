package com.infraops.orchestrator.registry.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;

public record ToolInvocationResult(
    String serviceId, String tool, Map<String, Object> arguments, JsonNode result, Instant timestamp) {}
