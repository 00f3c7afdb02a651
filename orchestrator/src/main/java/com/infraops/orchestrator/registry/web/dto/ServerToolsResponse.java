package com.infraops.orchestrator.registry.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record ServerToolsResponse(String serverId, List<JsonNode> tools) {}
