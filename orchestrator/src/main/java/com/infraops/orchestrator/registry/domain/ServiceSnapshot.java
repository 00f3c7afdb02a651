package com.infraops.orchestrator.registry.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/** Point-in-time view of one service, safe to hand out of the registry. */
public record ServiceSnapshot(
    String id,
    String name,
    ServiceStatus status,
    JsonNode health,
    Instant startTime,
    long uptime,
    Instant lastHealthCheck,
    String error) {}
