package com.infraops.orchestrator.workflow.domain;

import java.time.Instant;

public record StepResult(
    String id, String name, StepStatus status, Object result, Instant timestamp) {}
