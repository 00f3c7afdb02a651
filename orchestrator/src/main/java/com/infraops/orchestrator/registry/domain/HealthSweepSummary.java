package com.infraops.orchestrator.registry.domain;

import java.util.List;

public record HealthSweepSummary(int total, int reachable, int unreachable, List<String> recovered) {

  public static HealthSweepSummary empty() {
    return new HealthSweepSummary(0, 0, 0, List.of());
  }
}
