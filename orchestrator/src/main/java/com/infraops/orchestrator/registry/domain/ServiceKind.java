package com.infraops.orchestrator.registry.domain;

public enum ServiceKind {
  /** Exposes the generic {@code /health}, {@code /tools} and {@code /execute} endpoints. */
  GENERIC,
  /**
   * Agent-graph backend driven through its own thread/run protocol. It has no {@code /tools}
   * catalog, so generic tool discovery is skipped.
   */
  LANGGRAPH;

  public boolean supportsToolDiscovery() {
    return this == GENERIC;
  }
}
