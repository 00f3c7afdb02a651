package com.infraops.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Envelope delivered to subscribers as {@code {type, data, timestamp}}. A {@code null} topic
 * reaches every subscriber regardless of its filter.
 */
public record OrchestratorEvent(
    String type, @JsonIgnore EventTopic topic, Object data, Instant timestamp) {

  public static OrchestratorEvent of(EventTopic topic, String type, Object data) {
    return new OrchestratorEvent(type, topic, data, Instant.now());
  }
}
