package com.infraops.orchestrator.events;

import java.io.IOException;

public interface EventSubscriber {

  String id();

  /** {@code false} once the underlying connection is gone; the bus prunes such subscribers. */
  boolean isOpen();

  default boolean accepts(EventTopic topic) {
    return true;
  }

  void deliver(OrchestratorEvent event) throws IOException;
}
