package com.infraops.orchestrator.events.web;

import com.infraops.orchestrator.events.EventSubscriber;
import com.infraops.orchestrator.events.EventTopic;
import com.infraops.orchestrator.events.OrchestratorEvent;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class SseEventSubscriber implements EventSubscriber {

  private final String id;
  private final SseEmitter emitter;
  private final Set<EventTopic> topics;
  private volatile boolean open = true;

  SseEventSubscriber(String id, SseEmitter emitter, Set<EventTopic> topics) {
    this.id = id;
    this.emitter = emitter;
    this.topics = topics.isEmpty() ? EnumSet.allOf(EventTopic.class) : EnumSet.copyOf(topics);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public boolean accepts(EventTopic topic) {
    return topics.contains(topic);
  }

  @Override
  public void deliver(OrchestratorEvent event) throws IOException {
    try {
      emitter.send(SseEmitter.event().name(event.type()).data(event));
    } catch (IOException | IllegalStateException ex) {
      close();
      throw ex;
    }
  }

  void close() {
    open = false;
  }
}
