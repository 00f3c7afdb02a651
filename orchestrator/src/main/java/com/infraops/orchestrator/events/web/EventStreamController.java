package com.infraops.orchestrator.events.web;

import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.events.EventTopic;
import com.infraops.orchestrator.events.OrchestratorEvent;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/events")
public class EventStreamController {

  private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);

  private final EventBus eventBus;
  private final AtomicLong subscriberSequence = new AtomicLong();

  public EventStreamController(EventBus eventBus) {
    this.eventBus = eventBus;
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@RequestParam(name = "topics", required = false) String topics) {
    Set<EventTopic> requested = EventTopic.parse(topics);
    SseEmitter emitter = new SseEmitter(0L);
    SseEventSubscriber subscriber =
        new SseEventSubscriber("sse_" + subscriberSequence.incrementAndGet(), emitter, requested);

    Runnable detach =
        () -> {
          subscriber.close();
          eventBus.unsubscribe(subscriber);
        };
    emitter.onCompletion(detach);
    emitter.onTimeout(detach);
    emitter.onError(error -> detach.run());

    try {
      emitter.send(
          SseEmitter.event()
              .name("connected")
              .data(
                  OrchestratorEvent.of(
                      null, "connected", Map.of("subscriberId", subscriber.id(), "topics", requested))));
    } catch (IOException ex) {
      log.debug("SSE client {} disconnected before subscription", subscriber.id(), ex);
      emitter.completeWithError(ex);
      return emitter;
    }
    eventBus.subscribe(subscriber);
    return emitter;
  }
}
