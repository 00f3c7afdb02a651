package com.infraops.orchestrator.events;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans events out to live subscribers. Delivery happens on the bus executor, so publishers never
 * wait on a slow or broken connection.
 */
public class EventBus {

  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final Set<EventSubscriber> subscribers = new CopyOnWriteArraySet<>();
  private final Executor deliveryExecutor;

  public EventBus(Executor deliveryExecutor) {
    this.deliveryExecutor = deliveryExecutor;
  }

  public void subscribe(EventSubscriber subscriber) {
    if (subscriber != null && subscribers.add(subscriber)) {
      log.info("Event subscriber {} added ({} active)", subscriber.id(), subscribers.size());
    }
  }

  public void unsubscribe(EventSubscriber subscriber) {
    if (subscriber != null && subscribers.remove(subscriber)) {
      log.info("Event subscriber {} removed ({} active)", subscriber.id(), subscribers.size());
    }
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  public void publish(OrchestratorEvent event) {
    if (event == null || subscribers.isEmpty()) {
      return;
    }
    try {
      deliveryExecutor.execute(() -> deliver(event));
    } catch (RejectedExecutionException ex) {
      log.warn("Dropping event {}: delivery executor rejected it", event.type());
    }
  }

  private void deliver(OrchestratorEvent event) {
    for (EventSubscriber subscriber : subscribers) {
      if (!subscriber.isOpen()) {
        unsubscribe(subscriber);
        continue;
      }
      if (event.topic() != null && !subscriber.accepts(event.topic())) {
        continue;
      }
      try {
        subscriber.deliver(event);
      } catch (Exception ex) {
        log.debug("Delivery of {} to subscriber {} failed", event.type(), subscriber.id(), ex);
        unsubscribe(subscriber);
      }
    }
  }
}
