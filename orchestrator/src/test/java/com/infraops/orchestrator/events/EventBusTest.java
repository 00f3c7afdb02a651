package com.infraops.orchestrator.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;

class EventBusTest {

  @Test
  void deliversToEverySubscriberEvenWhenOneFails() {
    EventBus bus = new EventBus(Runnable::run);
    TestSubscriber healthy = new TestSubscriber("healthy", EnumSet.allOf(EventTopic.class));
    TestSubscriber broken = new TestSubscriber("broken", EnumSet.allOf(EventTopic.class));
    broken.failOnDelivery = true;
    bus.subscribe(broken);
    bus.subscribe(healthy);

    bus.publish(OrchestratorEvent.of(EventTopic.AUTOMATION, "workflow_completed", Map.of()));

    assertThat(healthy.received).extracting(OrchestratorEvent::type).containsExactly("workflow_completed");
    assertThat(bus.subscriberCount()).isEqualTo(1);
  }

  @Test
  void prunesClosedSubscribersWithoutDelivering() {
    EventBus bus = new EventBus(Runnable::run);
    TestSubscriber closed = new TestSubscriber("closed", EnumSet.allOf(EventTopic.class));
    closed.open = false;
    bus.subscribe(closed);

    bus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "health_check_completed", Map.of()));

    assertThat(closed.received).isEmpty();
    assertThat(bus.subscriberCount()).isZero();
  }

  @Test
  void filtersByTopicButBroadcastsUntopicedEvents() {
    EventBus bus = new EventBus(Runnable::run);
    TestSubscriber automationOnly = new TestSubscriber("automation", EnumSet.of(EventTopic.AUTOMATION));
    bus.subscribe(automationOnly);

    bus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "service_status_changed", Map.of()));
    bus.publish(OrchestratorEvent.of(EventTopic.AUTOMATION, "workflow_started", Map.of()));
    bus.publish(OrchestratorEvent.of(null, "heartbeat", Map.of()));

    assertThat(automationOnly.received)
        .extracting(OrchestratorEvent::type)
        .containsExactly("workflow_started", "heartbeat");
  }

  @Test
  void publishDoesNotRunOnCallerThread() {
    List<Runnable> queued = new ArrayList<>();
    Executor deferred = queued::add;
    EventBus bus = new EventBus(deferred);
    TestSubscriber subscriber = new TestSubscriber("deferred", EnumSet.allOf(EventTopic.class));
    bus.subscribe(subscriber);

    bus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "service_status_changed", Map.of()));

    assertThat(subscriber.received).isEmpty();
    queued.forEach(Runnable::run);
    assertThat(subscriber.received).hasSize(1);
  }

  @Test
  void rejectedDeliveryIsDropped() {
    EventBus bus =
        new EventBus(
            task -> {
              throw new RejectedExecutionException("shutting down");
            });
    bus.subscribe(new TestSubscriber("any", EnumSet.allOf(EventTopic.class)));

    bus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "service_status_changed", Map.of()));

    assertThat(bus.subscriberCount()).isEqualTo(1);
  }

  @Test
  void parsesTopicLists() {
    assertThat(EventTopic.parse(null)).containsExactlyInAnyOrder(EventTopic.values());
    assertThat(EventTopic.parse("automation, registry")).containsExactlyInAnyOrder(EventTopic.values());
    assertThat(EventTopic.parse("automation")).containsExactly(EventTopic.AUTOMATION);
    assertThatThrownBy(() -> EventTopic.parse("metrics"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("metrics");
  }

  private static final class TestSubscriber implements EventSubscriber {

    private final String id;
    private final Set<EventTopic> topics;
    private final List<OrchestratorEvent> received = new ArrayList<>();
    private boolean open = true;
    private boolean failOnDelivery;

    private TestSubscriber(String id, Set<EventTopic> topics) {
      this.id = id;
      this.topics = topics;
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
      if (failOnDelivery) {
        throw new IOException("Broken pipe");
      }
      received.add(event);
    }
  }
}
