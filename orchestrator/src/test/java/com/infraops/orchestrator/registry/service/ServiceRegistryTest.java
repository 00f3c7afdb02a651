package com.infraops.orchestrator.registry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.events.EventSubscriber;
import com.infraops.orchestrator.events.OrchestratorEvent;
import com.infraops.orchestrator.registry.client.BackendCallException;
import com.infraops.orchestrator.registry.client.BackendServiceClient;
import com.infraops.orchestrator.registry.config.ServiceRegistryProperties;
import com.infraops.orchestrator.registry.domain.HealthSweepSummary;
import com.infraops.orchestrator.registry.domain.ServiceDescriptor;
import com.infraops.orchestrator.registry.domain.ServiceKind;
import com.infraops.orchestrator.registry.domain.ServiceSnapshot;
import com.infraops.orchestrator.registry.domain.ServiceStatus;
import com.infraops.orchestrator.registry.domain.ToolInvocationResult;
import com.infraops.orchestrator.registry.exception.ServiceUnreachableException;
import com.infraops.orchestrator.registry.exception.ToolInvocationException;
import com.infraops.orchestrator.registry.exception.UnknownServiceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.backoff.Sleeper;

@ExtendWith(MockitoExtension.class)
class ServiceRegistryTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  @Mock private BackendServiceClient client;

  private ServiceRegistryProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private List<Duration> sleeps;
  private List<OrchestratorEvent> events;
  private ServiceRegistry registry;

  @BeforeEach
  void setUp() {
    properties = new ServiceRegistryProperties();
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(4);
    sleeps = new CopyOnWriteArrayList<>();
    events = new CopyOnWriteArrayList<>();
    registry = newRegistry(millis -> sleeps.add(Duration.ofMillis(millis)));
  }

  private ServiceRegistry newRegistry(Sleeper sleeper) {
    EventBus eventBus = new EventBus(Runnable::run);
    eventBus.subscribe(new RecordingSubscriber(events));
    ServiceRegistry created =
        new ServiceRegistry(
            client,
            properties,
            eventBus,
            executor,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC),
            sleeper);
    created.register(ServiceDescriptor.of("github", "GitHub MCP Server", "http://github:3000"));
    return created;
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    meterRegistry.close();
  }

  @Test
  void discoverMarksServiceRunningOnHealthyResponse() {
    when(client.fetchHealth(any(), any())).thenReturn(healthy());

    ServiceSnapshot snapshot = registry.discover("github");

    assertThat(snapshot.status()).isEqualTo(ServiceStatus.RUNNING);
    assertThat(snapshot.health().path("status").asText()).isEqualTo("ok");
    assertThat(snapshot.lastHealthCheck()).isEqualTo(NOW);
    assertThat(snapshot.error()).isNull();
    assertThat(registry.isHealthy()).isTrue();
    assertThat(
            meterRegistry
                .counter("registry.health.check", "service", "github", "outcome", "up")
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void discoverRetriesTransientFailuresWithGrowingBackoff() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed: connection refused", true));

    ServiceSnapshot snapshot = registry.discover("github");

    assertThat(snapshot.status()).isEqualTo(ServiceStatus.UNREACHABLE);
    assertThat(snapshot.error()).contains("connection refused");
    verify(client, times(3)).fetchHealth(any(), any());
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    for (int i = 1; i < sleeps.size(); i++) {
      assertThat(sleeps.get(i)).isGreaterThanOrEqualTo(sleeps.get(i - 1));
    }
  }

  @Test
  void retryBudgetFollowsConfiguredRetriesAndBackoff() {
    properties.setHealthRetries(3);
    properties.setRetryBackoff(Duration.ofMillis(500));
    ServiceRegistry tuned = newRegistry(millis -> sleeps.add(Duration.ofMillis(millis)));
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check timeout", true));

    assertThatThrownBy(() -> tuned.checkHealth("github"))
        .isInstanceOf(ServiceUnreachableException.class);

    verify(client, times(4)).fetchHealth(any(), any());
    assertThat(sleeps)
        .containsExactly(Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void interruptedBackoffMarksServiceUnreachable() {
    ServiceRegistry interrupted =
        newRegistry(
            millis -> {
              throw new InterruptedException("shutting down");
            });
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check timeout", true));

    try {
      assertThatThrownBy(() -> interrupted.checkHealth("github"))
          .isInstanceOf(ServiceUnreachableException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    verify(client, times(1)).fetchHealth(any(), any());
    assertThat(interrupted.find("github"))
        .hasValueSatisfying(
            snapshot -> assertThat(snapshot.status()).isEqualTo(ServiceStatus.UNREACHABLE));
  }

  @Test
  void checkHealthSucceedsWhenTransientFailureClears() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check timeout", true))
        .thenReturn(healthy());

    JsonNode payload = registry.checkHealth("github");

    assertThat(payload.path("status").asText()).isEqualTo("ok");
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
  }

  @Test
  void checkHealthSurfacesNonTransientFailureImmediately() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 500", false));

    assertThatThrownBy(() -> registry.checkHealth("github"))
        .isInstanceOf(ServiceUnreachableException.class)
        .satisfies(
            ex -> {
              ServiceUnreachableException unreachable = (ServiceUnreachableException) ex;
              assertThat(unreachable.getServiceId()).isEqualTo("github");
              assertThat(unreachable.getLastStatus()).isEqualTo(ServiceStatus.UNREACHABLE);
              assertThat(unreachable.getLastError()).contains("status 500");
            });
    verify(client, times(1)).fetchHealth(any(), any());
    assertThat(sleeps).isEmpty();
  }

  @Test
  void checkHealthRejectsUnknownService() {
    assertThatThrownBy(() -> registry.checkHealth("nope"))
        .isInstanceOf(UnknownServiceException.class)
        .hasMessage("Unknown service: nope");
  }

  @Test
  void invokeRediscoversUnreachableServiceOnceAndSucceeds() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 503", false))
        .thenReturn(healthy());
    ObjectNode toolResult = JsonNodeFactory.instance.objectNode().put("sha", "abc123");
    when(client.execute(any(), eq("push_files"), anyMap(), any())).thenReturn(toolResult);
    registry.discover("github");

    ToolInvocationResult result =
        registry.invoke("github", "push_files", Map.of("repository", "network-configs"));

    assertThat(result.serviceId()).isEqualTo("github");
    assertThat(result.tool()).isEqualTo("push_files");
    assertThat(result.arguments()).containsEntry("repository", "network-configs");
    assertThat(result.result().path("sha").asText()).isEqualTo("abc123");
    assertThat(result.timestamp()).isEqualTo(NOW);
    verify(client, times(2)).fetchHealth(any(), any());
  }

  @Test
  void invokeFailsAfterSingleRediscovery() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 503", false));
    registry.discover("github");

    assertThatThrownBy(() -> registry.invoke("github", "push_files", Map.of()))
        .isInstanceOf(ServiceUnreachableException.class)
        .hasMessageContaining("status 503");
    verify(client, times(2)).fetchHealth(any(), any());
    verify(client, never()).execute(any(), anyString(), anyMap(), any());
  }

  @Test
  void invokeDiscoversServiceWithoutRecordExactlyOnce() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 404", false));

    assertThatThrownBy(() -> registry.invoke("github", "push_files", Map.of()))
        .isInstanceOf(ServiceUnreachableException.class);
    verify(client, times(1)).fetchHealth(any(), any());
  }

  @Test
  void invokeRejectsUnknownService() {
    assertThatThrownBy(() -> registry.invoke("nope", "anything", Map.of()))
        .isInstanceOf(UnknownServiceException.class);
  }

  @Test
  void invokeGivesLongRunningToolsTheLongerTimeout() {
    registry.register(ServiceDescriptor.of("ansible", "Ansible MCP Server", "http://ansible:5000"));
    when(client.fetchHealth(any(), any())).thenReturn(healthy());
    when(client.execute(any(), anyString(), anyMap(), any()))
        .thenReturn(JsonNodeFactory.instance.objectNode().put("status", "completed"));

    registry.invoke("ansible", "run_playbook", Map.of("playbook_name", "backup-config.yml"));
    registry.invoke("github", "push_files", Map.of());

    verify(client)
        .execute(
            argThat(descriptor -> descriptor.id().equals("ansible")),
            eq("run_playbook"),
            anyMap(),
            eq(Duration.ofSeconds(120)));
    verify(client)
        .execute(
            argThat(descriptor -> descriptor.id().equals("github")),
            eq("push_files"),
            anyMap(),
            eq(Duration.ofSeconds(30)));
  }

  @Test
  void invokeWrapsExecutionFailureWithoutChangingStatus() {
    when(client.fetchHealth(any(), any())).thenReturn(healthy());
    when(client.execute(any(), anyString(), anyMap(), any()))
        .thenThrow(new BackendCallException("Tool execution failed with status 500", false));
    registry.discover("github");

    assertThatThrownBy(() -> registry.invoke("github", "push_files", Map.of()))
        .isInstanceOf(ToolInvocationException.class)
        .satisfies(
            ex -> {
              ToolInvocationException failure = (ToolInvocationException) ex;
              assertThat(failure.getServiceId()).isEqualTo("github");
              assertThat(failure.getTool()).isEqualTo("push_files");
              assertThat(failure.details()).containsEntry("tool", "push_files");
            });
    assertThat(registry.find("github")).get().extracting(ServiceSnapshot::status)
        .isEqualTo(ServiceStatus.RUNNING);
  }

  @Test
  void listAllReturnsEveryServiceWhenOneCheckHangs() {
    properties.setHealthTimeout(Duration.ofMillis(100));
    properties.setRetryBackoff(Duration.ofMillis(10));
    registry.register(ServiceDescriptor.of("slow", "Slow MCP Server", "http://slow:3000"));
    registry.register(ServiceDescriptor.of("broken", "Broken MCP Server", "http://broken:3000"));
    when(client.fetchHealth(argThat(d -> d != null && d.id().equals("github")), any()))
        .thenReturn(healthy());
    when(client.fetchHealth(argThat(d -> d != null && d.id().equals("slow")), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return healthy();
            });
    when(client.fetchHealth(argThat(d -> d != null && d.id().equals("broken")), any()))
        .thenThrow(new BackendCallException("Health check failed with status 500", false));

    List<ServiceSnapshot> snapshots = registry.listAll();

    assertThat(snapshots).extracting(ServiceSnapshot::id).containsExactly("github", "slow", "broken");
    assertThat(snapshots.get(0).status()).isEqualTo(ServiceStatus.RUNNING);
    assertThat(snapshots.get(1).error()).contains("did not complete");
    assertThat(snapshots.get(1).health().path("error").asText()).contains("did not complete");
    assertThat(snapshots.get(2).status()).isEqualTo(ServiceStatus.UNREACHABLE);
    assertThat(snapshots.get(2).error()).contains("status 500");
  }

  @Test
  void listAllReusesFreshResults() {
    when(client.fetchHealth(any(), any())).thenReturn(healthy());
    registry.discover("github");

    List<ServiceSnapshot> snapshots = registry.listAll();

    assertThat(snapshots).singleElement().extracting(ServiceSnapshot::status)
        .isEqualTo(ServiceStatus.RUNNING);
    verify(client, times(1)).fetchHealth(any(), any());
  }

  @Test
  void listToolsSkipsDiscoveryForLanggraphServices() {
    registry.register(
        new ServiceDescriptor("pyats", "pyATS MCP Server", "http://pyats:3002", null, ServiceKind.LANGGRAPH));

    assertThat(registry.listTools("pyats")).isEmpty();
    verify(client, never()).fetchTools(any(), any());
  }

  @Test
  void listToolsReturnsToolArray() {
    when(client.fetchHealth(any(), any())).thenReturn(healthy());
    ObjectNode body = JsonNodeFactory.instance.objectNode();
    body.putArray("tools").addObject().put("name", "push_files");
    when(client.fetchTools(any(), any())).thenReturn(body);
    registry.discover("github");

    List<JsonNode> tools = registry.listTools("github");

    assertThat(tools).singleElement().satisfies(
        tool -> assertThat(tool.path("name").asText()).isEqualTo("push_files"));
  }

  @Test
  void stoppedServicesAreLeftAloneBySweep() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 500", false));
    registry.discover("github");

    ServiceSnapshot stopped = registry.stop("github");
    HealthSweepSummary summary = registry.recoverUnreachable();

    assertThat(stopped.status()).isEqualTo(ServiceStatus.UNAVAILABLE);
    assertThat(summary.recovered()).isEmpty();
    verify(client, times(1)).fetchHealth(any(), any());
  }

  @Test
  void recoverUnreachableRediscoversFailedServices() {
    when(client.fetchHealth(any(), any()))
        .thenThrow(new BackendCallException("Health check failed with status 502", false))
        .thenReturn(healthy());
    registry.discover("github");

    HealthSweepSummary summary = registry.recoverUnreachable();

    assertThat(summary.recovered()).containsExactly("github");
    assertThat(summary.reachable()).isEqualTo(1);
    assertThat(summary.unreachable()).isZero();
    assertThat(registry.snapshots()).singleElement().extracting(ServiceSnapshot::status)
        .isEqualTo(ServiceStatus.RUNNING);
  }

  @Test
  void statusTransitionsArePublished() {
    when(client.fetchHealth(any(), any()))
        .thenReturn(healthy())
        .thenReturn(healthy())
        .thenThrow(new BackendCallException("Health check failed with status 500", false));

    registry.discover("github");
    registry.discover("github");
    registry.discover("github");

    List<OrchestratorEvent> transitions = new ArrayList<>();
    for (OrchestratorEvent event : events) {
      if (event.type().equals("service_status_changed")) {
        transitions.add(event);
      }
    }
    assertThat(transitions).hasSize(2);
    assertThat(transitions.get(0).data())
        .isEqualTo(Map.of("serviceId", "github", "previousStatus", "discovering", "status", "running"));
    @SuppressWarnings("unchecked")
    Map<String, Object> second = (Map<String, Object>) transitions.get(1).data();
    assertThat(second).containsEntry("previousStatus", "running").containsEntry("status", "unreachable");
  }

  @Test
  void resetClearsRecordsButKeepsDescriptors() {
    when(client.fetchHealth(any(), any())).thenReturn(healthy());
    registry.discover("github");

    registry.reset();

    assertThat(registry.snapshots()).isEmpty();
    assertThat(registry.isHealthy()).isFalse();
    assertThat(registry.descriptors()).extracting(ServiceDescriptor::id).containsExactly("github");
  }

  private static JsonNode healthy() {
    return JsonNodeFactory.instance.objectNode().put("status", "ok");
  }

  private record RecordingSubscriber(List<OrchestratorEvent> events) implements EventSubscriber {

    @Override
    public String id() {
      return "recording";
    }

    @Override
    public boolean isOpen() {
      return true;
    }

    @Override
    public void deliver(OrchestratorEvent event) {
      events.add(event);
    }
  }
}
