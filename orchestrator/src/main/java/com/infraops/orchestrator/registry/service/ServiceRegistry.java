package com.infraops.orchestrator.registry.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.events.EventTopic;
import com.infraops.orchestrator.events.OrchestratorEvent;
import com.infraops.orchestrator.registry.client.BackendCallException;
import com.infraops.orchestrator.registry.client.BackendServiceClient;
import com.infraops.orchestrator.registry.config.ServiceRegistryProperties;
import com.infraops.orchestrator.registry.domain.HealthSweepSummary;
import com.infraops.orchestrator.registry.domain.ServiceDescriptor;
import com.infraops.orchestrator.registry.domain.ServiceRecord;
import com.infraops.orchestrator.registry.domain.ServiceSnapshot;
import com.infraops.orchestrator.registry.domain.ServiceStatus;
import com.infraops.orchestrator.registry.domain.ToolInvocationResult;
import com.infraops.orchestrator.registry.exception.ServiceUnreachableException;
import com.infraops.orchestrator.registry.exception.ToolInvocationException;
import com.infraops.orchestrator.registry.exception.UnknownServiceException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;

/**
 * Authoritative runtime view of the configured backend services and the fault-tolerant proxy
 * used to call their tools.
 *
 * <p>Health-check failures are recorded on the service record rather than thrown, except where a
 * caller has to react ({@link #checkHealth}, {@link #invoke}). Every invocation gives an
 * unreachable service one more discovery before failing, and {@link #recoverUnreachable()} is
 * driven periodically by the maintenance scheduler.
 */
public class ServiceRegistry implements ToolInvoker {

  private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

  private final BackendServiceClient client;
  private final ServiceRegistryProperties properties;
  private final EventBus eventBus;
  private final Executor checkExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final RetryTemplate healthCheckRetryTemplate;

  private final Map<String, ServiceDescriptor> descriptors =
      Collections.synchronizedMap(new LinkedHashMap<>());
  private final Map<String, ServiceRecord> records = new ConcurrentHashMap<>();

  public ServiceRegistry(
      BackendServiceClient client,
      ServiceRegistryProperties properties,
      EventBus eventBus,
      Executor checkExecutor,
      MeterRegistry meterRegistry,
      Clock clock,
      Sleeper backOffSleeper) {
    this.client = client;
    this.properties = properties;
    this.eventBus = eventBus;
    this.checkExecutor = checkExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.healthCheckRetryTemplate = buildHealthCheckRetryTemplate(backOffSleeper);
  }

  /** Adds or replaces a descriptor. Replacing drops the runtime record of the old descriptor. */
  public void register(ServiceDescriptor descriptor) {
    ServiceDescriptor previous = descriptors.put(descriptor.id(), descriptor);
    if (previous != null && !previous.equals(descriptor)) {
      records.remove(descriptor.id());
      log.info("Service {} re-registered at {}", descriptor.id(), descriptor.baseUrl());
    } else if (previous == null) {
      log.debug("Service {} registered at {}", descriptor.id(), descriptor.baseUrl());
    }
  }

  public List<ServiceDescriptor> descriptors() {
    synchronized (descriptors) {
      return List.copyOf(descriptors.values());
    }
  }

  public Optional<ServiceSnapshot> find(String serviceId) {
    ServiceRecord record = records.get(serviceId);
    return record != null ? Optional.of(record.snapshot(clock.instant())) : Optional.empty();
  }

  /**
   * Probes the health endpoint once (including transient retries) and records the outcome. Only
   * an unknown service id is reported as an exception.
   */
  public ServiceSnapshot discover(String serviceId) {
    ServiceRecord record = obtainRecord(serviceId);
    log.info("Discovering {} server at {}", serviceId, record.descriptor().baseUrl());
    try {
      runHealthCheck(record);
      log.info("Server {} discovered and healthy", serviceId);
    } catch (ServiceUnreachableException ex) {
      log.warn("Server {} is unreachable: {}", serviceId, ex.getLastError());
    }
    return record.snapshot(clock.instant());
  }

  /** Backends are deployed independently, so starting one amounts to discovering it again. */
  public ServiceSnapshot start(String serviceId) {
    return discover(serviceId);
  }

  /** Takes a service out of rotation until it is started again. */
  public ServiceSnapshot stop(String serviceId) {
    ServiceRecord record = obtainRecord(serviceId);
    ServiceStatus previous = record.markUnavailable();
    log.info("Server {} marked as unavailable", serviceId);
    onTransition(record, previous);
    return record.snapshot(clock.instant());
  }

  /**
   * Issues the health request, retrying transient failures with exponential backoff.
   *
   * @throws UnknownServiceException if the id has no descriptor
   * @throws ServiceUnreachableException once the retry budget is exhausted or on a non-transient
   *     failure
   */
  public JsonNode checkHealth(String serviceId) {
    return runHealthCheck(obtainRecord(serviceId));
  }

  public List<JsonNode> listTools(String serviceId) {
    ServiceDescriptor descriptor = requireDescriptor(serviceId);
    if (!descriptor.kind().supportsToolDiscovery()) {
      log.info("Skipping tool discovery for {} server {}", descriptor.kind(), serviceId);
      return List.of();
    }
    ServiceRecord record = records.get(serviceId);
    if (record == null || record.status() != ServiceStatus.RUNNING) {
      throw new ServiceUnreachableException(
          serviceId,
          record != null ? record.status() : null,
          record != null ? record.lastError() : "Service has not been discovered",
          null);
    }
    JsonNode body;
    try {
      body = client.fetchTools(descriptor, properties.getToolsTimeout());
    } catch (RuntimeException ex) {
      log.error("Failed to get tools from {}: {}", serviceId, ex.getMessage());
      throw new ToolInvocationException(serviceId, "tools", ex.getMessage(), ex);
    }
    JsonNode tools = body != null ? body.path("tools") : null;
    if (tools == null || !tools.isArray()) {
      return List.of();
    }
    List<JsonNode> result = new ArrayList<>();
    tools.forEach(result::add);
    log.info("Retrieved {} tools from {}", result.size(), serviceId);
    return result;
  }

  @Override
  public ToolInvocationResult invoke(
      String serviceId, String toolName, Map<String, Object> arguments) {
    if (!StringUtils.hasText(toolName)) {
      throw new IllegalArgumentException("Tool name must be provided");
    }
    ServiceRecord record = records.get(serviceId);
    boolean freshlyDiscovered = false;
    if (record == null) {
      log.info("Server {} not found, attempting discovery", serviceId);
      discover(serviceId);
      record = records.get(serviceId);
      freshlyDiscovered = true;
    }
    if (record != null && record.status() != ServiceStatus.RUNNING && !freshlyDiscovered) {
      log.warn("Server {} status is {}, attempting re-discovery", serviceId, record.status().value());
      discover(serviceId);
      record = records.get(serviceId);
    }
    if (record == null || record.status() != ServiceStatus.RUNNING) {
      throw new ServiceUnreachableException(
          serviceId,
          record != null ? record.status() : null,
          record != null ? record.lastError() : null,
          null);
    }

    Map<String, Object> effectiveArguments = arguments != null ? arguments : Map.of();
    Duration timeout = invocationTimeout(serviceId, toolName);
    log.info("Executing tool {} on server {} (timeout {}s)", toolName, serviceId, timeout.toSeconds());
    long started = System.nanoTime();
    String outcome = "error";
    try {
      JsonNode result = client.execute(record.descriptor(), toolName, effectiveArguments, timeout);
      outcome = "success";
      log.debug("Tool {} executed successfully on {}", toolName, serviceId);
      return new ToolInvocationResult(
          serviceId, toolName, effectiveArguments, result, clock.instant());
    } catch (RuntimeException ex) {
      log.error("Tool execution failed for {} on {}: {}", toolName, serviceId, ex.getMessage());
      throw new ToolInvocationException(serviceId, toolName, ex.getMessage(), ex);
    } finally {
      meterRegistry
          .timer("registry.tool.invocation", "service", serviceId, "tool", toolName, "outcome", outcome)
          .record(Duration.ofNanos(System.nanoTime() - started));
    }
  }

  /**
   * Snapshot of every registered service. Stale and unreachable records are re-checked
   * concurrently; a failing or hanging check only affects its own entry.
   */
  public List<ServiceSnapshot> listAll() {
    Instant now = clock.instant();
    List<CompletableFuture<ServiceSnapshot>> futures = new ArrayList<>();
    for (ServiceDescriptor descriptor : descriptors()) {
      ServiceRecord record = records.computeIfAbsent(descriptor.id(), id -> newRecord(descriptor));
      if (record.needsHealthCheck(now, properties.getStaleAfter())) {
        futures.add(scheduleListingCheck(record));
      } else {
        futures.add(CompletableFuture.completedFuture(record.snapshot(now)));
      }
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    List<ServiceSnapshot> snapshots = futures.stream().map(CompletableFuture::join).toList();
    publishHealthSummary(summarize(snapshots, List.of()));
    return snapshots;
  }

  /** Current view without any I/O. */
  public List<ServiceSnapshot> snapshots() {
    Instant now = clock.instant();
    List<ServiceSnapshot> snapshots = new ArrayList<>();
    for (ServiceDescriptor descriptor : descriptors()) {
      ServiceRecord record = records.get(descriptor.id());
      if (record != null) {
        snapshots.add(record.snapshot(now));
      }
    }
    return snapshots;
  }

  /** Initial discovery of every registered service, run concurrently. */
  public List<ServiceSnapshot> discoverAll() {
    List<ServiceDescriptor> all = descriptors();
    log.info("Discovering {} configured MCP servers", all.size());
    List<CompletableFuture<ServiceSnapshot>> futures = new ArrayList<>();
    for (ServiceDescriptor descriptor : all) {
      ServiceRecord record = records.computeIfAbsent(descriptor.id(), id -> newRecord(descriptor));
      futures.add(scheduleListingCheck(record));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    List<ServiceSnapshot> snapshots = futures.stream().map(CompletableFuture::join).toList();
    publishHealthSummary(summarize(snapshots, List.of()));
    return snapshots;
  }

  /** Re-discovers every unreachable service. Driven by the maintenance scheduler. */
  public HealthSweepSummary recoverUnreachable() {
    List<String> unreachable =
        records.values().stream()
            .filter(record -> record.status() == ServiceStatus.UNREACHABLE)
            .map(ServiceRecord::id)
            .toList();
    List<String> recovered = new ArrayList<>();
    if (!unreachable.isEmpty()) {
      log.info("Attempting to recover {} unreachable server(s)", unreachable.size());
    }
    for (String serviceId : unreachable) {
      try {
        ServiceSnapshot snapshot = discover(serviceId);
        if (snapshot.status() == ServiceStatus.RUNNING) {
          recovered.add(serviceId);
          log.info("Successfully recovered server: {}", serviceId);
        }
      } catch (UnknownServiceException ex) {
        records.remove(serviceId);
        log.warn("Dropping record of deregistered server {}", serviceId);
      }
    }
    HealthSweepSummary summary = summarize(snapshots(), recovered);
    publishHealthSummary(summary);
    return summary;
  }

  public boolean isHealthy() {
    return records.values().stream().anyMatch(record -> record.status() == ServiceStatus.RUNNING);
  }

  /** Clears all runtime records. Descriptors stay registered. */
  public void reset() {
    records.clear();
    log.info("MCP service registry cleared");
  }

  private CompletableFuture<ServiceSnapshot> scheduleListingCheck(ServiceRecord record) {
    try {
      return CompletableFuture.supplyAsync(() -> checkForListing(record), checkExecutor)
          .orTimeout(listingCheckBudget().toMillis(), TimeUnit.MILLISECONDS)
          .exceptionally(ex -> record.snapshot(clock.instant(), describeListingFailure(ex)));
    } catch (RejectedExecutionException ex) {
      log.warn("Health check for {} rejected: {}", record.id(), ex.getMessage());
      return CompletableFuture.completedFuture(
          record.snapshot(clock.instant(), "Health check could not be scheduled"));
    }
  }

  private ServiceSnapshot checkForListing(ServiceRecord record) {
    try {
      runHealthCheck(record);
      return record.snapshot(clock.instant());
    } catch (ServiceUnreachableException ex) {
      return record.snapshot(clock.instant(), ex.getLastError());
    }
  }

  private JsonNode runHealthCheck(ServiceRecord record) {
    ServiceDescriptor descriptor = record.descriptor();
    String serviceId = descriptor.id();
    int maxAttempts = properties.getHealthRetries() + 1;
    ReentrantLock lock = record.healthCheckLock();
    lock.lock();
    try {
      JsonNode payload =
          healthCheckRetryTemplate.execute(
              context -> {
                int attempt = context.getRetryCount() + 1;
                if (attempt == 1) {
                  log.info("Checking health: {}", descriptor.healthUrl());
                } else {
                  log.info(
                      "Retrying health check (attempt {}/{}): {}",
                      attempt,
                      maxAttempts,
                      descriptor.healthUrl());
                }
                try {
                  return client.fetchHealth(descriptor, properties.getHealthTimeout());
                } catch (BackendCallException ex) {
                  log.warn(
                      "Health check attempt {} failed for {}: {}",
                      attempt,
                      serviceId,
                      ex.getMessage());
                  throw ex;
                } catch (RuntimeException ex) {
                  throw new BackendCallException(ex.getMessage(), false, ex);
                }
              });
      ServiceStatus previous = record.markHealthy(payload, clock.instant());
      meterRegistry.counter("registry.health.check", "service", serviceId, "outcome", "up").increment();
      onTransition(record, previous);
      log.info("Health check successful for {}", serviceId);
      return payload;
    } catch (BackendCallException | BackOffInterruptedException ex) {
      String error = "Health check failed: " + ex.getMessage();
      ServiceStatus previous = record.markUnreachable(error, clock.instant());
      meterRegistry.counter("registry.health.check", "service", serviceId, "outcome", "down").increment();
      onTransition(record, previous);
      log.error("Health check failed for {}: {}", serviceId, ex.getMessage());
      throw new ServiceUnreachableException(serviceId, ServiceStatus.UNREACHABLE, error, ex);
    } finally {
      lock.unlock();
    }
  }

  private RetryTemplate buildHealthCheckRetryTemplate(Sleeper sleeper) {
    int attempts = properties.getHealthRetries() + 1;
    ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
    backOffPolicy.setInitialInterval(Math.max(1L, properties.getRetryBackoff().toMillis()));
    backOffPolicy.setMultiplier(2.0);
    backOffPolicy.setMaxInterval(Math.max(1L, backoffFor(Math.max(1, attempts - 1)).toMillis()));
    backOffPolicy.setSleeper(sleeper);
    return RetryTemplate.builder()
        .maxAttempts(attempts)
        .customBackoff(backOffPolicy)
        .retryOn(
            throwable ->
                throwable instanceof BackendCallException backendCallException
                    && backendCallException.isTransientFailure())
        .build();
  }

  Duration backoffFor(int failedAttempt) {
    long factor = 1L << Math.min(failedAttempt - 1, 16);
    return properties.getRetryBackoff().multipliedBy(factor);
  }

  private Duration listingCheckBudget() {
    int attempts = properties.getHealthRetries() + 1;
    Duration budget = properties.getHealthTimeout().multipliedBy(attempts + 1L);
    for (int attempt = 1; attempt < attempts; attempt++) {
      budget = budget.plus(backoffFor(attempt));
    }
    return budget;
  }

  private Duration invocationTimeout(String serviceId, String toolName) {
    return properties.getLongRunningTools().contains(serviceId + ":" + toolName)
        ? properties.getLongRunningTimeout()
        : properties.getExecuteTimeout();
  }

  private ServiceRecord obtainRecord(String serviceId) {
    ServiceDescriptor descriptor = requireDescriptor(serviceId);
    return records.computeIfAbsent(serviceId, id -> newRecord(descriptor));
  }

  private ServiceDescriptor requireDescriptor(String serviceId) {
    ServiceDescriptor descriptor = serviceId != null ? descriptors.get(serviceId) : null;
    if (descriptor == null) {
      throw new UnknownServiceException(serviceId);
    }
    return descriptor;
  }

  private ServiceRecord newRecord(ServiceDescriptor descriptor) {
    return new ServiceRecord(descriptor, clock.instant());
  }

  private void onTransition(ServiceRecord record, ServiceStatus previous) {
    ServiceStatus current = record.status();
    if (previous == current) {
      return;
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("serviceId", record.id());
    data.put("previousStatus", previous.value());
    data.put("status", current.value());
    if (record.lastError() != null) {
      data.put("error", record.lastError());
    }
    eventBus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "service_status_changed", data));
  }

  private HealthSweepSummary summarize(List<ServiceSnapshot> snapshots, List<String> recovered) {
    int reachable =
        (int) snapshots.stream().filter(s -> s.status() == ServiceStatus.RUNNING).count();
    int unreachable =
        (int) snapshots.stream().filter(s -> s.status() == ServiceStatus.UNREACHABLE).count();
    return new HealthSweepSummary(snapshots.size(), reachable, unreachable, List.copyOf(recovered));
  }

  private void publishHealthSummary(HealthSweepSummary summary) {
    eventBus.publish(OrchestratorEvent.of(EventTopic.REGISTRY, "health_check_completed", summary));
  }

  private String describeListingFailure(Throwable ex) {
    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    if (cause instanceof TimeoutException) {
      return "Health check did not complete within " + listingCheckBudget().toMillis() + " ms";
    }
    return "Health check failed: " + cause.getMessage();
  }
}
