package com.infraops.orchestrator.registry.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime state of one registered service. Only the registry mutates it; every accessor is
 * synchronized so snapshots never observe a half-applied health result.
 */
public final class ServiceRecord {

  private final ServiceDescriptor descriptor;
  private final Instant startedAt;
  private final ReentrantLock healthCheckLock = new ReentrantLock();

  private ServiceStatus status = ServiceStatus.DISCOVERING;
  private Instant lastHealthCheckAt;
  private JsonNode lastHealthPayload;
  private String lastError;

  public ServiceRecord(ServiceDescriptor descriptor, Instant startedAt) {
    this.descriptor = descriptor;
    this.startedAt = startedAt;
  }

  public ServiceDescriptor descriptor() {
    return descriptor;
  }

  public String id() {
    return descriptor.id();
  }

  public Instant startedAt() {
    return startedAt;
  }

  /** Serializes health-check retry chains for this service. */
  public ReentrantLock healthCheckLock() {
    return healthCheckLock;
  }

  public synchronized ServiceStatus status() {
    return status;
  }

  public synchronized Instant lastHealthCheckAt() {
    return lastHealthCheckAt;
  }

  public synchronized String lastError() {
    return lastError;
  }

  public synchronized JsonNode lastHealthPayload() {
    return lastHealthPayload;
  }

  public synchronized ServiceStatus markHealthy(JsonNode payload, Instant checkedAt) {
    ServiceStatus previous = status;
    status = ServiceStatus.RUNNING;
    lastHealthPayload = payload;
    lastHealthCheckAt = checkedAt;
    lastError = null;
    return previous;
  }

  public synchronized ServiceStatus markUnreachable(String error, Instant checkedAt) {
    ServiceStatus previous = status;
    status = ServiceStatus.UNREACHABLE;
    lastError = error;
    lastHealthCheckAt = checkedAt;
    return previous;
  }

  public synchronized ServiceStatus markUnavailable() {
    ServiceStatus previous = status;
    status = ServiceStatus.UNAVAILABLE;
    return previous;
  }

  public synchronized boolean needsHealthCheck(Instant now, Duration staleAfter) {
    if (status == ServiceStatus.UNAVAILABLE) {
      return false;
    }
    if (status == ServiceStatus.UNREACHABLE || lastHealthCheckAt == null) {
      return true;
    }
    return Duration.between(lastHealthCheckAt, now).compareTo(staleAfter) > 0;
  }

  public synchronized ServiceSnapshot snapshot(Instant now) {
    return snapshot(now, null);
  }

  public synchronized ServiceSnapshot snapshot(Instant now, String checkError) {
    JsonNode health;
    if (checkError != null) {
      ObjectNode errorNode = JsonNodeFactory.instance.objectNode();
      errorNode.put("error", checkError);
      health = errorNode;
    } else if (lastHealthPayload != null) {
      health = lastHealthPayload.deepCopy();
    } else {
      ObjectNode unknown = JsonNodeFactory.instance.objectNode();
      unknown.put("status", "unknown");
      health = unknown;
    }
    long uptime = startedAt != null ? Math.max(0L, Duration.between(startedAt, now).toMillis()) : 0L;
    return new ServiceSnapshot(
        descriptor.id(),
        descriptor.displayName(),
        status,
        health,
        startedAt,
        uptime,
        lastHealthCheckAt,
        checkError != null ? checkError : lastError);
  }
}
