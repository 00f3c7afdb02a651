package com.infraops.orchestrator.registry.health;

import com.infraops.orchestrator.registry.domain.ServiceSnapshot;
import com.infraops.orchestrator.registry.domain.ServiceStatus;
import com.infraops.orchestrator.registry.service.ServiceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the registry's last known view without probing backends. The orchestrator is UP while
 * at least one backend is running.
 */
@Component("serviceRegistry")
public class ServiceRegistryHealthIndicator implements HealthIndicator {

  private final ServiceRegistry serviceRegistry;
  private final MeterRegistry meterRegistry;
  private final Map<String, Counter> unreachableCounters = new ConcurrentHashMap<>();

  public ServiceRegistryHealthIndicator(
      ServiceRegistry serviceRegistry, MeterRegistry meterRegistry) {
    this.serviceRegistry = serviceRegistry;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public Health health() {
    try {
      List<ServiceSnapshot> snapshots = serviceRegistry.snapshots();
      Map<String, Object> serverDetails = new LinkedHashMap<>();
      for (ServiceSnapshot snapshot : snapshots) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", snapshot.status().value());
        details.put("lastHealthCheck", snapshot.lastHealthCheck());
        if (snapshot.error() != null) {
          details.put("error", snapshot.error());
        }
        serverDetails.put(snapshot.id(), details);
        if (snapshot.status() == ServiceStatus.UNREACHABLE) {
          recordUnreachable(snapshot.id());
        }
      }

      Health.Builder builder =
          snapshots.isEmpty() || serviceRegistry.isHealthy() ? Health.up() : Health.down();
      builder.withDetail("total", snapshots.size());
      builder.withDetail(
          "running", snapshots.stream().filter(s -> s.status() == ServiceStatus.RUNNING).count());
      builder.withDetail("servers", serverDetails);
      return builder.build();
    } catch (Exception ex) {
      return Health.down(ex).build();
    }
  }

  private void recordUnreachable(String serviceId) {
    unreachableCounters
        .computeIfAbsent(
            serviceId,
            id ->
                Counter.builder("registry.health.unreachable")
                    .tag("service", id)
                    .description("Health reports that found the service unreachable")
                    .register(meterRegistry))
        .increment();
  }
}
