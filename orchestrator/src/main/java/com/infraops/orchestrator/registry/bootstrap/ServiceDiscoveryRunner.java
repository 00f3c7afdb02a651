package com.infraops.orchestrator.registry.bootstrap;

import com.infraops.orchestrator.registry.config.ServiceRegistryProperties;
import com.infraops.orchestrator.registry.domain.ServiceSnapshot;
import com.infraops.orchestrator.registry.domain.ServiceStatus;
import com.infraops.orchestrator.registry.service.ServiceRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Discovers the configured backends once the context is up. */
@Component
public class ServiceDiscoveryRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ServiceDiscoveryRunner.class);

  private final ServiceRegistry serviceRegistry;
  private final ServiceRegistryProperties properties;

  public ServiceDiscoveryRunner(
      ServiceRegistry serviceRegistry, ServiceRegistryProperties properties) {
    this.serviceRegistry = serviceRegistry;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.isDiscoverOnStartup()) {
      log.info("Startup discovery disabled; backends will be discovered on first use");
      return;
    }
    List<ServiceSnapshot> snapshots = serviceRegistry.discoverAll();
    long running = snapshots.stream().filter(s -> s.status() == ServiceStatus.RUNNING).count();
    log.info("Startup discovery finished: {}/{} servers running", running, snapshots.size());
  }
}
