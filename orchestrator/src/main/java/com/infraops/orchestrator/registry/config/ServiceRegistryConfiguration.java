package com.infraops.orchestrator.registry.config;

import com.infraops.orchestrator.events.EventBus;
import com.infraops.orchestrator.registry.client.BackendServiceClient;
import com.infraops.orchestrator.registry.client.WebClientBackendServiceClient;
import com.infraops.orchestrator.registry.service.ServiceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(ServiceRegistryProperties.class)
public class ServiceRegistryConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "backendWebClient")
  public WebClient backendWebClient(
      WebClient.Builder builder, ServiceRegistryProperties properties) {
    return builder
        .clientConnector(
            new ReactorClientHttpConnectorBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .responseTimeout(properties.getLongRunningTimeout())
                .build())
        .build();
  }

  @Bean
  public BackendServiceClient backendServiceClient(
      @Qualifier("backendWebClient") WebClient backendWebClient) {
    return new WebClientBackendServiceClient(backendWebClient);
  }

  @Bean(name = "registryExecutor", destroyMethod = "shutdown")
  public ExecutorService registryExecutor(ServiceRegistryProperties properties) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("registry-check-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newFixedThreadPool(properties.getMaxConcurrentChecks(), threadFactory);
  }

  @Bean
  public ServiceRegistry serviceRegistry(
      BackendServiceClient backendServiceClient,
      ServiceRegistryProperties properties,
      EventBus eventBus,
      @Qualifier("registryExecutor") ExecutorService registryExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    ServiceRegistry registry =
        new ServiceRegistry(
            backendServiceClient,
            properties,
            eventBus,
            registryExecutor,
            meterRegistry,
            clock,
            new ThreadWaitSleeper());
    properties.toDescriptors().forEach(registry::register);
    return registry;
  }
}
