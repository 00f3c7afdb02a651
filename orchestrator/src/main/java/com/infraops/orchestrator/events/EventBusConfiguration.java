package com.infraops.orchestrator.events;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EventBusConfiguration {

  @Bean(name = "eventBusExecutor", destroyMethod = "shutdown")
  public ExecutorService eventBusExecutor() {
    return Executors.newSingleThreadExecutor(
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("event-bus");
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public EventBus eventBus(@Qualifier("eventBusExecutor") ExecutorService eventBusExecutor) {
    return new EventBus(eventBusExecutor);
  }
}
