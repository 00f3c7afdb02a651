package com.infraops.orchestrator.registry.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

public class ReactorClientHttpConnectorBuilder {

  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration responseTimeout = Duration.ofSeconds(120);
  private int maxConnections = 50;

  public ReactorClientHttpConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  /** Upper bound at connector level; per-call timeouts are applied on top of it. */
  public ReactorClientHttpConnectorBuilder responseTimeout(Duration responseTimeout) {
    if (responseTimeout != null) {
      this.responseTimeout = responseTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder maxConnections(int maxConnections) {
    if (maxConnections > 0) {
      this.maxConnections = maxConnections;
    }
    return this;
  }

  public ClientHttpConnector build() {
    ConnectionProvider provider =
        ConnectionProvider.builder("mcp-backends").maxConnections(maxConnections).build();
    HttpClient client =
        HttpClient.create(provider)
            .responseTimeout(responseTimeout)
            .proxyWithSystemProperties()
            .compress(true)
            .keepAlive(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
