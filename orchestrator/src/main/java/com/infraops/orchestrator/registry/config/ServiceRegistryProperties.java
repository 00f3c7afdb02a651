package com.infraops.orchestrator.registry.config;

import com.infraops.orchestrator.registry.domain.ServiceDescriptor;
import com.infraops.orchestrator.registry.domain.ServiceKind;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.registry")
public class ServiceRegistryProperties {

  private final Map<String, ServiceProperties> services = new LinkedHashMap<>();

  private boolean discoverOnStartup = true;
  private Duration healthTimeout = Duration.ofSeconds(10);
  private Duration toolsTimeout = Duration.ofSeconds(10);

  @Min(0)
  private int healthRetries = 2;

  private Duration retryBackoff = Duration.ofSeconds(2);
  private Duration staleAfter = Duration.ofSeconds(30);
  private Duration executeTimeout = Duration.ofSeconds(30);
  private Duration longRunningTimeout = Duration.ofSeconds(120);

  /** Tools given the long-running timeout, as {@code serviceId:toolName}. */
  private Set<String> longRunningTools = new LinkedHashSet<>(List.of("ansible:run_playbook"));

  private Duration connectTimeout = Duration.ofSeconds(10);

  @Min(1)
  private int maxConcurrentChecks = 8;

  public Map<String, ServiceProperties> getServices() {
    return services;
  }

  public List<ServiceDescriptor> toDescriptors() {
    List<ServiceDescriptor> descriptors = new ArrayList<>();
    services.forEach(
        (id, props) ->
            descriptors.add(
                new ServiceDescriptor(
                    id, props.getDisplayName(), props.getUrl(), props.getHealthPath(), props.getKind())));
    return descriptors;
  }

  public boolean isDiscoverOnStartup() {
    return discoverOnStartup;
  }

  public void setDiscoverOnStartup(boolean discoverOnStartup) {
    this.discoverOnStartup = discoverOnStartup;
  }

  public Duration getHealthTimeout() {
    return healthTimeout;
  }

  public void setHealthTimeout(Duration healthTimeout) {
    if (isPositive(healthTimeout)) {
      this.healthTimeout = healthTimeout;
    }
  }

  public Duration getToolsTimeout() {
    return toolsTimeout;
  }

  public void setToolsTimeout(Duration toolsTimeout) {
    if (isPositive(toolsTimeout)) {
      this.toolsTimeout = toolsTimeout;
    }
  }

  public int getHealthRetries() {
    return Math.max(0, healthRetries);
  }

  public void setHealthRetries(int healthRetries) {
    this.healthRetries = Math.max(0, healthRetries);
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    if (retryBackoff != null && !retryBackoff.isNegative()) {
      this.retryBackoff = retryBackoff;
    }
  }

  public Duration getStaleAfter() {
    return staleAfter;
  }

  public void setStaleAfter(Duration staleAfter) {
    if (staleAfter != null && !staleAfter.isNegative()) {
      this.staleAfter = staleAfter;
    }
  }

  public Duration getExecuteTimeout() {
    return executeTimeout;
  }

  public void setExecuteTimeout(Duration executeTimeout) {
    if (isPositive(executeTimeout)) {
      this.executeTimeout = executeTimeout;
    }
  }

  public Duration getLongRunningTimeout() {
    return longRunningTimeout;
  }

  public void setLongRunningTimeout(Duration longRunningTimeout) {
    if (isPositive(longRunningTimeout)) {
      this.longRunningTimeout = longRunningTimeout;
    }
  }

  public Set<String> getLongRunningTools() {
    return longRunningTools;
  }

  public void setLongRunningTools(Set<String> longRunningTools) {
    this.longRunningTools =
        longRunningTools != null ? new LinkedHashSet<>(longRunningTools) : new LinkedHashSet<>();
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    if (isPositive(connectTimeout)) {
      this.connectTimeout = connectTimeout;
    }
  }

  public int getMaxConcurrentChecks() {
    return Math.max(1, maxConcurrentChecks);
  }

  public void setMaxConcurrentChecks(int maxConcurrentChecks) {
    this.maxConcurrentChecks = Math.max(1, maxConcurrentChecks);
  }

  private static boolean isPositive(Duration value) {
    return value != null && !value.isNegative() && !value.isZero();
  }

  public static class ServiceProperties {

    private String displayName;
    private String url;
    private String healthPath = ServiceDescriptor.DEFAULT_HEALTH_PATH;
    private ServiceKind kind = ServiceKind.GENERIC;

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getHealthPath() {
      return healthPath;
    }

    public void setHealthPath(String healthPath) {
      this.healthPath = StringUtils.hasText(healthPath) ? healthPath : ServiceDescriptor.DEFAULT_HEALTH_PATH;
    }

    public ServiceKind getKind() {
      return kind;
    }

    public void setKind(ServiceKind kind) {
      this.kind = kind != null ? kind : ServiceKind.GENERIC;
    }
  }
}
