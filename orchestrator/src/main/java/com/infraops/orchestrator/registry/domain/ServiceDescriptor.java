package com.infraops.orchestrator.registry.domain;

import org.springframework.util.StringUtils;

public record ServiceDescriptor(
    String id, String displayName, String baseUrl, String healthPath, ServiceKind kind) {

  public static final String DEFAULT_HEALTH_PATH = "/health";

  public ServiceDescriptor {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("Service id must not be blank");
    }
    if (!StringUtils.hasText(baseUrl)) {
      throw new IllegalArgumentException("Base URL must be defined for service '" + id + "'");
    }
    id = id.trim();
    baseUrl = stripTrailingSlash(baseUrl.trim());
    displayName = StringUtils.hasText(displayName) ? displayName.trim() : id;
    healthPath = normalizePath(healthPath);
    kind = kind != null ? kind : ServiceKind.GENERIC;
  }

  public static ServiceDescriptor of(String id, String displayName, String baseUrl) {
    return new ServiceDescriptor(id, displayName, baseUrl, DEFAULT_HEALTH_PATH, ServiceKind.GENERIC);
  }

  public String healthUrl() {
    return baseUrl + healthPath;
  }

  public String toolsUrl() {
    return baseUrl + "/tools";
  }

  public String executeUrl() {
    return baseUrl + "/execute";
  }

  private static String stripTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static String normalizePath(String path) {
    if (!StringUtils.hasText(path)) {
      return DEFAULT_HEALTH_PATH;
    }
    String trimmed = path.trim();
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }
}
