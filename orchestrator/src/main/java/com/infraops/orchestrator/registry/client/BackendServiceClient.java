package com.infraops.orchestrator.registry.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.infraops.orchestrator.registry.domain.ServiceDescriptor;
import java.time.Duration;
import java.util.Map;

/** Transport for the three endpoints every backend service exposes. */
public interface BackendServiceClient {

  /** {@code GET {baseUrl}{healthPath}}; any non-2xx or transport error is a failure. */
  JsonNode fetchHealth(ServiceDescriptor descriptor, Duration timeout);

  /** {@code GET {baseUrl}/tools}; returns the raw response body. */
  JsonNode fetchTools(ServiceDescriptor descriptor, Duration timeout);

  /** {@code POST {baseUrl}/execute} with {@code {tool, arguments}}; body passed through verbatim. */
  JsonNode execute(
      ServiceDescriptor descriptor, String tool, Map<String, Object> arguments, Duration timeout);
}
