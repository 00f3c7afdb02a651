package com.infraops.orchestrator.registry.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.infraops.orchestrator.registry.domain.ServiceDescriptor;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

public class WebClientBackendServiceClient implements BackendServiceClient {

  private final WebClient webClient;

  public WebClientBackendServiceClient(WebClient backendWebClient) {
    this.webClient = backendWebClient;
  }

  @Override
  public JsonNode fetchHealth(ServiceDescriptor descriptor, Duration timeout) {
    return webClient
        .get()
        .uri(descriptor.healthUrl())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(ex -> translate("Health check", ex))
        .blockOptional()
        .orElseThrow(() -> new BackendCallException("Health check returned an empty body", false));
  }

  @Override
  public JsonNode fetchTools(ServiceDescriptor descriptor, Duration timeout) {
    return webClient
        .get()
        .uri(descriptor.toolsUrl())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(ex -> translate("Tool listing", ex))
        .blockOptional()
        .orElse(NullNode.getInstance());
  }

  @Override
  public JsonNode execute(
      ServiceDescriptor descriptor, String tool, Map<String, Object> arguments, Duration timeout) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("tool", tool);
    payload.put("arguments", arguments != null ? arguments : Map.of());
    return webClient
        .post()
        .uri(descriptor.executeUrl())
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(payload)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .onErrorMap(ex -> translate("Tool execution", ex))
        .blockOptional()
        .orElse(NullNode.getInstance());
  }

  static BackendCallException translate(String operation, Throwable ex) {
    if (ex instanceof BackendCallException backendCallException) {
      return backendCallException;
    }
    if (ex instanceof TimeoutException) {
      return new BackendCallException(operation + " timeout: " + ex.getMessage(), true, ex);
    }
    if (ex instanceof WebClientResponseException responseException) {
      String body = responseException.getResponseBodyAsString();
      String message =
          operation
              + " failed with status "
              + responseException.getStatusCode().value()
              + (StringUtils.hasText(body) ? ": " + body : "");
      return new BackendCallException(message, false, ex);
    }
    if (ex instanceof WebClientRequestException requestException) {
      return new BackendCallException(
          operation + " failed: " + describeTransportError(requestException), true, ex);
    }
    if (ex instanceof CodecException) {
      return new BackendCallException(
          operation + " returned a malformed response: " + ex.getMessage(), false, ex);
    }
    return new BackendCallException(operation + " failed: " + ex.getMessage(), false, ex);
  }

  private static String describeTransportError(WebClientRequestException ex) {
    Throwable root = ex.getRootCause() != null ? ex.getRootCause() : ex;
    if (root instanceof ConnectException) {
      return "connection refused (" + root.getMessage() + ")";
    }
    if (root instanceof UnknownHostException) {
      return "host not found (" + root.getMessage() + ")";
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }
}
