package com.infraops.orchestrator.workflow.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final outcome of an execution. Pipelines attach their own fields ({@code files},
 * {@code backupPath}, ...) which serialize alongside {@code success}/{@code message}/{@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "message", "error"})
public final class ExecutionResult {

  private final boolean success;
  private final String message;
  private final String error;
  private final Map<String, Object> attributes;

  private ExecutionResult(
      boolean success, String message, String error, Map<String, Object> attributes) {
    this.success = success;
    this.message = message;
    this.error = error;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static ExecutionResult success(String message) {
    return new ExecutionResult(true, message, null, Map.of());
  }

  public static ExecutionResult failure(String error) {
    return new ExecutionResult(false, null, error, Map.of());
  }

  /** Returns a copy with {@code key} set; {@code null} values are skipped. */
  public ExecutionResult with(String key, Object value) {
    if (value == null) {
      return this;
    }
    Map<String, Object> merged = new LinkedHashMap<>(attributes);
    merged.put(key, value);
    return new ExecutionResult(success, message, error, merged);
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMessage() {
    return message;
  }

  public String getError() {
    return error;
  }

  @JsonAnyGetter
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public Object attribute(String key) {
    return attributes.get(key);
  }
}
