package com.infraops.orchestrator.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;

/**
 * Base type for caller-facing failures. Carries an HTTP status and a map of structured details
 * (service id, tool, last error, ...) that the API layer copies into the problem response.
 */
public abstract class OrchestratorException extends RuntimeException {

  private final Map<String, Object> details = new LinkedHashMap<>();

  protected OrchestratorException(String message) {
    super(message);
  }

  protected OrchestratorException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract HttpStatus status();

  public abstract String title();

  protected final void detail(String key, Object value) {
    if (value != null) {
      details.put(key, value);
    }
  }

  public Map<String, Object> details() {
    return Collections.unmodifiableMap(details);
  }
}
