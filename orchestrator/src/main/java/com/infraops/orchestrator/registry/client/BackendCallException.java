package com.infraops.orchestrator.registry.client;

/**
 * Failure of a single outbound call. {@code transientFailure} marks errors worth retrying:
 * timeouts, refused connections and name-resolution failures.
 */
public class BackendCallException extends RuntimeException {

  private final boolean transientFailure;

  public BackendCallException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public BackendCallException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
