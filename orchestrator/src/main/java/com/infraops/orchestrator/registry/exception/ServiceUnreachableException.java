package com.infraops.orchestrator.registry.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import com.infraops.orchestrator.registry.domain.ServiceStatus;
import org.springframework.http.HttpStatus;

/** Raised once the health-check retry budget is spent, or when a re-discovery did not help. */
public class ServiceUnreachableException extends OrchestratorException {

  private final String serviceId;
  private final ServiceStatus lastStatus;
  private final String lastError;

  public ServiceUnreachableException(
      String serviceId, ServiceStatus lastStatus, String lastError, Throwable cause) {
    super(
        "Service "
            + serviceId
            + " is not running (status: "
            + (lastStatus != null ? lastStatus.value() : "unknown")
            + "). Last error: "
            + (lastError != null ? lastError : "Unknown error"),
        cause);
    this.serviceId = serviceId;
    this.lastStatus = lastStatus;
    this.lastError = lastError;
    detail("serviceId", serviceId);
    detail("status", lastStatus != null ? lastStatus.value() : null);
    detail("lastError", lastError);
  }

  public String getServiceId() {
    return serviceId;
  }

  public ServiceStatus getLastStatus() {
    return lastStatus;
  }

  public String getLastError() {
    return lastError;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.SERVICE_UNAVAILABLE;
  }

  @Override
  public String title() {
    return "Service unreachable";
  }
}
