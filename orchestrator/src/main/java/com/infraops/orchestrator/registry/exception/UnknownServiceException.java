package com.infraops.orchestrator.registry.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

public class UnknownServiceException extends OrchestratorException {

  private final String serviceId;

  public UnknownServiceException(String serviceId) {
    super("Unknown service: " + serviceId);
    this.serviceId = serviceId;
    detail("serviceId", serviceId);
  }

  public String getServiceId() {
    return serviceId;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.NOT_FOUND;
  }

  @Override
  public String title() {
    return "Unknown service";
  }
}
