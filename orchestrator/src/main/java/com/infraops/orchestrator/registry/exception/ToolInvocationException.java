package com.infraops.orchestrator.registry.exception;

import com.infraops.orchestrator.common.exception.OrchestratorException;
import org.springframework.http.HttpStatus;

public class ToolInvocationException extends OrchestratorException {

  private final String serviceId;
  private final String tool;

  public ToolInvocationException(String serviceId, String tool, String reason, Throwable cause) {
    super("Tool execution failed for " + tool + " on " + serviceId + ": " + reason, cause);
    this.serviceId = serviceId;
    this.tool = tool;
    detail("serviceId", serviceId);
    detail("tool", tool);
    detail("lastError", reason);
  }

  public String getServiceId() {
    return serviceId;
  }

  public String getTool() {
    return tool;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_GATEWAY;
  }

  @Override
  public String title() {
    return "Tool execution failed";
  }
}
