package com.infraops.orchestrator.registry.service;

import com.infraops.orchestrator.registry.domain.ToolInvocationResult;
import java.util.Map;

/** Uniform "invoke named tool on named service" entry point used by workflows. */
@FunctionalInterface
public interface ToolInvoker {

  ToolInvocationResult invoke(String serviceId, String toolName, Map<String, Object> arguments);
}
