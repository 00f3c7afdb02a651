package com.infraops.orchestrator.registry.web;

import com.infraops.orchestrator.registry.domain.ServiceSnapshot;
import com.infraops.orchestrator.registry.domain.ToolInvocationResult;
import com.infraops.orchestrator.registry.service.ServiceRegistry;
import com.infraops.orchestrator.registry.web.dto.ServerToolsResponse;
import com.infraops.orchestrator.registry.web.dto.ToolExecutionRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/mcp")
public class ServiceRegistryController {

  private final ServiceRegistry serviceRegistry;

  public ServiceRegistryController(ServiceRegistry serviceRegistry) {
    this.serviceRegistry = serviceRegistry;
  }

  @GetMapping("/servers")
  public List<ServiceSnapshot> listServers() {
    return serviceRegistry.listAll();
  }

  @PostMapping("/servers/{serverId}/discover")
  public ServiceSnapshot discover(@PathVariable String serverId) {
    return serviceRegistry.discover(serverId);
  }

  @PostMapping("/servers/{serverId}/start")
  public ServiceSnapshot start(@PathVariable String serverId) {
    return serviceRegistry.start(serverId);
  }

  @PostMapping("/servers/{serverId}/stop")
  public ServiceSnapshot stop(@PathVariable String serverId) {
    return serviceRegistry.stop(serverId);
  }

  @GetMapping("/servers/{serverId}/tools")
  public ServerToolsResponse tools(@PathVariable String serverId) {
    return new ServerToolsResponse(serverId, serviceRegistry.listTools(serverId));
  }

  @PostMapping("/execute")
  public ToolInvocationResult execute(@Valid @RequestBody ToolExecutionRequest request) {
    return serviceRegistry.invoke(request.server(), request.tool(), request.arguments());
  }
}
