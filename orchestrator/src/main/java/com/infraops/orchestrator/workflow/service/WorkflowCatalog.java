package com.infraops.orchestrator.workflow.service;

import com.infraops.orchestrator.workflow.action.AnalyzeNetworkIssuesAction;
import com.infraops.orchestrator.workflow.action.FormatConfigurationsAction;
import com.infraops.orchestrator.workflow.action.GenerateDocumentationAction;
import com.infraops.orchestrator.workflow.domain.StepDefinition;
import com.infraops.orchestrator.workflow.domain.WorkflowDefinition;
import com.infraops.orchestrator.workflow.domain.WorkflowSummary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Static workflow definitions, built once at startup. */
public class WorkflowCatalog {

  public static final String NETWORK_ISSUE_RESOLUTION = "network_issue_resolution";
  public static final String CONFIG_BACKUP = "config_backup";
  public static final String UPDATE_DOCUMENTATION = "update_documentation";
  public static final String CONFIG_SNAPSHOT = "config_snapshot";

  private final Map<String, WorkflowDefinition> definitions = new LinkedHashMap<>();

  public WorkflowCatalog(List<WorkflowDefinition> definitions) {
    for (WorkflowDefinition definition : definitions) {
      if (this.definitions.putIfAbsent(definition.id(), definition) != null) {
        throw new IllegalStateException("Duplicate workflow " + definition.id());
      }
    }
  }

  public static WorkflowCatalog withBuiltIns() {
    return new WorkflowCatalog(
        List.of(
            networkIssueResolution(), configBackup(), updateDocumentation(), configSnapshot()));
  }

  public Optional<WorkflowDefinition> find(String workflowId) {
    return Optional.ofNullable(workflowId).map(definitions::get);
  }

  public List<WorkflowSummary> summaries() {
    return definitions.values().stream().map(WorkflowSummary::of).toList();
  }

  static WorkflowDefinition networkIssueResolution() {
    return new WorkflowDefinition(
        NETWORK_ISSUE_RESOLUTION,
        "Network Issue Detection and Resolution",
        "Detect interface problems, open a ServiceNow problem and apply safe fixes",
        List.of(
            StepDefinition.external(
                "check_network_health",
                "Check Network Health",
                "pyats",
                "run_show_command",
                Map.of("device_name", "all", "command", "show ip interface brief")),
            StepDefinition.internal(
                    "analyze_issues", "Analyze Issues", AnalyzeNetworkIssuesAction.NAME)
                .withCondition(StepConditions.ISSUES_FOUND),
            StepDefinition.external(
                    "create_ticket",
                    "Create ServiceNow Ticket",
                    "servicenow",
                    "create_servicenow_problem",
                    Map.of())
                .withBinding("problem_data", "analyze_issues.problem")
                .withCondition(StepConditions.AUTO_FIX_REQUESTED),
            StepDefinition.external(
                    "apply_fixes",
                    "Apply Automated Fixes",
                    "pyats",
                    "apply_device_configuration",
                    Map.of())
                .withBinding("device_name", "analyze_issues.affected_devices")
                .withBinding("config_commands", "analyze_issues.config_commands")));
  }

  /** Listed for discovery; the run itself is handled by the config-backup pipeline. */
  static WorkflowDefinition configBackup() {
    return new WorkflowDefinition(
        CONFIG_BACKUP,
        "Configuration Backup",
        "Back up device configurations with Ansible and copy them into the config repository",
        List.of(
            StepDefinition.external(
                "ansible_backup", "Run Ansible backup-config", "ansible", "run_playbook", Map.of()),
            StepDefinition.external(
                "list_backups", "List backup files", "filesystem", "list_directory", Map.of()),
            StepDefinition.external(
                "create_repo_dir",
                "Create repo backup directory",
                "filesystem",
                "create_directory",
                Map.of()),
            StepDefinition.external(
                "copy_to_repo", "Copy backups to repo", "filesystem", "write_file", Map.of())));
  }

  static WorkflowDefinition updateDocumentation() {
    return new WorkflowDefinition(
        UPDATE_DOCUMENTATION,
        "Update Network Documentation",
        "Regenerate topology documentation from CDP neighbors and publish it",
        List.of(
            StepDefinition.external(
                "gather_topology",
                "Gather Network Topology",
                "pyats",
                "run_show_command",
                Map.of("device_name", "all", "command", "show cdp neighbors")),
            StepDefinition.internal(
                    "generate_docs", "Generate Documentation", GenerateDocumentationAction.NAME)
                .withCondition(StepConditions.STEP_SUCCEEDED),
            StepDefinition.external(
                    "update_repository",
                    "Update Documentation Repository",
                    "github",
                    "create_or_update_file",
                    Map.of("repository", "network-docs", "path", "topology.md"))
                .withBinding("content", "generate_docs.documentation")));
  }

  static WorkflowDefinition configSnapshot() {
    return new WorkflowDefinition(
        CONFIG_SNAPSHOT,
        "Configuration Snapshot",
        "Learn running configurations and push them to GitHub",
        List.of(
            StepDefinition.external(
                "get_configs",
                "Get Device Configurations",
                "pyats",
                "execute_learn_config",
                Map.of("device_name", "all")),
            StepDefinition.internal(
                    "format_configs", "Format Configurations", FormatConfigurationsAction.NAME)
                .withCondition(StepConditions.STEP_SUCCEEDED),
            StepDefinition.external(
                    "commit_to_github",
                    "Commit to GitHub",
                    "github",
                    "push_files",
                    Map.of("repository", "network-configs"))
                .withBinding("files", "format_configs.files")));
  }
}
