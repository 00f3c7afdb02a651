package com.infraops.orchestrator.workflow.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.infraops.orchestrator.registry.domain.ToolInvocationResult;
import com.infraops.orchestrator.registry.service.ToolInvoker;
import com.infraops.orchestrator.workflow.config.WorkflowProperties;
import com.infraops.orchestrator.workflow.domain.ExecutionResult;
import com.infraops.orchestrator.workflow.domain.StepResult;
import com.infraops.orchestrator.workflow.domain.StepStatus;
import com.infraops.orchestrator.workflow.domain.WorkflowExecution;
import com.infraops.orchestrator.workflow.service.WorkflowCatalog;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Runs the backup playbook, lists what it wrote, then copies every config artifact into the
 * repository checkout through the filesystem backend. A file that cannot be read or written is
 * skipped; {@code files} in the result lists exactly the copied ones.
 */
public class ConfigBackupPipeline implements WorkflowPipeline {

  private static final Logger log = LoggerFactory.getLogger(ConfigBackupPipeline.class);

  static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);
  private static final Pattern FILE_PREFIX = Pattern.compile("^\\[FILE\\]\\s*");

  private final ToolInvoker toolInvoker;
  private final WorkflowProperties.ConfigBackup settings;
  private final Clock clock;

  public ConfigBackupPipeline(
      ToolInvoker toolInvoker, WorkflowProperties.ConfigBackup settings, Clock clock) {
    this.toolInvoker = toolInvoker;
    this.settings = settings;
    this.clock = clock;
  }

  @Override
  public String workflowId() {
    return WorkflowCatalog.CONFIG_BACKUP;
  }

  @Override
  public ExecutionResult run(WorkflowExecution execution, StepRecorder recorder) {
    String timestamp = TIMESTAMP.format(clock.instant());
    Object requestedPath = execution.getParameters().get("backupPath");
    String backupPath =
        requestedPath != null && StringUtils.hasText(requestedPath.toString())
            ? requestedPath.toString().trim()
            : settings.getBackupBasePath() + "/" + timestamp;
    String repoBackupDir = settings.getRepoBackupPath() + "/" + timestamp;
    String backupService = settings.getBackupServiceId();
    String filesystem = settings.getFilesystemServiceId();

    log.info("Config backup: running {} with backup_path={}", settings.getPlaybook(), backupPath);
    Map<String, Object> playbookArgs = new LinkedHashMap<>();
    playbookArgs.put("playbook_name", settings.getPlaybook());
    playbookArgs.put("inventory", settings.getInventory());
    playbookArgs.put("extra_vars", Map.of("backup_path", backupPath));
    ToolInvocationResult playbook;
    try {
      playbook = toolInvoker.invoke(backupService, "run_playbook", playbookArgs);
    } catch (RuntimeException ex) {
      return abort(recorder, "ansible_backup", "Run Ansible backup-config", ex, backupPath);
    }
    boolean playbookOk = "completed".equals(status(playbook));
    recorder.record(step("ansible_backup", "Run Ansible backup-config", playbookOk, playbook));
    if (!playbookOk) {
      String error = firstText(playbook.result(), "Playbook failed", "error", "stderr");
      log.error("Config backup: playbook failed: {}", error);
      return ExecutionResult.failure(error).with("backupPath", backupPath);
    }

    ToolInvocationResult listing;
    try {
      listing = toolInvoker.invoke(filesystem, "list_directory", Map.of("path", backupPath));
    } catch (RuntimeException ex) {
      return abort(recorder, "list_backups", "List backup files", ex, backupPath);
    }
    boolean listingOk = "success".equals(status(listing));
    recorder.record(step("list_backups", "List backup files", listingOk, listing));
    if (!listingOk) {
      return ExecutionResult.failure(
              firstText(listing.result(), "Failed to list backup directory", "error"))
          .with("backupPath", backupPath);
    }

    List<String> fileNames = artifactNames(listing.result().path("output").asText(""));
    if (fileNames.isEmpty()) {
      log.warn("Config backup: no backup files found in {}", backupPath);
      return ExecutionResult.success("Backup completed but no config files were written")
          .with("backupPath", backupPath)
          .with("repoBackupDir", repoBackupDir)
          .with("files", List.of());
    }

    try {
      toolInvoker.invoke(filesystem, "create_directory", Map.of("path", repoBackupDir));
    } catch (RuntimeException ex) {
      return abort(recorder, "create_repo_dir", "Create repo backup directory", ex, backupPath);
    }
    recorder.record(
        step("create_repo_dir", "Create repo backup directory", true, Map.of("path", repoBackupDir)));

    List<String> copied = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (String name : fileNames) {
      if (copy(filesystem, backupPath + "/" + name, repoBackupDir + "/" + name)) {
        copied.add(name);
      } else {
        skipped.add(name);
      }
    }
    recorder.record(
        step(
            "copy_to_repo",
            "Copy backups to repo",
            true,
            Map.of("files", List.copyOf(copied), "skipped", List.copyOf(skipped))));

    log.info("Config backup: saved {} file(s) to {}", copied.size(), repoBackupDir);
    return ExecutionResult.success(
            "Backed up " + copied.size() + " device config(s) to fileserver and repo")
        .with("backupPath", backupPath)
        .with("repoBackupDir", repoBackupDir)
        .with("files", List.copyOf(copied));
  }

  private boolean copy(String filesystem, String source, String destination) {
    ToolInvocationResult read;
    try {
      read = toolInvoker.invoke(filesystem, "read_file", Map.of("path", source));
    } catch (RuntimeException ex) {
      log.warn("Config backup: skipping {}, read failed: {}", source, ex.getMessage());
      return false;
    }
    JsonNode content = read.result() != null ? read.result().get("output") : null;
    if (!"success".equals(status(read)) || content == null || content.isNull()) {
      log.warn("Config backup: skipping {}, read returned status {}", source, status(read));
      return false;
    }
    try {
      ToolInvocationResult write =
          toolInvoker.invoke(
              filesystem, "write_file", Map.of("path", destination, "content", content.asText()));
      String writeStatus = status(write);
      if (writeStatus != null && !"success".equals(writeStatus)) {
        log.warn("Config backup: skipping {}, write returned status {}", destination, writeStatus);
        return false;
      }
    } catch (RuntimeException ex) {
      log.warn("Config backup: skipping {}, write failed: {}", destination, ex.getMessage());
      return false;
    }
    return true;
  }

  List<String> artifactNames(String listing) {
    List<String> names = new ArrayList<>();
    for (String line : listing.split("\\r?\\n")) {
      if (line.startsWith("[DIR]")) {
        continue;
      }
      String name = FILE_PREFIX.matcher(line).replaceFirst("").trim();
      if (!name.isEmpty() && settings.getArtifactExtensions().stream().anyMatch(name::endsWith)) {
        names.add(name);
      }
    }
    return names;
  }

  private ExecutionResult abort(
      StepRecorder recorder, String stepId, String stepName, RuntimeException ex, String backupPath) {
    log.error("Config backup: step {} failed: {}", stepId, ex.getMessage());
    recorder.record(step(stepId, stepName, false, Map.of("error", String.valueOf(ex.getMessage()))));
    return ExecutionResult.failure(ex.getMessage()).with("backupPath", backupPath);
  }

  private StepResult step(String id, String name, boolean success, Object result) {
    return new StepResult(id, name, StepStatus.of(success), result, clock.instant());
  }

  private static String status(ToolInvocationResult invocation) {
    if (invocation == null || invocation.result() == null) {
      return null;
    }
    JsonNode status = invocation.result().get("status");
    return status != null && status.isTextual() ? status.asText() : null;
  }

  private static String firstText(JsonNode node, String fallback, String... fields) {
    if (node != null) {
      for (String field : fields) {
        JsonNode value = node.get(field);
        if (value != null && value.isTextual() && StringUtils.hasText(value.asText())) {
          return value.asText();
        }
      }
    }
    return fallback;
  }
}
