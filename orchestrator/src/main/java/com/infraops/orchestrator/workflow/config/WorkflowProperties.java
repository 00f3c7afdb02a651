package com.infraops.orchestrator.workflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "app.workflow")
public class WorkflowProperties {

  private Duration historyRetention = Duration.ofHours(24);
  private int defaultHistoryLimit = 10;

  /** When set, an unknown step condition aborts the execution instead of continuing. */
  private boolean strictConditions = false;

  private final ConfigBackup configBackup = new ConfigBackup();

  public Duration getHistoryRetention() {
    return historyRetention;
  }

  public void setHistoryRetention(Duration historyRetention) {
    if (historyRetention != null && !historyRetention.isNegative() && !historyRetention.isZero()) {
      this.historyRetention = historyRetention;
    }
  }

  public int getDefaultHistoryLimit() {
    return Math.max(1, defaultHistoryLimit);
  }

  public void setDefaultHistoryLimit(int defaultHistoryLimit) {
    this.defaultHistoryLimit = Math.max(1, defaultHistoryLimit);
  }

  public boolean isStrictConditions() {
    return strictConditions;
  }

  public void setStrictConditions(boolean strictConditions) {
    this.strictConditions = strictConditions;
  }

  public ConfigBackup getConfigBackup() {
    return configBackup;
  }

  public static class ConfigBackup {

    private String backupServiceId = "ansible";
    private String playbook = "backup-config.yml";
    private String inventory = "hosts.yml";
    private String filesystemServiceId = "filesystem";
    private String backupBasePath = "/projects/backups";
    private String repoBackupPath = "/projects/MCP-Infrastructure/network-config-backups";
    private List<String> artifactExtensions = new ArrayList<>(List.of(".cfg", ".txt"));

    public String getBackupServiceId() {
      return backupServiceId;
    }

    public void setBackupServiceId(String backupServiceId) {
      if (StringUtils.hasText(backupServiceId)) {
        this.backupServiceId = backupServiceId.trim();
      }
    }

    public String getPlaybook() {
      return playbook;
    }

    public void setPlaybook(String playbook) {
      if (StringUtils.hasText(playbook)) {
        this.playbook = playbook.trim();
      }
    }

    public String getInventory() {
      return inventory;
    }

    public void setInventory(String inventory) {
      if (StringUtils.hasText(inventory)) {
        this.inventory = inventory.trim();
      }
    }

    public String getFilesystemServiceId() {
      return filesystemServiceId;
    }

    public void setFilesystemServiceId(String filesystemServiceId) {
      if (StringUtils.hasText(filesystemServiceId)) {
        this.filesystemServiceId = filesystemServiceId.trim();
      }
    }

    public String getBackupBasePath() {
      return backupBasePath;
    }

    public void setBackupBasePath(String backupBasePath) {
      if (StringUtils.hasText(backupBasePath)) {
        this.backupBasePath = stripTrailingSlash(backupBasePath.trim());
      }
    }

    public String getRepoBackupPath() {
      return repoBackupPath;
    }

    public void setRepoBackupPath(String repoBackupPath) {
      if (StringUtils.hasText(repoBackupPath)) {
        this.repoBackupPath = stripTrailingSlash(repoBackupPath.trim());
      }
    }

    public List<String> getArtifactExtensions() {
      return artifactExtensions;
    }

    public void setArtifactExtensions(List<String> artifactExtensions) {
      this.artifactExtensions =
          artifactExtensions != null ? new ArrayList<>(artifactExtensions) : new ArrayList<>();
    }

    private static String stripTrailingSlash(String path) {
      return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
  }
}
