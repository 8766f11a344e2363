package com.gentoro.thinkmcp.analytics.config;

import com.gentoro.thinkmcp.exception.ValidationException;

/** Names of the analytics settings, as used in files, overrides and validation messages. */
public enum ConfigField {
  ENABLED("enabled", "THINK_MCP_ANALYTICS_ENABLED", "analytics.enabled"),
  RETENTION_DAYS(
      "retentionDays", "THINK_MCP_ANALYTICS_RETENTION_DAYS", "analytics.retention-days"),
  STORAGE_PATH("storagePath", "THINK_MCP_ANALYTICS_STORAGE_PATH", "analytics.storage-path"),
  BATCH_SIZE("batchSize", "THINK_MCP_ANALYTICS_BATCH_SIZE", "analytics.batch-size"),
  FLUSH_INTERVAL_MS(
      "flushIntervalMs", "THINK_MCP_ANALYTICS_FLUSH_INTERVAL_MS", "analytics.flush-interval-ms");

  private final String key;
  private final String environmentVariable;
  private final String applicationKey;

  ConfigField(String key, String environmentVariable, String applicationKey) {
    this.key = key;
    this.environmentVariable = environmentVariable;
    this.applicationKey = applicationKey;
  }

  public String key() {
    return key;
  }

  public String environmentVariable() {
    return environmentVariable;
  }

  public String applicationKey() {
    return applicationKey;
  }

  public static ConfigField fromKey(String key) {
    for (ConfigField field : values()) {
      if (field.key.equals(key)) {
        return field;
      }
    }
    throw new ValidationException("Unknown analytics configuration field: " + key);
  }
}
