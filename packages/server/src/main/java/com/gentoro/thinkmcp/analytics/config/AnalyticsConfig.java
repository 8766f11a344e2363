package com.gentoro.thinkmcp.analytics.config;

import java.nio.file.Path;

/**
 * Effective analytics settings after all configuration layers have been applied.
 *
 * @param enabled master switch; recording also requires consent
 * @param retentionDays partitions older than this many days are removed
 * @param storagePath directory holding the daily partition files
 * @param batchSize number of pending events that triggers a flush
 * @param flushIntervalMs period of the timer flush
 */
public record AnalyticsConfig(
    boolean enabled, int retentionDays, Path storagePath, int batchSize, long flushIntervalMs) {

  public static final boolean DEFAULT_ENABLED = false;
  public static final int DEFAULT_RETENTION_DAYS = 90;
  public static final int DEFAULT_BATCH_SIZE = 50;
  public static final long DEFAULT_FLUSH_INTERVAL_MS = 30_000L;

  public AnalyticsConfig withEnabled(boolean value) {
    return new AnalyticsConfig(value, retentionDays, storagePath, batchSize, flushIntervalMs);
  }

  public AnalyticsConfig withRetentionDays(int value) {
    return new AnalyticsConfig(enabled, value, storagePath, batchSize, flushIntervalMs);
  }

  public AnalyticsConfig withStoragePath(Path value) {
    return new AnalyticsConfig(enabled, retentionDays, value, batchSize, flushIntervalMs);
  }

  public AnalyticsConfig withBatchSize(int value) {
    return new AnalyticsConfig(enabled, retentionDays, storagePath, value, flushIntervalMs);
  }

  public AnalyticsConfig withFlushIntervalMs(long value) {
    return new AnalyticsConfig(enabled, retentionDays, storagePath, batchSize, value);
  }
}
