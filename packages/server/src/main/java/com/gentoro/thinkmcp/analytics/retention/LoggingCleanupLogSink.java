package com.gentoro.thinkmcp.analytics.retention;

import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.util.Objects;

/**
 * Emits each retention audit entry as a compact JSON line under the {@code analytics.retention}
 * log category.
 */
public class LoggingCleanupLogSink implements CleanupLogSink {
  private final org.slf4j.Logger log;

  public LoggingCleanupLogSink() {
    this(com.gentoro.thinkmcp.logging.LoggingService.getLogger("analytics.retention"));
  }

  public LoggingCleanupLogSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void accept(CleanupLogEntry entry) {
    if (entry.action() == CleanupAction.CLEANUP_FAILED) {
      log.warn(JacksonUtility.toCompactJson(entry));
    } else {
      log.info(JacksonUtility.toCompactJson(entry));
    }
  }
}
