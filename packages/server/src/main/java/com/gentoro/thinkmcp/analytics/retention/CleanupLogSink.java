package com.gentoro.thinkmcp.analytics.retention;

/** Receives retention audit entries as they are recorded. */
@FunctionalInterface
public interface CleanupLogSink {
  void accept(CleanupLogEntry entry);
}
