package com.gentoro.thinkmcp.analytics.deletion;

@FunctionalInterface
public interface DeletionLogSink {
  void accept(DeletionLogEntry entry);
}
