package com.gentoro.thinkmcp.analytics.retention;

import java.util.Map;

/** One audit entry of the retention log. Details hold counts and dates only. */
public record CleanupLogEntry(String timestamp, CleanupAction action, Map<String, Object> details) {

  public CleanupLogEntry {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
