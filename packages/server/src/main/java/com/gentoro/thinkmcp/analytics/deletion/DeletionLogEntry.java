package com.gentoro.thinkmcp.analytics.deletion;

import java.util.Map;

/** One audited step of a data deletion. */
public record DeletionLogEntry(
    String timestamp, DeletionAction action, Map<String, Object> details) {

  public DeletionLogEntry {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
