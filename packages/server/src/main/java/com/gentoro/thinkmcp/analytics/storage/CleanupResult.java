package com.gentoro.thinkmcp.analytics.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Files and events removed (or, for a dry run, that would be removed). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CleanupResult(boolean success, int filesDeleted, int eventsDeleted, String error) {

  public static CleanupResult ok(int filesDeleted, int eventsDeleted) {
    return new CleanupResult(true, filesDeleted, eventsDeleted, null);
  }

  public static CleanupResult failed(int filesDeleted, int eventsDeleted, String error) {
    return new CleanupResult(false, filesDeleted, eventsDeleted, error);
  }
}
