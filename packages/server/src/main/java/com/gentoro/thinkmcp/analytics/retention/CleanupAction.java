package com.gentoro.thinkmcp.analytics.retention;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CleanupAction {
  CLEANUP_STARTED,
  CLEANUP_COMPLETED,
  CLEANUP_FAILED,
  DRY_RUN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
