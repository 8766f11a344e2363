package com.gentoro.thinkmcp.analytics.deletion;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DeletionAction {
  DELETION_REQUESTED,
  DELETION_STARTED,
  DELETION_COMPLETED,
  DELETION_FAILED,
  COMPONENTS_RESET;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
