package com.gentoro.thinkmcp.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse classification of a failed tool invocation. Never carries the error text itself. */
public enum ErrorCategory {
  VALIDATION,
  RUNTIME,
  TIMEOUT,
  UNKNOWN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ErrorCategory fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Error category must not be null");
    }
    return ErrorCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return value();
  }
}
