package com.gentoro.thinkmcp.analytics.tracking;

import com.gentoro.thinkmcp.analytics.ErrorCategory;
import java.util.List;
import java.util.Locale;

/**
 * Maps a failure to an {@link ErrorCategory} by looking only at the exception's class name. The
 * message is never inspected, so no user content can leak into the category.
 */
public final class ErrorCategorizer {
  private static final List<String> VALIDATION_MARKERS =
      List.of("validation", "schema", "type", "argument", "invalid");
  private static final List<String> TIMEOUT_MARKERS = List.of("timeout", "timedout");

  private ErrorCategorizer() {}

  public static ErrorCategory categorize(Throwable error) {
    if (error == null) {
      return ErrorCategory.UNKNOWN;
    }
    String name = error.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    if (VALIDATION_MARKERS.stream().anyMatch(name::contains)) {
      return ErrorCategory.VALIDATION;
    }
    if (TIMEOUT_MARKERS.stream().anyMatch(name::contains)) {
      return ErrorCategory.TIMEOUT;
    }
    if (error instanceof Exception) {
      return ErrorCategory.RUNTIME;
    }
    return ErrorCategory.UNKNOWN;
  }
}
