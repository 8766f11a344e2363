package com.gentoro.thinkmcp.analytics.config;

import java.util.List;

/**
 * Outcome of validating an {@link AnalyticsConfig}. Errors block use of the configuration;
 * warnings are advisory.
 */
public record ConfigValidationResult(
    boolean valid, List<FieldIssue> errors, List<FieldIssue> warnings) {

  public ConfigValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  /** A problem with a single configuration field. */
  public record FieldIssue(String field, String message) {
    @Override
    public String toString() {
      return message;
    }
  }
}
