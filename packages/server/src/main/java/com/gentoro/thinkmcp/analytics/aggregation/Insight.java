package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.Locale;

/** A single observation derived from usage data, optionally about one tool. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Insight(
    String id,
    Category category,
    Severity severity,
    String title,
    String description,
    ToolName toolName,
    String recommendation,
    Double metric) {

  public enum Category {
    POPULARITY,
    RELIABILITY,
    PERFORMANCE,
    TREND;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** Ordered from most to least urgent. */
  public enum Severity {
    CRITICAL,
    WARNING,
    INFO,
    SUCCESS;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
