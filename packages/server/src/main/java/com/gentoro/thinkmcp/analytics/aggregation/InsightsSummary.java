package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsightsSummary(
    HealthStatus healthStatus,
    String summary,
    int totalInsights,
    int criticalCount,
    int warningCount,
    String topRecommendation) {

  public enum HealthStatus {
    HEALTHY("healthy"),
    NEEDS_ATTENTION("needs-attention"),
    CRITICAL("critical");

    private final String value;

    HealthStatus(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }
  }
}
