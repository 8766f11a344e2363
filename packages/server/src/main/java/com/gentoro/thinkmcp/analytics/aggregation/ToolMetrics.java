package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.Map;

/**
 * Per-tool figures over a date range. {@code errorRate} is a fraction in [0, 1]; {@code
 * errorsByCategory} is keyed by the category's wire name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolMetrics(
    ToolName toolName,
    int invocationCount,
    int successCount,
    int errorCount,
    double errorRate,
    double avgDurationMs,
    long minDurationMs,
    long maxDurationMs,
    long p95DurationMs,
    Map<String, Integer> errorsByCategory,
    String firstInvocation,
    String lastInvocation) {}
