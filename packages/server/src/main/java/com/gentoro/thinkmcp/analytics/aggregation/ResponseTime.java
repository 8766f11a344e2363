package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.ToolName;

public record ResponseTime(
    ToolName toolName,
    double avgDurationMs,
    long minDurationMs,
    long maxDurationMs,
    long p95DurationMs) {}
