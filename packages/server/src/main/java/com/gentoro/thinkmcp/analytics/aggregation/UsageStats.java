package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.List;

public record UsageStats(
    String periodStart,
    String periodEnd,
    int totalInvocations,
    int totalSuccesses,
    int totalErrors,
    double overallErrorRate,
    int uniqueSessions,
    int uniqueTools,
    List<ToolMetrics> tools,
    List<ToolName> toolsNeedingAttention) {}
