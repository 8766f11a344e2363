package com.gentoro.thinkmcp.analytics.aggregation;

import java.util.List;

public record InsightsReport(
    String generatedAt,
    String periodStart,
    String periodEnd,
    List<Insight> insights,
    int totalInsights,
    int criticalCount,
    int warningCount,
    int infoCount,
    int successCount) {}
