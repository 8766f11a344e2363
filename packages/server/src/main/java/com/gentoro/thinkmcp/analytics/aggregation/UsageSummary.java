package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.thinkmcp.analytics.ToolName;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageSummary(
    int totalInvocations,
    int uniqueSessions,
    double overallErrorRate,
    ToolName mostPopularTool,
    ToolName highestErrorRateTool,
    ToolName slowestTool) {}
