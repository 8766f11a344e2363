package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.List;

/**
 * Direction of a tool's daily usage. {@code activeDays} counts days with at least one
 * invocation.
 */
public record UsageTrend(
    ToolName toolName,
    TrendDirection direction,
    double changePercent,
    int activeDays,
    List<TimeSeriesPoint> dataPoints) {}
