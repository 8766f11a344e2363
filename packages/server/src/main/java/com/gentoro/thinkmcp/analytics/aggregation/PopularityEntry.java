package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.ToolName;

/** A tool's place in the usage ranking; {@code share} is a fraction of all invocations. */
public record PopularityEntry(int rank, ToolName toolName, int invocationCount, double share) {}
