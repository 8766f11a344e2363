package com.gentoro.thinkmcp.analytics.aggregation;

/**
 * Invocation count of one period. The period id is {@code YYYY-MM-DD}, {@code YYYY-Www} (ISO week)
 * or {@code YYYY-MM}, depending on the granularity asked for.
 */
public record PeriodCount(String period, int count) {}
