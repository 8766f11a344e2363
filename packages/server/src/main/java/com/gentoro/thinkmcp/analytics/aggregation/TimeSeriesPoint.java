package com.gentoro.thinkmcp.analytics.aggregation;

/** Invocation count of one calendar day ({@code YYYY-MM-DD}). */
public record TimeSeriesPoint(String date, int count) {}
