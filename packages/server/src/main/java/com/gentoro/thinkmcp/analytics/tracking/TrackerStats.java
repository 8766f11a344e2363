package com.gentoro.thinkmcp.analytics.tracking;

public record TrackerStats(
    int activeInvocations,
    long totalStarted,
    long totalCompleted,
    long totalSuccesses,
    long totalErrors) {}
