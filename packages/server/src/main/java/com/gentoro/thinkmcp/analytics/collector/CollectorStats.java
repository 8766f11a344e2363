package com.gentoro.thinkmcp.analytics.collector;

public record CollectorStats(
    boolean enabled,
    int pendingEvents,
    long totalEventsTracked,
    long totalEventsFlushed,
    long totalFlushErrors,
    long totalEventsDiscarded,
    String sessionId,
    int batchSize,
    long flushIntervalMs) {}
