package com.gentoro.thinkmcp.analytics.retention;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one retention run. For a dry run the counts describe what would have been deleted.
 * {@code pendingEventsDiscarded} counts in-memory events dated on or before the cutoff.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetentionCleanupResult(
    boolean success,
    int filesDeleted,
    int eventsDeleted,
    int pendingEventsDiscarded,
    int retentionDays,
    String cutoffDate,
    long durationMs,
    boolean dryRun,
    String error) {}
