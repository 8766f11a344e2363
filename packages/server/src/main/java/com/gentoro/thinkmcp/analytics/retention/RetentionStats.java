package com.gentoro.thinkmcp.analytics.retention;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetentionStats(
    long totalCleanups,
    long totalFilesDeleted,
    long totalEventsDeleted,
    String lastCleanupAt,
    RetentionCleanupResult lastResult,
    boolean scheduledCleanupActive,
    int retentionDays) {}
