package com.gentoro.thinkmcp.analytics.deletion;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeletionStats(
    long totalDeletions,
    long totalFilesDeleted,
    long totalEventsDeleted,
    String lastDeletionAt,
    DeletionResult lastResult) {}
