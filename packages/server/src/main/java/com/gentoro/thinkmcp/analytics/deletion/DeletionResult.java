package com.gentoro.thinkmcp.analytics.deletion;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a full data deletion. {@code eventsDeleted} includes events that were still pending
 * in memory.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeletionResult(
    boolean success,
    int filesDeleted,
    int eventsDeleted,
    boolean componentsReset,
    boolean consentDeleted,
    long durationMs,
    String completedAt,
    String error) {}
