package com.gentoro.thinkmcp.analytics.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorageInfo(
    String storagePath,
    int totalFiles,
    int totalEvents,
    long totalBytes,
    String oldestDate,
    String newestDate,
    int retentionDays) {}
