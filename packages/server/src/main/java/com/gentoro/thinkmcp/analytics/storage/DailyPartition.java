package com.gentoro.thinkmcp.analytics.storage;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import java.util.List;

/** On-disk shape of one {@code analytics-YYYY-MM-DD.json} file. */
public record DailyPartition(
    String schemaVersion, String date, List<AnalyticsEvent> events, String lastModified) {

  public static final String SCHEMA_VERSION = "1.0.0";
}
