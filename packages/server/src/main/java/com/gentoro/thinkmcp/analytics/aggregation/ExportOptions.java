package com.gentoro.thinkmcp.analytics.aggregation;

import java.time.LocalDate;

/**
 * Sections to include in a dashboard export. {@code start}/{@code end} default to the storage's
 * read window when {@code null}.
 */
public record ExportOptions(
    LocalDate start,
    LocalDate end,
    boolean includeRawEvents,
    boolean includeStats,
    boolean includeInsights,
    boolean includeErrors,
    boolean includeTrends,
    boolean prettyPrint) {

  public static ExportOptions defaults() {
    return new ExportOptions(null, null, false, true, true, true, true, true);
  }

  /** Summary and metadata only. */
  public static ExportOptions minimal() {
    return new ExportOptions(null, null, false, false, false, false, false, false);
  }

  /** Every section, raw events included. */
  public static ExportOptions full() {
    return new ExportOptions(null, null, true, true, true, true, true, true);
  }

  public ExportOptions withRange(LocalDate from, LocalDate to) {
    return new ExportOptions(
        from, to, includeRawEvents, includeStats, includeInsights, includeErrors, includeTrends,
        prettyPrint);
  }

  public ExportOptions withRawEvents(boolean value) {
    return new ExportOptions(
        start, end, value, includeStats, includeInsights, includeErrors, includeTrends,
        prettyPrint);
  }
}
