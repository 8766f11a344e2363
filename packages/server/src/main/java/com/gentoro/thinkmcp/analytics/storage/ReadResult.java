package com.gentoro.thinkmcp.analytics.storage;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import java.time.LocalDate;
import java.util.List;

/** Events read from storage, sorted by timestamp, plus the inclusive date range that was read. */
public record ReadResult(
    boolean success, List<AnalyticsEvent> events, LocalDate start, LocalDate end, String error) {

  public ReadResult {
    events = events == null ? List.of() : List.copyOf(events);
  }

  public static ReadResult failed(LocalDate start, LocalDate end, String error) {
    return new ReadResult(false, List.of(), start, end, error);
  }
}
