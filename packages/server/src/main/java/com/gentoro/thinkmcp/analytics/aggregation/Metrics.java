package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ToolName;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Arithmetic shared by the aggregation services. */
final class Metrics {
  /** Relative change, in percent, above which a series counts as increasing. */
  static final double TREND_THRESHOLD_PERCENT = 10.0;

  private Metrics() {}

  /** {@code part / total}, or 0 when {@code total} is 0. */
  static double rate(long part, long total) {
    return total == 0 ? 0.0 : (double) part / total;
  }

  /** Nearest-rank 95th percentile of {@code values}; 0 for an empty input. */
  static long p95(long[] values) {
    if (values.length == 0) return 0;
    long[] sorted = values.clone();
    Arrays.sort(sorted);
    int index = (int) Math.ceil(sorted.length * 0.95) - 1;
    return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
  }

  /**
   * Percent change between the mean of the first and second half of a series. A series going
   * from an all-zero first half to a positive second half counts as +100%.
   */
  static double changePercent(List<Double> series) {
    if (series.size() < 2) return 0.0;
    int mid = series.size() / 2;
    double first = mean(series.subList(0, mid));
    double second = mean(series.subList(mid, series.size()));
    if (first == 0.0) {
      return second > 0.0 ? 100.0 : 0.0;
    }
    return (second - first) / first * 100.0;
  }

  static TrendDirection direction(List<Double> series) {
    if (series.size() < 2) return TrendDirection.STABLE;
    double change = changePercent(series);
    if (change > TREND_THRESHOLD_PERCENT) return TrendDirection.INCREASING;
    if (change < -TREND_THRESHOLD_PERCENT) return TrendDirection.DECREASING;
    return TrendDirection.STABLE;
  }

  static double mean(List<Double> values) {
    if (values.isEmpty()) return 0.0;
    double sum = 0;
    for (double v : values) sum += v;
    return sum / values.size();
  }

  static double round(double value, int decimals) {
    double factor = Math.pow(10, decimals);
    return Math.round(value * factor) / factor;
  }

  /** Every date from {@code start} to {@code end}, inclusive. */
  static List<LocalDate> days(LocalDate start, LocalDate end) {
    List<LocalDate> days = new ArrayList<>();
    for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
      days.add(d);
    }
    return days;
  }

  static String isoWeek(LocalDate date) {
    return "%d-W%02d"
        .formatted(
            date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
  }

  static String month(LocalDate date) {
    return "%04d-%02d".formatted(date.getYear(), date.getMonthValue());
  }

  static Map<ToolName, List<AnalyticsEvent>> byTool(List<AnalyticsEvent> events) {
    Map<ToolName, List<AnalyticsEvent>> grouped = new TreeMap<>();
    for (AnalyticsEvent event : events) {
      grouped.computeIfAbsent(event.toolName(), t -> new ArrayList<>()).add(event);
    }
    return grouped;
  }

  /** Daily counts over {@code [start, end]}, days without events included as zero. */
  static Map<LocalDate, Integer> dailyCounts(
      List<AnalyticsEvent> events, LocalDate start, LocalDate end) {
    Map<LocalDate, Integer> counts = new LinkedHashMap<>();
    for (LocalDate day : days(start, end)) {
      counts.put(day, 0);
    }
    for (AnalyticsEvent event : events) {
      counts.computeIfPresent(event.partitionDate(), (d, c) -> c + 1);
    }
    return counts;
  }
}
