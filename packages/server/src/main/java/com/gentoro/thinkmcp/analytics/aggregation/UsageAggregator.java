package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.ReadResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only usage figures computed from stored events.
 *
 * <p>Every method takes an inclusive date range; {@code null} bounds fall back to the storage's
 * default window. All rates are fractions in [0, 1].
 */
public class UsageAggregator {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(UsageAggregator.class);

  /** Tools whose error rate is above this fraction are flagged as needing attention. */
  public static final double ATTENTION_ERROR_RATE = 0.10;

  private final AnalyticsStorage storage;

  public UsageAggregator(AnalyticsStorage storage) {
    this.storage = storage;
  }

  public UsageStats getUsageStats(LocalDate start, LocalDate end) {
    ReadResult read = read(start, end);
    List<AnalyticsEvent> events = read.events();

    int errors = (int) events.stream().filter(e -> !e.success()).count();
    List<ToolMetrics> tools =
        Metrics.byTool(events).entrySet().stream()
            .map(entry -> toolMetrics(entry.getKey(), entry.getValue()))
            .sorted(
                Comparator.comparingInt(ToolMetrics::invocationCount)
                    .reversed()
                    .thenComparing(ToolMetrics::toolName))
            .toList();
    List<ToolName> attention =
        tools.stream()
            .filter(t -> t.errorRate() > ATTENTION_ERROR_RATE)
            .map(ToolMetrics::toolName)
            .toList();

    return new UsageStats(
        read.start().toString(),
        read.end().toString(),
        events.size(),
        events.size() - errors,
        errors,
        Metrics.rate(errors, events.size()),
        uniqueSessions(events),
        tools.size(),
        tools,
        attention);
  }

  /** Metrics of every tool used in the range, most used first. */
  public List<ToolMetrics> getToolMetrics(LocalDate start, LocalDate end) {
    return getUsageStats(start, end).tools();
  }

  /** Metrics of one tool, or {@code null} when it was not used in the range. */
  public ToolMetrics getToolMetrics(ToolName toolName, LocalDate start, LocalDate end) {
    List<AnalyticsEvent> events =
        read(start, end).events().stream().filter(e -> e.toolName() == toolName).toList();
    return events.isEmpty() ? null : toolMetrics(toolName, events);
  }

  /** Usage trend of every tool used in the range. */
  public List<UsageTrend> getUsageTrends(LocalDate start, LocalDate end) {
    ReadResult read = read(start, end);
    List<UsageTrend> trends = new ArrayList<>();
    for (Map.Entry<ToolName, List<AnalyticsEvent>> entry :
        Metrics.byTool(read.events()).entrySet()) {
      Map<LocalDate, Integer> daily =
          Metrics.dailyCounts(entry.getValue(), read.start(), read.end());
      List<Double> series = daily.values().stream().map(Integer::doubleValue).toList();
      int activeDays = (int) daily.values().stream().filter(c -> c > 0).count();
      trends.add(
          new UsageTrend(
              entry.getKey(),
              Metrics.direction(series),
              Metrics.round(Metrics.changePercent(series), 1),
              activeDays,
              toPoints(daily)));
    }
    return trends;
  }

  public List<TimeSeriesPoint> getDailyCounts(LocalDate start, LocalDate end) {
    ReadResult read = read(start, end);
    return toPoints(Metrics.dailyCounts(read.events(), read.start(), read.end()));
  }

  public List<PeriodCount> getWeeklyCounts(LocalDate start, LocalDate end) {
    return getPeriodCounts(start, end, Metrics::isoWeek);
  }

  public List<PeriodCount> getMonthlyCounts(LocalDate start, LocalDate end) {
    return getPeriodCounts(start, end, Metrics::month);
  }

  /** Counts grouped by the period id {@code periodOf} assigns to each day, in date order. */
  public List<PeriodCount> getPeriodCounts(
      LocalDate start, LocalDate end, Function<LocalDate, String> periodOf) {
    ReadResult read = read(start, end);
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Map.Entry<LocalDate, Integer> day :
        Metrics.dailyCounts(read.events(), read.start(), read.end()).entrySet()) {
      counts.merge(periodOf.apply(day.getKey()), day.getValue(), Integer::sum);
    }
    return counts.entrySet().stream().map(e -> new PeriodCount(e.getKey(), e.getValue())).toList();
  }

  public UsageSummary getSummary(LocalDate start, LocalDate end) {
    UsageStats stats = getUsageStats(start, end);
    ToolName mostPopular = stats.tools().isEmpty() ? null : stats.tools().get(0).toolName();
    ToolName highestErrorRate =
        stats.tools().stream()
            .filter(t -> t.errorCount() > 0)
            .max(
                Comparator.comparingDouble(ToolMetrics::errorRate)
                    .thenComparingInt(ToolMetrics::errorCount))
            .map(ToolMetrics::toolName)
            .orElse(null);
    ToolName slowest =
        stats.tools().stream()
            .max(Comparator.comparingDouble(ToolMetrics::avgDurationMs))
            .map(ToolMetrics::toolName)
            .orElse(null);
    return new UsageSummary(
        stats.totalInvocations(),
        stats.uniqueSessions(),
        stats.overallErrorRate(),
        mostPopular,
        highestErrorRate,
        slowest);
  }

  /** Tools ordered by invocation count; {@code limit <= 0} returns all of them. */
  public List<PopularityEntry> getPopularityRanking(LocalDate start, LocalDate end, int limit) {
    UsageStats stats = getUsageStats(start, end);
    List<PopularityEntry> ranking = new ArrayList<>();
    int rank = 1;
    for (ToolMetrics tool : stats.tools()) {
      if (limit > 0 && ranking.size() >= limit) break;
      ranking.add(
          new PopularityEntry(
              rank++,
              tool.toolName(),
              tool.invocationCount(),
              Metrics.rate(tool.invocationCount(), stats.totalInvocations())));
    }
    return ranking;
  }

  /** Error rate per used tool, keyed by tool. */
  public Map<ToolName, Double> getErrorRates(LocalDate start, LocalDate end) {
    Map<ToolName, Double> rates = new TreeMap<>();
    getToolMetrics(start, end).forEach(t -> rates.put(t.toolName(), t.errorRate()));
    return rates;
  }

  /** Response-time figures per used tool, slowest average first. */
  public List<ResponseTime> getResponseTimes(LocalDate start, LocalDate end) {
    return getToolMetrics(start, end).stream()
        .map(
            t ->
                new ResponseTime(
                    t.toolName(),
                    t.avgDurationMs(),
                    t.minDurationMs(),
                    t.maxDurationMs(),
                    t.p95DurationMs()))
        .sorted(Comparator.comparingDouble(ResponseTime::avgDurationMs).reversed())
        .toList();
  }

  /** Events of the range; an unreadable store reads as empty. */
  ReadResult read(LocalDate start, LocalDate end) {
    ReadResult read = storage.readEvents(start, end);
    if (!read.success()) {
      log.warn("Aggregating over an empty set: analytics read failed: {}", read.error());
    }
    return read;
  }

  static ToolMetrics toolMetrics(ToolName toolName, List<AnalyticsEvent> events) {
    int errors = 0;
    long total = 0;
    long min = Long.MAX_VALUE;
    long max = 0;
    long[] durations = new long[events.size()];
    Map<String, Integer> byCategory = new TreeMap<>();
    AnalyticsEvent first = null;
    AnalyticsEvent last = null;
    for (int i = 0; i < events.size(); i++) {
      AnalyticsEvent event = events.get(i);
      long duration = event.durationMs();
      durations[i] = duration;
      total += duration;
      min = Math.min(min, duration);
      max = Math.max(max, duration);
      if (!event.success()) {
        errors++;
        ErrorCategory category =
            event.errorCategory() == null ? ErrorCategory.UNKNOWN : event.errorCategory();
        byCategory.merge(category.value(), 1, Integer::sum);
      }
      if (first == null || event.instant().isBefore(first.instant())) first = event;
      if (last == null || event.instant().isAfter(last.instant())) last = event;
    }
    int count = events.size();
    return new ToolMetrics(
        toolName,
        count,
        count - errors,
        errors,
        Metrics.rate(errors, count),
        count == 0 ? 0.0 : Metrics.round((double) total / count, 2),
        count == 0 ? 0 : min,
        max,
        Metrics.p95(durations),
        byCategory,
        first == null ? null : first.timestamp(),
        last == null ? null : last.timestamp());
  }

  private static int uniqueSessions(List<AnalyticsEvent> events) {
    Set<String> sessions = new HashSet<>();
    events.forEach(e -> sessions.add(e.sessionId()));
    return sessions.size();
  }

  private static List<TimeSeriesPoint> toPoints(Map<LocalDate, Integer> daily) {
    return daily.entrySet().stream()
        .map(e -> new TimeSeriesPoint(e.getKey().toString(), e.getValue()))
        .toList();
  }
}
