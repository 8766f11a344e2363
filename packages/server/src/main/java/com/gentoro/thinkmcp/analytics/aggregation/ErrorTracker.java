package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.ReadResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Error-focused views over stored events: rates, categories, problem tools and trends. */
public class ErrorTracker {

  public static final double CRITICAL_ERROR_RATE = 0.25;
  public static final double WARNING_ERROR_RATE = 0.10;
  public static final double DEFAULT_PROBLEM_THRESHOLD = 0.05;
  public static final double DEFAULT_HIGH_ERROR_RATE = 0.10;

  public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Severity forRate(double errorRate) {
      if (errorRate >= CRITICAL_ERROR_RATE) return CRITICAL;
      if (errorRate >= WARNING_ERROR_RATE) return WARNING;
      return INFO;
    }
  }

  public record ToolErrorBreakdown(
      ToolName toolName,
      int invocationCount,
      int errorCount,
      double errorRate,
      Map<String, Integer> errorsByCategory) {}

  public record ErrorStats(
      int totalInvocations,
      int totalErrors,
      double overallErrorRate,
      Map<String, Integer> byCategory,
      List<ToolErrorBreakdown> byTool,
      List<ToolName> toolsByErrorRate,
      List<ToolName> toolsByErrorCount) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ProblematicTool(
      ToolName toolName,
      double errorRate,
      int errorCount,
      int invocationCount,
      Severity severity,
      ErrorCategory dominantCategory) {}

  /** Error rate of one day; days without invocations have a rate of 0. */
  public record ErrorTrendPoint(String date, int invocations, int errors, double errorRate) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorTrend(
      ToolName toolName,
      List<ErrorTrendPoint> dataPoints,
      TrendDirection trend,
      double changePercent,
      double averageErrorRate) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorSummary(
      int totalErrors,
      double overallErrorRate,
      int problematicTools,
      int criticalTools,
      ErrorCategory mostCommonCategory,
      TrendDirection trend) {}

  private final UsageAggregator aggregator;

  public ErrorTracker(AnalyticsStorage storage) {
    this.aggregator = new UsageAggregator(storage);
  }

  public ErrorStats getErrorStats(LocalDate start, LocalDate end) {
    List<AnalyticsEvent> events = aggregator.read(start, end).events();
    List<ToolErrorBreakdown> byTool = breakdown(events);
    int errors = byTool.stream().mapToInt(ToolErrorBreakdown::errorCount).sum();
    return new ErrorStats(
        events.size(),
        errors,
        Metrics.rate(errors, events.size()),
        categoryCounts(events),
        byTool,
        byTool.stream()
            .filter(t -> t.errorCount() > 0)
            .sorted(Comparator.comparingDouble(ToolErrorBreakdown::errorRate).reversed())
            .map(ToolErrorBreakdown::toolName)
            .toList(),
        byTool.stream()
            .filter(t -> t.errorCount() > 0)
            .sorted(Comparator.comparingInt(ToolErrorBreakdown::errorCount).reversed())
            .map(ToolErrorBreakdown::toolName)
            .toList());
  }

  /** Breakdown of one tool, or {@code null} when the tool was not used in the range. */
  public ToolErrorBreakdown getToolErrorBreakdown(
      ToolName toolName, LocalDate start, LocalDate end) {
    List<AnalyticsEvent> events =
        aggregator.read(start, end).events().stream()
            .filter(e -> e.toolName() == toolName)
            .toList();
    return events.isEmpty() ? null : breakdown(events).get(0);
  }

  public List<ProblematicTool> getProblematicTools(LocalDate start, LocalDate end) {
    return getProblematicTools(start, end, DEFAULT_PROBLEM_THRESHOLD);
  }

  /**
   * Tools whose error rate is at least {@code threshold}, most severe first, then by rate.
   *
   * @param threshold minimum error rate, as a fraction
   */
  public List<ProblematicTool> getProblematicTools(
      LocalDate start, LocalDate end, double threshold) {
    List<ProblematicTool> problems = new ArrayList<>();
    for (ToolErrorBreakdown tool : breakdown(aggregator.read(start, end).events())) {
      if (tool.errorCount() == 0 || tool.errorRate() < threshold) continue;
      problems.add(
          new ProblematicTool(
              tool.toolName(),
              tool.errorRate(),
              tool.errorCount(),
              tool.invocationCount(),
              Severity.forRate(tool.errorRate()),
              dominant(tool.errorsByCategory())));
    }
    problems.sort(
        Comparator.comparing(ProblematicTool::severity)
            .thenComparing(Comparator.comparingDouble(ProblematicTool::errorRate).reversed()));
    return problems;
  }

  public ErrorTrend getErrorTrend(LocalDate start, LocalDate end) {
    return getErrorTrend(start, end, null);
  }

  /**
   * Daily error rate over the range and its direction.
   *
   * @param toolName restrict to one tool; {@code null} covers all tools
   */
  public ErrorTrend getErrorTrend(LocalDate start, LocalDate end, ToolName toolName) {
    ReadResult read = aggregator.read(start, end);
    Map<LocalDate, int[]> daily = new LinkedHashMap<>();
    for (LocalDate day : Metrics.days(read.start(), read.end())) {
      daily.put(day, new int[2]);
    }
    int invocations = 0;
    int errors = 0;
    for (AnalyticsEvent event : read.events()) {
      if (toolName != null && event.toolName() != toolName) continue;
      int[] counts = daily.get(event.partitionDate());
      if (counts == null) continue;
      counts[0]++;
      invocations++;
      if (!event.success()) {
        counts[1]++;
        errors++;
      }
    }
    List<ErrorTrendPoint> points = new ArrayList<>();
    List<Double> series = new ArrayList<>();
    daily.forEach(
        (day, counts) -> {
          double rate = Metrics.rate(counts[1], counts[0]);
          points.add(new ErrorTrendPoint(day.toString(), counts[0], counts[1], rate));
          series.add(rate);
        });
    return new ErrorTrend(
        toolName,
        points,
        Metrics.direction(series),
        Metrics.round(Metrics.changePercent(series), 1),
        Metrics.rate(errors, invocations));
  }

  /** Error counts per category, keyed by wire name. */
  public Map<String, Integer> getErrorsByCategory(LocalDate start, LocalDate end) {
    return categoryCounts(aggregator.read(start, end).events());
  }

  public boolean hasHighErrorRate(LocalDate start, LocalDate end) {
    return hasHighErrorRate(start, end, DEFAULT_HIGH_ERROR_RATE);
  }

  public boolean hasHighErrorRate(LocalDate start, LocalDate end, double threshold) {
    return getErrorStats(start, end).overallErrorRate() > threshold;
  }

  public ErrorSummary getSummary(LocalDate start, LocalDate end) {
    ErrorStats stats = getErrorStats(start, end);
    List<ProblematicTool> problems = getProblematicTools(start, end);
    return new ErrorSummary(
        stats.totalErrors(),
        stats.overallErrorRate(),
        problems.size(),
        (int) problems.stream().filter(p -> p.severity() == Severity.CRITICAL).count(),
        dominant(stats.byCategory()),
        getErrorTrend(start, end).trend());
  }

  private static List<ToolErrorBreakdown> breakdown(List<AnalyticsEvent> events) {
    List<ToolErrorBreakdown> result = new ArrayList<>();
    for (Map.Entry<ToolName, List<AnalyticsEvent>> entry : Metrics.byTool(events).entrySet()) {
      ToolMetrics metrics = UsageAggregator.toolMetrics(entry.getKey(), entry.getValue());
      result.add(
          new ToolErrorBreakdown(
              entry.getKey(),
              metrics.invocationCount(),
              metrics.errorCount(),
              metrics.errorRate(),
              metrics.errorsByCategory()));
    }
    return result;
  }

  private static Map<String, Integer> categoryCounts(List<AnalyticsEvent> events) {
    Map<String, Integer> counts = new TreeMap<>();
    for (AnalyticsEvent event : events) {
      if (event.success()) continue;
      ErrorCategory category =
          event.errorCategory() == null ? ErrorCategory.UNKNOWN : event.errorCategory();
      counts.merge(category.value(), 1, Integer::sum);
    }
    return counts;
  }

  private static ErrorCategory dominant(Map<String, Integer> counts) {
    return counts.entrySet().stream()
        .max(Map.Entry.comparingByValue())
        .map(e -> ErrorCategory.fromValue(e.getKey()))
        .orElse(null);
  }
}
