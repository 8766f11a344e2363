package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.ToolName;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns aggregated usage and error figures into human-readable insights.
 *
 * <p>Four groups are produced: popularity (what is used and what is not), reliability (error
 * rates), performance (slow and fast tools) and trend (usage and error direction). Until {@link
 * InsightOptions#minInvocations()} invocations exist only a "collecting data" insight is
 * returned.
 */
public class InsightsGenerator {

  static final double UNDERUTILIZED_SHARE = 0.05;
  static final double CONCENTRATED_SHARE = 0.80;
  static final long FAST_RESPONSE_MS = 100L;
  static final int MIN_TREND_ACTIVE_DAYS = 3;

  private final UsageAggregator aggregator;
  private final ErrorTracker errorTracker;
  private final InsightOptions options;
  private final Clock clock;

  public InsightsGenerator(
      UsageAggregator aggregator, ErrorTracker errorTracker, InsightOptions options, Clock clock) {
    this.aggregator = aggregator;
    this.errorTracker = errorTracker;
    this.options = options == null ? InsightOptions.defaults() : options;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /** All insights for the range, most urgent first. */
  public List<Insight> generateInsights(LocalDate start, LocalDate end) {
    UsageStats stats = aggregator.getUsageStats(start, end);
    IdSequence ids = new IdSequence();
    List<Insight> insights = new ArrayList<>();

    if (stats.totalInvocations() < options.minInvocations()) {
      insights.add(
          new Insight(
              ids.next(Insight.Category.POPULARITY, null),
              Insight.Category.POPULARITY,
              Insight.Severity.INFO,
              "Collecting Data",
              "Only %d invocation(s) recorded so far; insights appear after %d."
                  .formatted(stats.totalInvocations(), options.minInvocations()),
              null,
              "Keep using the reasoning tools to build up a usage history.",
              (double) stats.totalInvocations()));
      return insights;
    }

    insights.addAll(popularity(stats, ids));
    insights.addAll(reliability(start, end, ids));
    insights.addAll(performance(stats, ids));
    insights.addAll(trends(start, end, ids));
    insights.sort(
        Comparator.comparing(Insight::severity).thenComparing(Insight::category));
    return insights;
  }

  public InsightsReport generateReport(LocalDate start, LocalDate end) {
    UsageStats stats = aggregator.getUsageStats(start, end);
    List<Insight> insights = generateInsights(start, end);
    return new InsightsReport(
        Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString(),
        stats.periodStart(),
        stats.periodEnd(),
        insights,
        insights.size(),
        count(insights, Insight.Severity.CRITICAL),
        count(insights, Insight.Severity.WARNING),
        count(insights, Insight.Severity.INFO),
        count(insights, Insight.Severity.SUCCESS));
  }

  public InsightsSummary getSummary(LocalDate start, LocalDate end) {
    return summarize(generateInsights(start, end), aggregator.getUsageStats(start, end));
  }

  InsightsSummary summarize(List<Insight> insights, UsageStats stats) {
    int critical = count(insights, Insight.Severity.CRITICAL);
    int warnings = count(insights, Insight.Severity.WARNING);
    InsightsSummary.HealthStatus health;
    String line;
    if (critical > 0) {
      health = InsightsSummary.HealthStatus.CRITICAL;
      line = "%d critical issue(s) need immediate attention.".formatted(critical);
    } else if (warnings > 0) {
      health = InsightsSummary.HealthStatus.NEEDS_ATTENTION;
      line = "%d warning(s) worth reviewing.".formatted(warnings);
    } else {
      health = InsightsSummary.HealthStatus.HEALTHY;
      line =
          "%d invocation(s) across %d tool(s), no issues found."
              .formatted(stats.totalInvocations(), stats.uniqueTools());
    }
    String top =
        insights.stream()
            .filter(
                i ->
                    i.severity() == Insight.Severity.CRITICAL
                        || i.severity() == Insight.Severity.WARNING)
            .map(Insight::recommendation)
            .filter(r -> r != null && !r.isBlank())
            .findFirst()
            .orElse(null);
    return new InsightsSummary(health, line, insights.size(), critical, warnings, top);
  }

  /** One line per insight, prefixed with a severity marker. */
  public static String formatInsights(List<Insight> insights) {
    if (insights.isEmpty()) {
      return "No insights available.";
    }
    StringBuilder sb = new StringBuilder();
    for (Insight insight : insights) {
      sb.append(marker(insight.severity()))
          .append(' ')
          .append(insight.title())
          .append(": ")
          .append(insight.description());
      if (insight.recommendation() != null) {
        sb.append("\n    -> ").append(insight.recommendation());
      }
      sb.append('\n');
    }
    return sb.toString().stripTrailing();
  }

  public String generateTextReport(LocalDate start, LocalDate end) {
    InsightsReport report = generateReport(start, end);
    UsageStats stats = aggregator.getUsageStats(start, end);
    InsightsSummary summary = summarize(report.insights(), stats);
    return String.join(
        "\n",
        "Usage Insights (" + report.periodStart() + " to " + report.periodEnd() + ")",
        "Health: " + summary.healthStatus().value(),
        summary.summary(),
        "",
        "Invocations: %d  Errors: %d (%s)  Sessions: %d"
            .formatted(
                stats.totalInvocations(),
                stats.totalErrors(),
                percent(stats.overallErrorRate()),
                stats.uniqueSessions()),
        "",
        formatInsights(report.insights()));
  }

  private List<Insight> popularity(UsageStats stats, IdSequence ids) {
    List<Insight> insights = new ArrayList<>();
    ToolMetrics top = stats.tools().get(0);
    double topShare = (double) top.invocationCount() / stats.totalInvocations();
    insights.add(
        new Insight(
            ids.next(Insight.Category.POPULARITY, top.toolName()),
            Insight.Category.POPULARITY,
            Insight.Severity.INFO,
            "Most Popular: " + top.toolName(),
            "%s accounts for %s of all invocations (%d)."
                .formatted(top.toolName(), percent(topShare), top.invocationCount()),
            top.toolName(),
            null,
            topShare));

    List<ToolName> underused =
        stats.tools().stream()
            .filter(
                t -> (double) t.invocationCount() / stats.totalInvocations() < UNDERUTILIZED_SHARE)
            .map(ToolMetrics::toolName)
            .toList();
    if (!underused.isEmpty()) {
      insights.add(
          new Insight(
              ids.next(Insight.Category.POPULARITY, null),
              Insight.Category.POPULARITY,
              Insight.Severity.INFO,
              "Underutilized Tools",
              "Each below %s of usage: %s."
                  .formatted(percent(UNDERUTILIZED_SHARE), join(underused)),
              null,
              underused.get(0).suggestion(),
              (double) underused.size()));
    }

    Set<ToolName> unused = EnumSet.allOf(ToolName.class);
    stats.tools().forEach(t -> unused.remove(t.toolName()));
    if (!unused.isEmpty()) {
      ToolName first = unused.iterator().next();
      insights.add(
          new Insight(
              ids.next(Insight.Category.POPULARITY, null),
              Insight.Category.POPULARITY,
              Insight.Severity.INFO,
              "Unexplored Tools",
              "%d tool(s) have not been used yet: %s."
                  .formatted(unused.size(), join(List.copyOf(unused))),
              null,
              "Try %s: %s".formatted(first, first.suggestion()),
              (double) unused.size()));
    }

    if (stats.tools().size() > 2) {
      int topTwo = stats.tools().get(0).invocationCount() + stats.tools().get(1).invocationCount();
      double share = (double) topTwo / stats.totalInvocations();
      if (share > CONCENTRATED_SHARE) {
        insights.add(
            new Insight(
                ids.next(Insight.Category.POPULARITY, null),
                Insight.Category.POPULARITY,
                Insight.Severity.INFO,
                "Concentrated Usage",
                "%s and %s make up %s of all invocations."
                    .formatted(
                        stats.tools().get(0).toolName(),
                        stats.tools().get(1).toolName(),
                        percent(share)),
                null,
                "Other tools may fit some of these problems better.",
                share));
      }
    }
    return insights;
  }

  private List<Insight> reliability(LocalDate start, LocalDate end, IdSequence ids) {
    List<Insight> insights = new ArrayList<>();
    for (ErrorTracker.ProblematicTool tool :
        errorTracker.getProblematicTools(start, end, options.errorRateThreshold())) {
      Insight.Severity severity =
          switch (tool.severity()) {
            case CRITICAL -> Insight.Severity.CRITICAL;
            case WARNING -> Insight.Severity.WARNING;
            case INFO -> Insight.Severity.INFO;
          };
      String category =
          tool.dominantCategory() == null ? "unknown" : tool.dominantCategory().value();
      insights.add(
          new Insight(
              ids.next(Insight.Category.RELIABILITY, tool.toolName()),
              Insight.Category.RELIABILITY,
              severity,
              "Error Rate: " + tool.toolName(),
              "%s fails %s of the time (%d of %d), mostly %s errors."
                  .formatted(
                      tool.toolName(),
                      percent(tool.errorRate()),
                      tool.errorCount(),
                      tool.invocationCount(),
                      category),
              tool.toolName(),
              "validation".equals(category)
                  ? "Check the required arguments passed to " + tool.toolName() + "."
                  : "Review recent failures of " + tool.toolName() + ".",
              tool.errorRate()));
    }
    if (insights.isEmpty()) {
      insights.add(
          new Insight(
              ids.next(Insight.Category.RELIABILITY, null),
              Insight.Category.RELIABILITY,
              Insight.Severity.SUCCESS,
              "Healthy Error Rates",
              "Every tool stays below a %s error rate."
                  .formatted(percent(options.errorRateThreshold())),
              null,
              null,
              null));
    }
    return insights;
  }

  private List<Insight> performance(UsageStats stats, IdSequence ids) {
    List<Insight> insights = new ArrayList<>();
    for (ToolMetrics tool : stats.tools()) {
      if (tool.avgDurationMs() <= options.slowResponseMs()) continue;
      boolean verySlow = tool.avgDurationMs() > options.slowResponseMs() * 3.0;
      insights.add(
          new Insight(
              ids.next(Insight.Category.PERFORMANCE, tool.toolName()),
              Insight.Category.PERFORMANCE,
              verySlow ? Insight.Severity.WARNING : Insight.Severity.INFO,
              "Slow Responses: " + tool.toolName(),
              "%s averages %.0fms (p95 %dms)."
                  .formatted(tool.toolName(), tool.avgDurationMs(), tool.p95DurationMs()),
              tool.toolName(),
              "Consider smaller inputs for " + tool.toolName() + ".",
              tool.avgDurationMs()));
    }
    stats.tools().stream()
        .filter(t -> t.avgDurationMs() < FAST_RESPONSE_MS)
        .min(Comparator.comparingDouble(ToolMetrics::avgDurationMs))
        .ifPresent(
            fastest ->
                insights.add(
                    new Insight(
                        ids.next(Insight.Category.PERFORMANCE, fastest.toolName()),
                        Insight.Category.PERFORMANCE,
                        Insight.Severity.SUCCESS,
                        "Fastest Tool: " + fastest.toolName(),
                        "%s responds in %.0fms on average."
                            .formatted(fastest.toolName(), fastest.avgDurationMs()),
                        fastest.toolName(),
                        null,
                        fastest.avgDurationMs())));
    return insights;
  }

  private List<Insight> trends(LocalDate start, LocalDate end, IdSequence ids) {
    List<Insight> insights = new ArrayList<>();
    for (UsageTrend trend : aggregator.getUsageTrends(start, end)) {
      if (trend.activeDays() < MIN_TREND_ACTIVE_DAYS
          || trend.direction() == TrendDirection.STABLE
          || Math.abs(trend.changePercent()) < options.trendChangePercent()) {
        continue;
      }
      boolean rising = trend.direction() == TrendDirection.INCREASING;
      insights.add(
          new Insight(
              ids.next(Insight.Category.TREND, trend.toolName()),
              Insight.Category.TREND,
              Insight.Severity.INFO,
              (rising ? "Rising Usage: " : "Declining Usage: ") + trend.toolName(),
              "%s usage changed by %+.1f%% over the period."
                  .formatted(trend.toolName(), trend.changePercent()),
              trend.toolName(),
              null,
              trend.changePercent()));
    }

    ErrorTracker.ErrorTrend errorTrend = errorTracker.getErrorTrend(start, end);
    if (errorTrend.trend() == TrendDirection.INCREASING) {
      insights.add(
          new Insight(
              ids.next(Insight.Category.TREND, null),
              Insight.Category.TREND,
              Insight.Severity.WARNING,
              "Error Rate Rising",
              "The daily error rate rose by %+.1f%% over the period."
                  .formatted(errorTrend.changePercent()),
              null,
              "Look at which tools started failing recently.",
              errorTrend.changePercent()));
    } else if (errorTrend.trend() == TrendDirection.DECREASING) {
      insights.add(
          new Insight(
              ids.next(Insight.Category.TREND, null),
              Insight.Category.TREND,
              Insight.Severity.SUCCESS,
              "Error Rate Falling",
              "The daily error rate fell by %.1f%% over the period."
                  .formatted(Math.abs(errorTrend.changePercent())),
              null,
              null,
              errorTrend.changePercent()));
    }
    return insights;
  }

  private static int count(List<Insight> insights, Insight.Severity severity) {
    return (int) insights.stream().filter(i -> i.severity() == severity).count();
  }

  private static String marker(Insight.Severity severity) {
    return switch (severity) {
      case CRITICAL -> "[CRITICAL]";
      case WARNING -> "[WARNING]";
      case INFO -> "[INFO]";
      case SUCCESS -> "[OK]";
    };
  }

  private static String percent(double fraction) {
    return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
  }

  private static String join(List<ToolName> tools) {
    return tools.stream().map(ToolName::value).collect(Collectors.joining(", "));
  }

  private static final class IdSequence {
    private int next = 1;

    String next(Insight.Category category, ToolName tool) {
      return String.join(
          "-",
          Arrays.asList(
              category.value(), tool == null ? "general" : tool.value(), String.valueOf(next++)));
    }
  }
}
