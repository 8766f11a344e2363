package com.gentoro.thinkmcp.analytics.aggregation;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.utility.FileUtility;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Builds the dashboard JSON document from the aggregation services.
 *
 * <p>Raw events are only included on request and always in their six-field stored shape, so an
 * export never carries more than what is on disk.
 */
public class AnalyticsExporter {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(AnalyticsExporter.class);

  public static final String EXPORT_FORMAT_VERSION = "1.0.0";
  public static final String PRIVACY_NOTICE_VERSION = "1.0.0";

  private final AnalyticsStorage storage;
  private final UsageAggregator aggregator;
  private final ErrorTracker errorTracker;
  private final InsightsGenerator insightsGenerator;
  private final BooleanSupplier analyticsEnabled;
  private final Clock clock;

  public AnalyticsExporter(
      AnalyticsStorage storage,
      UsageAggregator aggregator,
      ErrorTracker errorTracker,
      InsightsGenerator insightsGenerator,
      BooleanSupplier analyticsEnabled,
      Clock clock) {
    this.storage = storage;
    this.aggregator = aggregator;
    this.errorTracker = errorTracker;
    this.insightsGenerator = insightsGenerator;
    this.analyticsEnabled = analyticsEnabled;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public ExportResult exportForDashboard() {
    return exportForDashboard(ExportOptions.defaults());
  }

  public ExportResult exportForDashboard(ExportOptions options) {
    try {
      DashboardExport data = build(options);
      String json =
          options.prettyPrint() ? JacksonUtility.toJson(data) : JacksonUtility.toCompactJson(data);
      return new ExportResult(true, data, json, null, null);
    } catch (Exception e) {
      log.error("Failed to build analytics export", e);
      return ExportResult.failed(ExceptionUtil.describe(e));
    }
  }

  /** Export and write the JSON document to {@code target}. */
  public ExportResult exportToFile(Path target, ExportOptions options) {
    ExportResult result = exportForDashboard(options);
    if (!result.success()) {
      return result;
    }
    try {
      FileUtility.writeAtomically(target, result.json());
      log.info("Analytics export written to {}", target.toAbsolutePath());
      return new ExportResult(true, result.data(), result.json(), target.toString(), null);
    } catch (Exception e) {
      log.error("Failed to write analytics export to {}", target, e);
      return ExportResult.failed(ExceptionUtil.describe(e));
    }
  }

  public ExportResult exportMinimal() {
    return exportForDashboard(ExportOptions.minimal());
  }

  public ExportResult exportFull() {
    return exportForDashboard(ExportOptions.full());
  }

  private DashboardExport build(ExportOptions options) {
    LocalDate start = options.start();
    LocalDate end = options.end();
    UsageStats stats = aggregator.getUsageStats(start, end);
    LocalDate periodStart = LocalDate.parse(stats.periodStart());
    LocalDate periodEnd = LocalDate.parse(stats.periodEnd());

    InsightsReport report = insightsGenerator.generateReport(periodStart, periodEnd);
    InsightsSummary insightsSummary = insightsGenerator.summarize(report.insights(), stats);
    UsageSummary usageSummary = aggregator.getSummary(periodStart, periodEnd);

    DashboardExport.Metadata metadata =
        new DashboardExport.Metadata(
            EXPORT_FORMAT_VERSION,
            Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString(),
            stats.periodStart(),
            stats.periodEnd(),
            Math.max(0, ChronoUnit.DAYS.between(periodStart, periodEnd) + 1),
            PRIVACY_NOTICE_VERSION,
            analyticsEnabled.getAsBoolean(),
            DashboardExport.IncludedSections.of(options));

    DashboardExport.Summary summary =
        new DashboardExport.Summary(
            stats.totalInvocations(),
            stats.uniqueSessions(),
            Metrics.rate(stats.totalSuccesses(), stats.totalInvocations()),
            stats.overallErrorRate(),
            usageSummary.mostPopularTool(),
            usageSummary.highestErrorRateTool(),
            insightsSummary.healthStatus().value(),
            stats.uniqueTools(),
            report.totalInsights(),
            report.criticalCount(),
            report.warningCount());

    boolean withStats = options.includeStats();
    boolean withTrends = options.includeTrends();
    boolean withErrors = options.includeErrors();
    List<AnalyticsEvent> raw =
        options.includeRawEvents() ? storage.readEvents(periodStart, periodEnd).events() : null;

    return new DashboardExport(
        metadata,
        summary,
        withStats ? stats : null,
        withStats ? aggregator.getPopularityRanking(periodStart, periodEnd, 0) : null,
        withStats ? aggregator.getResponseTimes(periodStart, periodEnd) : null,
        withTrends ? aggregator.getDailyCounts(periodStart, periodEnd) : null,
        withTrends ? aggregator.getWeeklyCounts(periodStart, periodEnd) : null,
        withTrends ? aggregator.getMonthlyCounts(periodStart, periodEnd) : null,
        withTrends ? aggregator.getUsageTrends(periodStart, periodEnd) : null,
        withErrors ? errorTracker.getErrorStats(periodStart, periodEnd) : null,
        withErrors ? errorTracker.getProblematicTools(periodStart, periodEnd) : null,
        withErrors && withTrends ? errorTracker.getErrorTrend(periodStart, periodEnd) : null,
        options.includeInsights() ? report : null,
        options.includeInsights() ? insightsSummary : null,
        raw,
        storage.getStorageInfo());
  }
}
