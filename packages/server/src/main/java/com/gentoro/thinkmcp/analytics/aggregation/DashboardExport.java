package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.StorageInfo;
import java.util.List;

/** Dashboard document. Sections that were not requested are {@code null} and left out of JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "summary"})
public record DashboardExport(
    Metadata metadata,
    Summary summary,
    UsageStats usageStats,
    List<PopularityEntry> popularityRanking,
    List<ResponseTime> responseTimes,
    List<TimeSeriesPoint> dailyCounts,
    List<PeriodCount> weeklyCounts,
    List<PeriodCount> monthlyCounts,
    List<UsageTrend> trends,
    ErrorTracker.ErrorStats errorStats,
    List<ErrorTracker.ProblematicTool> problematicTools,
    ErrorTracker.ErrorTrend errorTrend,
    InsightsReport insightsReport,
    InsightsSummary insightsSummary,
    List<AnalyticsEvent> rawEvents,
    StorageInfo storageInfo) {

  public record Metadata(
      String version,
      String generatedAt,
      String periodStart,
      String periodEnd,
      long periodDays,
      String privacyVersion,
      boolean analyticsEnabled,
      IncludedSections options) {}

  /** The section flags an export was produced with. */
  public record IncludedSections(
      boolean includeRawEvents,
      boolean includeStats,
      boolean includeInsights,
      boolean includeErrors,
      boolean includeTrends) {

    static IncludedSections of(ExportOptions options) {
      return new IncludedSections(
          options.includeRawEvents(),
          options.includeStats(),
          options.includeInsights(),
          options.includeErrors(),
          options.includeTrends());
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Summary(
      int totalInvocations,
      int uniqueSessions,
      double successRate,
      double errorRate,
      ToolName mostPopularTool,
      ToolName highestErrorRateTool,
      String healthStatus,
      int toolsUsed,
      int insightsCount,
      int criticalIssuesCount,
      int warningsCount) {}
}
