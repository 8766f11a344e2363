package com.gentoro.thinkmcp.analytics.aggregation;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.ReadResult;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("UsageAggregator")
class UsageAggregatorTest {

  private static final LocalDate START = TODAY.minusDays(6);

  @TempDir Path dir;
  private UsageAggregator aggregator;

  @BeforeEach
  void setUp() {
    FileAnalyticsStorage storage = new FileAnalyticsStorage(dir, 90, CLOCK);
    List<AnalyticsEvent> events = new ArrayList<>(repeat(ToolName.TRACE, TODAY, 6, 10));
    events.add(failed(ToolName.TRACE, TODAY, ErrorCategory.VALIDATION));
    events.add(failed(ToolName.TRACE, TODAY, ErrorCategory.VALIDATION));
    events.add(ok(ToolName.MODEL, TODAY.minusDays(1), 100));
    events.add(ok(ToolName.MODEL, TODAY.minusDays(1), 300));
    events.add(ok(ToolName.DEBUG, TODAY.minusDays(20), 5));
    store(storage, events);
    aggregator = new UsageAggregator(storage);
  }

  @Test
  @DisplayName("usage stats cover the range only and order tools by use")
  void usageStats() {
    UsageStats stats = aggregator.getUsageStats(START, TODAY);

    assertEquals("2025-06-09", stats.periodStart());
    assertEquals(10, stats.totalInvocations());
    assertEquals(8, stats.totalSuccesses());
    assertEquals(2, stats.totalErrors());
    assertEquals(0.2, stats.overallErrorRate(), 1e-9);
    assertEquals(1, stats.uniqueSessions());
    assertEquals(
        List.of(ToolName.TRACE, ToolName.MODEL),
        stats.tools().stream().map(ToolMetrics::toolName).toList());
    assertEquals(List.of(ToolName.TRACE), stats.toolsNeedingAttention());
  }

  @Test
  @DisplayName("tool metrics carry durations, percentiles and error categories")
  void toolMetrics() {
    ToolMetrics trace = aggregator.getToolMetrics(ToolName.TRACE, START, TODAY);

    assertEquals(8, trace.invocationCount());
    assertEquals(0.25, trace.errorRate(), 1e-9);
    assertEquals(20.0, trace.avgDurationMs());
    assertEquals(10, trace.minDurationMs());
    assertEquals(50, trace.maxDurationMs());
    assertEquals(50, trace.p95DurationMs());
    assertEquals(Map.of("validation", 2), trace.errorsByCategory());
    assertEquals("2025-06-15T10:00:00Z", trace.firstInvocation());
    assertEquals("2025-06-15T11:00:00Z", trace.lastInvocation());

    assertNull(aggregator.getToolMetrics(ToolName.DEBUG, START, TODAY));
  }

  @Test
  @DisplayName("the summary names the most used, most failing and slowest tools")
  void summary() {
    UsageSummary summary = aggregator.getSummary(START, TODAY);
    assertEquals(ToolName.TRACE, summary.mostPopularTool());
    assertEquals(ToolName.TRACE, summary.highestErrorRateTool());
    assertEquals(ToolName.MODEL, summary.slowestTool());
  }

  @Test
  @DisplayName("popularity ranking assigns ranks and shares")
  void popularity() {
    List<PopularityEntry> ranking = aggregator.getPopularityRanking(START, TODAY, 1);
    assertEquals(1, ranking.size());
    assertEquals(new PopularityEntry(1, ToolName.TRACE, 8, 0.8), ranking.get(0));
    assertEquals(2, aggregator.getPopularityRanking(START, TODAY, 0).size());
  }

  @Test
  @DisplayName("daily series include empty days; weeks and months are grouped")
  void timeSeries() {
    List<TimeSeriesPoint> daily = aggregator.getDailyCounts(START, TODAY);
    assertEquals(7, daily.size());
    assertEquals(new TimeSeriesPoint("2025-06-09", 0), daily.get(0));
    assertEquals(new TimeSeriesPoint("2025-06-14", 2), daily.get(5));
    assertEquals(new TimeSeriesPoint("2025-06-15", 8), daily.get(6));

    assertEquals(
        List.of(new PeriodCount("2025-W24", 10)), aggregator.getWeeklyCounts(START, TODAY));
    assertEquals(
        List.of(new PeriodCount("2025-05", 0), new PeriodCount("2025-06", 10)),
        aggregator.getMonthlyCounts(LocalDate.of(2025, 5, 30), TODAY));
  }

  @Test
  @DisplayName("trends report direction and active days per tool")
  void trends() {
    UsageTrend trace =
        aggregator.getUsageTrends(START, TODAY).stream()
            .filter(t -> t.toolName() == ToolName.TRACE)
            .findFirst()
            .orElseThrow();
    assertEquals(TrendDirection.INCREASING, trace.direction());
    assertEquals(100.0, trace.changePercent());
    assertEquals(1, trace.activeDays());
    assertEquals(7, trace.dataPoints().size());
  }

  @Test
  @DisplayName("error rates and response times are reported per tool")
  void ratesAndResponseTimes() {
    assertEquals(0.25, aggregator.getErrorRates(START, TODAY).get(ToolName.TRACE), 1e-9);
    assertEquals(0.0, aggregator.getErrorRates(START, TODAY).get(ToolName.MODEL));

    List<ResponseTime> times = aggregator.getResponseTimes(START, TODAY);
    assertEquals(ToolName.MODEL, times.get(0).toolName());
    assertEquals(200.0, times.get(0).avgDurationMs());
  }

  @Test
  @DisplayName("an unreadable store aggregates as empty")
  void failedRead() {
    AnalyticsStorage broken = mock(AnalyticsStorage.class);
    when(broken.readEvents(START, TODAY)).thenReturn(ReadResult.failed(START, TODAY, "io"));

    UsageStats stats = new UsageAggregator(broken).getUsageStats(START, TODAY);
    assertEquals(0, stats.totalInvocations());
    assertEquals(0.0, stats.overallErrorRate());
    assertTrue(stats.tools().isEmpty());
  }
}
