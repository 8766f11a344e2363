package com.gentoro.thinkmcp.analytics.aggregation;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("InsightsGenerator")
class InsightsGeneratorTest {

  private static final LocalDate START = ErrorTrackerTest.START;

  @TempDir Path dir;
  private FileAnalyticsStorage storage;
  private InsightsGenerator generator;

  @BeforeEach
  void setUp() {
    storage = new FileAnalyticsStorage(dir, 90, CLOCK);
    UsageAggregator aggregator = new UsageAggregator(storage);
    generator =
        new InsightsGenerator(
            aggregator, new ErrorTracker(storage), InsightOptions.defaults(), CLOCK);
  }

  @Test
  @DisplayName("too little data yields a single collecting-data insight")
  void collectingData() {
    store(storage, repeat(ToolName.TRACE, TODAY, 3, 10));

    List<Insight> insights = generator.generateInsights(START, TODAY);
    assertEquals(1, insights.size());
    assertEquals("Collecting Data", insights.get(0).title());
    assertEquals("popularity-general-1", insights.get(0).id());
    assertEquals(3.0, insights.get(0).metric());
  }

  @Test
  @DisplayName("insights cover popularity, reliability, performance and trend, urgent first")
  void mixedInsights() {
    store(storage, ErrorTrackerTest.mixedEvents());

    List<Insight> insights = generator.generateInsights(START, TODAY);
    List<String> titles = insights.stream().map(Insight::title).toList();

    assertEquals("Error Rate: trace", titles.get(0));
    assertEquals(Insight.Severity.CRITICAL, insights.get(0).severity());
    assertEquals("Error Rate: debug", titles.get(1));
    assertEquals("Error Rate Rising", titles.get(2));
    assertTrue(titles.contains("Most Popular: debug"));
    assertTrue(titles.contains("Unexplored Tools"));
    assertTrue(titles.contains("Fastest Tool: model"));
    assertFalse(titles.contains("Concentrated Usage"));
    assertEquals(6, insights.size());
  }

  @Test
  @DisplayName("the report counts insights per severity")
  void report() {
    store(storage, ErrorTrackerTest.mixedEvents());

    InsightsReport report = generator.generateReport(START, TODAY);
    assertEquals("2025-06-15T12:00:00Z", report.generatedAt());
    assertEquals(6, report.totalInsights());
    assertEquals(1, report.criticalCount());
    assertEquals(2, report.warningCount());
    assertEquals(2, report.infoCount());
    assertEquals(1, report.successCount());
  }

  @Test
  @DisplayName("critical insights make the health critical with a top recommendation")
  void summaryCritical() {
    store(storage, ErrorTrackerTest.mixedEvents());

    InsightsSummary summary = generator.getSummary(START, TODAY);
    assertEquals(InsightsSummary.HealthStatus.CRITICAL, summary.healthStatus());
    assertEquals("Check the required arguments passed to trace.", summary.topRecommendation());

    String text = generator.generateTextReport(START, TODAY);
    assertTrue(text.contains("Health: critical"), text);
    assertTrue(text.contains("[CRITICAL] Error Rate: trace"), text);
    assertTrue(text.contains("Invocations: 19  Errors: 2 (10.5%)"), text);
  }

  @Test
  @DisplayName("clean usage is reported as healthy")
  void summaryHealthy() {
    store(storage, repeat(ToolName.MODEL, TODAY, 12, 20));

    InsightsSummary summary = generator.getSummary(START, TODAY);
    assertEquals(InsightsSummary.HealthStatus.HEALTHY, summary.healthStatus());
    assertNull(summary.topRecommendation());
    assertTrue(
        generator.generateInsights(START, TODAY).stream()
            .anyMatch(i -> i.title().equals("Healthy Error Rates")));
  }

  @Test
  @DisplayName("an empty list formats to a fixed message")
  void formatEmpty() {
    assertEquals("No insights available.", InsightsGenerator.formatInsights(List.of()));
  }
}
