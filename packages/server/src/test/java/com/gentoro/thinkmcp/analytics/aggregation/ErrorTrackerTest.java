package com.gentoro.thinkmcp.analytics.aggregation;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ErrorTracker")
class ErrorTrackerTest {

  static final LocalDate START = TODAY.minusDays(3);

  @TempDir Path dir;
  private ErrorTracker tracker;

  /** trace 1/4 failed today, debug 1/10 failed yesterday, model 5 clean two days ago. */
  static List<AnalyticsEvent> mixedEvents() {
    List<AnalyticsEvent> events = new ArrayList<>(repeat(ToolName.TRACE, TODAY, 3, 10));
    events.add(failed(ToolName.TRACE, TODAY, ErrorCategory.VALIDATION));
    events.addAll(repeat(ToolName.DEBUG, TODAY.minusDays(1), 9, 10));
    events.add(failed(ToolName.DEBUG, TODAY.minusDays(1), ErrorCategory.RUNTIME));
    events.addAll(repeat(ToolName.MODEL, TODAY.minusDays(2), 5, 10));
    return events;
  }

  @BeforeEach
  void setUp() {
    FileAnalyticsStorage storage = new FileAnalyticsStorage(dir, 90, CLOCK);
    store(storage, mixedEvents());
    tracker = new ErrorTracker(storage);
  }

  @Test
  @DisplayName("error stats break errors down by category and tool")
  void errorStats() {
    ErrorTracker.ErrorStats stats = tracker.getErrorStats(START, TODAY);

    assertEquals(19, stats.totalInvocations());
    assertEquals(2, stats.totalErrors());
    assertEquals(Map.of("runtime", 1, "validation", 1), stats.byCategory());
    assertEquals(List.of(ToolName.TRACE, ToolName.DEBUG), stats.toolsByErrorRate());
    assertEquals(3, stats.byTool().size());
  }

  @Test
  @DisplayName("problematic tools are ranked by severity and respect the threshold")
  void problematicTools() {
    List<ErrorTracker.ProblematicTool> problems = tracker.getProblematicTools(START, TODAY);

    assertEquals(2, problems.size());
    assertEquals(ToolName.TRACE, problems.get(0).toolName());
    assertEquals(ErrorTracker.Severity.CRITICAL, problems.get(0).severity());
    assertEquals(ErrorCategory.VALIDATION, problems.get(0).dominantCategory());
    assertEquals(ToolName.DEBUG, problems.get(1).toolName());
    assertEquals(ErrorTracker.Severity.WARNING, problems.get(1).severity());

    assertEquals(1, tracker.getProblematicTools(START, TODAY, 0.2).size());
  }

  @Test
  @DisplayName("severity follows the critical and warning error rates")
  void severity() {
    assertEquals(ErrorTracker.Severity.CRITICAL, ErrorTracker.Severity.forRate(0.25));
    assertEquals(ErrorTracker.Severity.WARNING, ErrorTracker.Severity.forRate(0.10));
    assertEquals(ErrorTracker.Severity.INFO, ErrorTracker.Severity.forRate(0.09));
  }

  @Test
  @DisplayName("the error trend follows the daily error rate")
  void errorTrend() {
    ErrorTracker.ErrorTrend trend = tracker.getErrorTrend(START, TODAY);

    assertEquals(4, trend.dataPoints().size());
    assertEquals(0.0, trend.dataPoints().get(0).errorRate());
    assertEquals(0.25, trend.dataPoints().get(3).errorRate(), 1e-9);
    assertEquals(TrendDirection.INCREASING, trend.trend());
    assertEquals(2.0 / 19.0, trend.averageErrorRate(), 1e-9);

    ErrorTracker.ErrorTrend model = tracker.getErrorTrend(START, TODAY, ToolName.MODEL);
    assertEquals(TrendDirection.STABLE, model.trend());
    assertEquals(ToolName.MODEL, model.toolName());
  }

  @Test
  @DisplayName("high error rate checks compare the overall rate with a threshold")
  void highErrorRate() {
    assertTrue(tracker.hasHighErrorRate(START, TODAY));
    assertFalse(tracker.hasHighErrorRate(START, TODAY, 0.2));
  }

  @Test
  @DisplayName("summary and single-tool breakdowns")
  void summaryAndBreakdown() {
    ErrorTracker.ErrorSummary summary = tracker.getSummary(START, TODAY);
    assertEquals(2, summary.totalErrors());
    assertEquals(2, summary.problematicTools());
    assertEquals(1, summary.criticalTools());
    assertEquals(TrendDirection.INCREASING, summary.trend());

    ErrorTracker.ToolErrorBreakdown trace =
        tracker.getToolErrorBreakdown(ToolName.TRACE, START, TODAY);
    assertEquals(1, trace.errorCount());
    assertEquals(4, trace.invocationCount());
    assertNull(tracker.getToolErrorBreakdown(ToolName.MAP, START, TODAY));
  }
}
