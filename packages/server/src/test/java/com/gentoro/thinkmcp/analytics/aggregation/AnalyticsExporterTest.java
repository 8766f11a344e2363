package com.gentoro.thinkmcp.analytics.aggregation;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("AnalyticsExporter")
class AnalyticsExporterTest {

  private static final ExportOptions RANGE =
      ExportOptions.defaults().withRange(ErrorTrackerTest.START, TODAY);

  @TempDir Path dir;
  private AnalyticsExporter exporter;

  @BeforeEach
  void setUp() {
    FileAnalyticsStorage storage = new FileAnalyticsStorage(dir.resolve("analytics"), 90, CLOCK);
    store(storage, ErrorTrackerTest.mixedEvents());
    UsageAggregator aggregator = new UsageAggregator(storage);
    ErrorTracker errorTracker = new ErrorTracker(storage);
    InsightsGenerator insights =
        new InsightsGenerator(aggregator, errorTracker, InsightOptions.defaults(), CLOCK);
    exporter =
        new AnalyticsExporter(storage, aggregator, errorTracker, insights, () -> true, CLOCK);
  }

  @Test
  @DisplayName("the default export carries metadata, summary and all aggregate sections")
  void defaultExport() {
    ExportResult result = exporter.exportForDashboard(RANGE);

    assertTrue(result.success());
    DashboardExport data = result.data();
    assertEquals("1.0.0", data.metadata().version());
    assertEquals("2025-06-15T12:00:00Z", data.metadata().generatedAt());
    assertEquals("2025-06-12", data.metadata().periodStart());
    assertEquals(4, data.metadata().periodDays());
    assertTrue(data.metadata().analyticsEnabled());

    assertEquals(19, data.summary().totalInvocations());
    assertEquals(17.0 / 19.0, data.summary().successRate(), 1e-9);
    assertEquals(ToolName.DEBUG, data.summary().mostPopularTool());
    assertEquals(ToolName.TRACE, data.summary().highestErrorRateTool());
    assertEquals("critical", data.summary().healthStatus());
    assertEquals(1, data.summary().criticalIssuesCount());

    assertNotNull(data.usageStats());
    assertNotNull(data.dailyCounts());
    assertNotNull(data.errorTrend());
    assertNotNull(data.insightsReport());
    assertNull(data.rawEvents());
    assertEquals(3, data.storageInfo().totalFiles());
  }

  @Test
  @DisplayName("the minimal export leaves every optional section out of the JSON")
  void minimalExport() throws Exception {
    ExportResult result =
        exporter.exportForDashboard(
            ExportOptions.minimal().withRange(ErrorTrackerTest.START, TODAY));

    JsonNode root = JacksonUtility.getJsonMapper().readTree(result.json());
    List<String> fields = new ArrayList<>();
    root.fieldNames().forEachRemaining(fields::add);
    assertEquals(List.of("metadata", "summary", "storageInfo"), fields);
    assertFalse(root.get("metadata").get("options").get("includeStats").asBoolean());
    assertFalse(result.json().contains("\n"));
  }

  @Test
  @DisplayName("raw events carry only the stored event fields")
  void rawEvents() throws Exception {
    ExportResult result = exporter.exportForDashboard(RANGE.withRawEvents(true));

    assertEquals(19, result.data().rawEvents().size());
    JsonNode first = JacksonUtility.getJsonMapper().readTree(result.json()).get("rawEvents").get(0);
    List<String> fields = new ArrayList<>();
    first.fieldNames().forEachRemaining(fields::add);
    assertEquals(List.of("toolName", "timestamp", "success", "durationMs", "sessionId"), fields);
  }

  @Test
  @DisplayName("exporting to a file writes the same JSON document")
  void exportToFile() throws Exception {
    Path target = dir.resolve("out").resolve("export.json");

    ExportResult result = exporter.exportToFile(target, RANGE);

    assertTrue(result.success());
    assertEquals(target.toString(), result.filePath());
    assertEquals(result.json(), Files.readString(target));
  }
}
