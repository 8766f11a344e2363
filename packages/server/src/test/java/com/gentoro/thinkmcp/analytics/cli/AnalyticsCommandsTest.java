package com.gentoro.thinkmcp.analytics.cli;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.thinkmcp.StartupParameters;
import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.aggregation.InsightOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("AnalyticsCommands")
class AnalyticsCommandsTest {

  @TempDir Path dir;
  private AnalyticsContext context;
  private AnalyticsCommands commands;

  @BeforeEach
  void setUp() {
    context = new AnalyticsContext(configManager(dir), CLOCK, false, InsightOptions.defaults());
    commands = new AnalyticsCommands(context);
  }

  @AfterEach
  void tearDown() {
    context.shutdown();
  }

  private CommandResult run(String... args) {
    return commands.run(new StartupParameters(args));
  }

  private void seed() {
    store(
        context.storage(),
        List.of(
            ok(ToolName.TRACE, TODAY, 12),
            failed(ToolName.DEBUG, TODAY.minusDays(1), ErrorCategory.RUNTIME),
            ok(ToolName.MODEL, TODAY.minusDays(120), 3)));
  }

  @Test
  @DisplayName("enable records consent and turns recording on")
  void enable() {
    CommandResult result = run("--mode", "analytics", "--command", "enable");

    assertTrue(result.success());
    assertEquals(CommandResult.EXIT_OK, result.exitCode());
    assertTrue(result.message().startsWith("Analytics enabled."));
    assertTrue(result.message().contains(dir.resolve("analytics").toString()));
    assertTrue(context.collector().isEnabled());
  }

  @Test
  @DisplayName("disable keeps collected data unless asked to delete it")
  void disable() {
    run("--mode", "analytics", "--command", "enable");
    seed();

    CommandResult kept = run("--mode", "analytics", "--command", "disable");
    assertTrue(kept.message().startsWith("Analytics disabled. No further usage data"));
    assertFalse(context.collector().isEnabled());
    assertEquals(3, context.storage().getStorageInfo().totalEvents());

    CommandResult deleted =
        run("--mode", "analytics", "--command", "disable", "--delete-data", "--reason", "done");
    assertTrue(deleted.message().startsWith("Analytics disabled and all collected data deleted."));
    assertEquals(3, deleted.data().get("eventsDeleted"));
    assertEquals(0, context.storage().getStorageInfo().totalEvents());
  }

  @Test
  @DisplayName("status reports consent, storage and, when verbose, the value sources")
  void status() {
    seed();

    CommandResult result = run("--mode", "analytics", "--command", "status", "--verbose");

    assertTrue(result.success());
    assertTrue(result.message().contains("Status:          DISABLED"), result.message());
    assertTrue(result.message().contains("Total Events:    3"), result.message());
    assertTrue(result.message().contains("retentionDays:   DEFAULT"), result.message());
    assertEquals(Boolean.FALSE, result.data().get("enabled"));
    assertEquals(90, result.data().get("retentionDays"));
  }

  @Test
  @DisplayName("json export returns the dashboard document")
  void exportJson() {
    seed();

    CommandResult result =
        run(
            "--mode", "analytics", "--command", "export",
            "--start", "2025-06-01", "--end", "2025-06-15");

    assertTrue(result.success());
    assertTrue(result.message().contains("\"totalInvocations\" : 2"), result.message());
  }

  @Test
  @DisplayName("csv export writes one quoted row per event")
  void exportCsv() throws Exception {
    seed();
    Path output = dir.resolve("events.csv");

    CommandResult result = commands.export(TODAY.minusDays(7), TODAY, false, "csv", output);

    assertTrue(result.success());
    List<String> lines = Files.readAllLines(output);
    assertEquals("timestamp,toolName,success,durationMs,errorCategory,sessionId", lines.get(0));
    assertEquals(
        "\"2025-06-14T11:00:00Z\",\"debug\",\"false\",\"50\",\"runtime\",\"" + SESSION + "\"",
        lines.get(1));
    assertEquals(3, lines.size());
  }

  @Test
  @DisplayName("bad dates and formats are usage errors")
  void usageErrors() {
    CommandResult badDate =
        run("--mode", "analytics", "--command", "insights", "--start", "15/06/2025");
    assertEquals(CommandResult.EXIT_USAGE, badDate.exitCode());
    assertTrue(badDate.message().contains("expected YYYY-MM-DD"));

    CommandResult badFormat = run("--mode", "analytics", "--command", "export", "--format", "xml");
    assertEquals(CommandResult.EXIT_USAGE, badFormat.exitCode());
  }

  @Test
  @DisplayName("clear deletes everything and can drop the consent record")
  void clear() {
    run("--mode", "analytics", "--command", "enable");
    seed();

    CommandResult result = run("--mode", "analytics", "--command", "clear", "--delete-consent");

    assertTrue(result.success());
    assertTrue(result.message().startsWith("All analytics data has been deleted."));
    assertEquals(Boolean.TRUE, result.data().get("consentDeleted"));
    assertTrue(context.consentManager().isFirstRun());
  }

  @Test
  @DisplayName("cleanup applies the retention policy, optionally as a dry run")
  void cleanup() {
    seed();

    CommandResult dryRun = run("--mode", "analytics", "--command", "cleanup", "--dry-run");
    assertEquals(
        "Would delete 1 event(s) from 1 file(s) dated on or before 2025-03-17 (retention 90 days).",
        dryRun.message());
    assertEquals(3, context.storage().getStorageInfo().totalEvents());

    CommandResult real = run("--mode", "analytics", "--command", "cleanup");
    assertTrue(real.message().startsWith("Deleted 1 event(s)"));
    assertEquals(2, context.storage().getStorageInfo().totalEvents());
  }

  @Test
  @DisplayName("insights and privacy print text reports")
  void insightsAndPrivacy() {
    seed();

    assertTrue(
        run("--mode", "analytics", "--command", "insights").message().startsWith("Usage Insights"));
    assertEquals(
        PrivacyNotice.BRIEF,
        run("--mode", "analytics", "--command", "privacy", "--brief").message());
    assertEquals(PrivacyNotice.FULL, run("--mode", "analytics", "--command", "privacy").message());
  }

  @Test
  @DisplayName("byte sizes are shown in readable units")
  void formatBytes() {
    assertEquals("512 B", AnalyticsCommands.formatBytes(512));
    assertEquals("1.5 KB", AnalyticsCommands.formatBytes(1536));
    assertEquals("2.0 MB", AnalyticsCommands.formatBytes(2 * 1024 * 1024));
  }
}
