package com.gentoro.thinkmcp.analytics.cli;

import com.gentoro.thinkmcp.StartupParameters;
import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.aggregation.ExportOptions;
import com.gentoro.thinkmcp.analytics.aggregation.ExportResult;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfig;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import com.gentoro.thinkmcp.analytics.consent.ConsentResult;
import com.gentoro.thinkmcp.analytics.consent.ConsentStatus;
import com.gentoro.thinkmcp.analytics.deletion.DeletionOptions;
import com.gentoro.thinkmcp.analytics.deletion.DeletionResult;
import com.gentoro.thinkmcp.analytics.retention.RetentionCleanupResult;
import com.gentoro.thinkmcp.analytics.storage.ReadResult;
import com.gentoro.thinkmcp.analytics.storage.StorageInfo;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.utility.FileUtility;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operator commands for the analytics subsystem: opt in and out, inspect, export, delete and run
 * retention by hand.
 *
 * <p>Commands never throw; every failure is reported through a {@link CommandResult} with a
 * non-zero exit code.
 */
public class AnalyticsCommands {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(AnalyticsCommands.class);

  private static final String RULE = "=".repeat(72);

  private final AnalyticsContext context;

  public AnalyticsCommands(AnalyticsContext context) {
    this.context = context;
  }

  /** Dispatch {@code --command} with the remaining startup parameters as options. */
  public CommandResult run(StartupParameters parameters) {
    String command = parameters.getOptionalParameter("command", String.class).orElse("status");
    try {
      return switch (command) {
        case "enable" -> enable();
        case "disable" ->
            disable(
                parameters.isFlagSet("delete-data"),
                parameters.getOptionalParameter("reason", String.class).orElse(null));
        case "status" -> status(parameters.isFlagSet("verbose"));
        case "export" ->
            export(
                date(parameters, "start"),
                date(parameters, "end"),
                parameters.isFlagSet("raw-events"),
                parameters.getOptionalParameter("format", String.class).orElse("json"),
                parameters.getOptionalParameter("output", String.class).map(Path::of).orElse(null));
        case "clear" ->
            clear(
                parameters.isFlagSet("delete-consent"),
                parameters.getOptionalParameter("reason", String.class).orElse(null));
        case "cleanup" -> cleanup(parameters.isFlagSet("dry-run"));
        case "insights" -> insights(date(parameters, "start"), date(parameters, "end"));
        case "privacy" -> privacy(parameters.isFlagSet("brief"));
        default -> CommandResult.usage("Unknown analytics command: " + command);
      };
    } catch (IllegalArgumentException e) {
      return CommandResult.usage(e.getMessage());
    } catch (Exception e) {
      log.error("Analytics command '{}' failed", command, e);
      return CommandResult.failed(
          "Analytics command '%s' failed: %s".formatted(command, ExceptionUtil.describe(e)));
    }
  }

  /** Record consent and persist {@code enabled=true}. */
  public CommandResult enable() {
    ConsentResult result = context.consentManager().grantConsent(true);
    if (!result.success()) {
      return CommandResult.failed("Failed to enable analytics: " + result.error());
    }
    return CommandResult.ok(
        String.join(
            "\n",
            "Analytics enabled. Thank you for helping improve think-mcp.",
            PrivacyNotice.SUMMARY,
            "Data location: " + context.storage().getStoragePath()));
  }

  /**
   * Withdraw consent and persist {@code enabled=false}; optionally delete everything collected so
   * far.
   */
  public CommandResult disable(boolean deleteData, String reason) {
    ConsentResult result = context.consentManager().withdrawConsent(true);
    if (!result.success()) {
      return CommandResult.failed("Failed to disable analytics: " + result.error());
    }
    if (!deleteData) {
      return CommandResult.ok(
          String.join(
              "\n",
              "Analytics disabled. No further usage data will be recorded.",
              "Data already collected is kept until it expires or is cleared."));
    }
    DeletionResult deletion =
        context
            .deletionManager()
            .deleteAllData(
                DeletionOptions.defaults()
                    .withReason(reason == null ? "analytics disabled" : reason));
    if (!deletion.success()) {
      return CommandResult.failed(
          "Analytics disabled, but deleting collected data failed: " + deletion.error());
    }
    return CommandResult.ok(
        "Analytics disabled and all collected data deleted.\n"
            + context.deletionManager().getSuccessMessage(deletion),
        deletionData(deletion));
  }

  public CommandResult status(boolean verbose) {
    AnalyticsConfigManager configManager = context.configManager();
    AnalyticsConfig config = configManager.resolve().config();
    ConsentStatus consent = context.consentManager().getConsentStatus();
    StorageInfo storage = context.storage().getStorageInfo();
    boolean recording = context.collector().isEnabled();

    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add("ANALYTICS STATUS");
    lines.add(RULE);
    lines.add("  Status:          " + (recording ? "ENABLED" : "DISABLED"));
    lines.add("  Config Enabled:  " + yesNo(config.enabled()));
    lines.add("  Consent Given:   " + yesNo(consent.hasConsented()));
    if (consent.consentedAt() != null) {
      lines.add("  Consented At:    " + consent.consentedAt());
    }
    if (consent.withdrawnAt() != null) {
      lines.add("  Withdrawn At:    " + consent.withdrawnAt());
    }
    lines.add("  Policy Version:  " + consent.policyVersion());
    if (consent.needsReConsent()) {
      lines.add("");
      lines.add("  Re-consent needed due to policy update (current " + PrivacyNotice.VERSION + ")");
    }
    lines.add("");
    lines.add("  STORAGE");
    lines.add("  Path:            " + storage.storagePath());
    lines.add("  Total Files:     " + storage.totalFiles());
    lines.add("  Total Events:    " + storage.totalEvents());
    lines.add("  Total Size:      " + formatBytes(storage.totalBytes()));
    if (storage.oldestDate() != null) {
      lines.add("  Date Range:      " + storage.oldestDate() + " to " + storage.newestDate());
    }
    lines.add("  Retention:       " + config.retentionDays() + " days");
    if (verbose) {
      lines.add("");
      lines.add("  CONFIGURATION");
      lines.add("  Batch Size:      " + config.batchSize() + " events");
      lines.add("  Flush Interval:  " + config.flushIntervalMs() / 1000 + " seconds");
      configManager
          .getSources()
          .forEach((field, source) -> lines.add("  %-16s %s".formatted(field.key() + ":", source)));
      configManager.validate().warnings().forEach(w -> lines.add("  Warning: " + w));
    }
    lines.add("");
    lines.add("  COMMANDS");
    lines.add(PrivacyNotice.QUICK_REFERENCE);
    lines.add(RULE);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("enabled", recording);
    data.put("consent", consent);
    data.put("retentionDays", config.retentionDays());
    data.put("storage", storage);
    data.put("collector", context.collector().getStats());
    return CommandResult.ok(String.join("\n", lines), data);
  }

  /**
   * Export collected data. {@code json} writes the dashboard document; {@code csv} writes the raw
   * events, one per line.
   *
   * @param output target file; {@code null} returns the document in the message
   */
  public CommandResult export(
      LocalDate start, LocalDate end, boolean rawEvents, String format, Path output) {
    String normalized = format == null ? "json" : format.toLowerCase(Locale.ROOT);
    if (normalized.equals("csv")) {
      return exportCsv(start, end, output);
    }
    if (!normalized.equals("json")) {
      return CommandResult.usage("Unsupported export format: " + format);
    }
    ExportOptions options = ExportOptions.defaults().withRange(start, end).withRawEvents(rawEvents);
    ExportResult result =
        output == null
            ? context.exporter().exportForDashboard(options)
            : context.exporter().exportToFile(output, options);
    if (!result.success()) {
      return CommandResult.failed("Failed to export analytics data: " + result.error());
    }
    if (output != null) {
      return CommandResult.ok(
          "Analytics export written to " + result.filePath(),
          Map.of("filePath", result.filePath()));
    }
    return CommandResult.ok(result.json());
  }

  /** Delete all collected data through the deletion manager. */
  public CommandResult clear(boolean deleteConsent, String reason) {
    DeletionResult result =
        context
            .deletionManager()
            .deleteAllData(
                DeletionOptions.defaults().withDeleteConsent(deleteConsent).withReason(reason));
    if (!result.success()) {
      return CommandResult.failed(context.deletionManager().formatResult(result));
    }
    return CommandResult.ok(
        "All analytics data has been deleted.\n" + context.deletionManager().formatResult(result),
        deletionData(result));
  }

  /** Apply the retention policy now. */
  public CommandResult cleanup(boolean dryRun) {
    RetentionCleanupResult result = context.retentionEnforcer().runCleanup(dryRun);
    if (!result.success()) {
      return CommandResult.failed("Retention cleanup failed: " + result.error());
    }
    String verb = dryRun ? "Would delete" : "Deleted";
    String message =
        "%s %d event(s) from %d file(s) dated on or before %s (retention %d days)."
            .formatted(
                verb,
                result.eventsDeleted(),
                result.filesDeleted(),
                result.cutoffDate(),
                result.retentionDays());
    if (result.pendingEventsDiscarded() > 0) {
      message +=
          "\n%s %d unsaved event(s)."
              .formatted(dryRun ? "Would discard" : "Discarded", result.pendingEventsDiscarded());
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("result", result);
    return CommandResult.ok(message, data);
  }

  public CommandResult insights(LocalDate start, LocalDate end) {
    return CommandResult.ok(context.insightsGenerator().generateTextReport(start, end));
  }

  public CommandResult privacy(boolean brief) {
    return CommandResult.ok(brief ? PrivacyNotice.BRIEF : PrivacyNotice.FULL);
  }

  private CommandResult exportCsv(LocalDate start, LocalDate end, Path output) {
    ReadResult read = context.storage().readEvents(start, end);
    if (!read.success()) {
      return CommandResult.failed("Failed to read analytics data: " + read.error());
    }
    StringBuilder csv =
        new StringBuilder("timestamp,toolName,success,durationMs,errorCategory,sessionId\n");
    for (AnalyticsEvent event : read.events()) {
      csv.append(
          "\"%s\",\"%s\",\"%s\",\"%d\",\"%s\",\"%s\"\n"
              .formatted(
                  event.timestamp(),
                  event.toolName(),
                  event.success(),
                  event.durationMs(),
                  event.errorCategory() == null ? "" : event.errorCategory().value(),
                  event.sessionId()));
    }
    if (output == null) {
      return CommandResult.ok(csv.toString().stripTrailing());
    }
    FileUtility.writeAtomically(output, csv.toString());
    return CommandResult.ok(
        "Exported %d event(s) to %s".formatted(read.events().size(), output),
        Map.of("filePath", output.toString()));
  }

  private static Map<String, Object> deletionData(DeletionResult result) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("filesDeleted", result.filesDeleted());
    data.put("eventsDeleted", result.eventsDeleted());
    data.put("consentDeleted", result.consentDeleted());
    return data;
  }

  private static LocalDate date(StartupParameters parameters, String name) {
    String value = parameters.getOptionalParameter(name, String.class).orElse(null);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          "Invalid --%s date '%s', expected YYYY-MM-DD".formatted(name, value), e);
    }
  }

  private static String yesNo(boolean value) {
    return value ? "Yes" : "No";
  }

  static String formatBytes(long bytes) {
    if (bytes < 1024) return bytes + " B";
    if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
    return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
  }
}
