package com.gentoro.thinkmcp.analytics.deletion;

import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.storage.CleanupResult;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Erases all stored analytics on user request and records an audit trail of the request.
 *
 * <p>Pending in-memory events are dropped first so that nothing recorded before the request is
 * written afterwards. Never throws; failures are reported through {@link DeletionResult}.
 */
public class DataDeletionManager {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(DataDeletionManager.class);

  public static final int MAX_LOG_ENTRIES = 50;

  private final AnalyticsContext context;
  private final Clock clock;
  private final Deque<DeletionLogEntry> logs = new ArrayDeque<>();
  private volatile DeletionLogSink sink;

  private long totalDeletions;
  private long totalFilesDeleted;
  private long totalEventsDeleted;
  private String lastDeletionAt;
  private DeletionResult lastResult;

  public DataDeletionManager(AnalyticsContext context, Clock clock) {
    this.context = context;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.sink =
        entry ->
            log.info(
                "Analytics deletion audit: {} {}", entry.action().value(), entry.details());
  }

  public DeletionResult deleteAllData() {
    return deleteAllData(DeletionOptions.defaults());
  }

  public synchronized DeletionResult deleteAllData(DeletionOptions options) {
    long started = System.nanoTime();

    Map<String, Object> requested = new LinkedHashMap<>();
    requested.put("resetComponents", options.resetComponents());
    requested.put("deleteConsent", options.deleteConsent());
    if (options.reason() != null && !options.reason().isBlank()) {
      requested.put("reason", options.reason());
    }
    record(DeletionAction.DELETION_REQUESTED, requested);
    record(
        DeletionAction.DELETION_STARTED,
        Map.of("storagePath", context.storage().getStoragePath().toString()));

    int pending = 0;
    try {
      pending = context.collector().discardPending();
      context.collector().awaitQueuedWrites();
      CleanupResult stored = context.storage().deleteAllData();
      if (!stored.success()) {
        return failed(
            started, stored.filesDeleted(), stored.eventsDeleted() + pending, stored.error());
      }

      boolean reset = false;
      if (options.resetComponents()) {
        context.resetComponents();
        reset = true;
        record(DeletionAction.COMPONENTS_RESET, Map.of());
      }

      boolean consentDeleted = false;
      if (options.deleteConsent()) {
        consentDeleted = context.consentManager().deleteConsentRecord();
      }

      long durationMs = elapsed(started);
      DeletionResult result =
          new DeletionResult(
              true,
              stored.filesDeleted(),
              stored.eventsDeleted() + pending,
              reset,
              consentDeleted,
              durationMs,
              now(),
              null);

      Map<String, Object> details = new LinkedHashMap<>();
      details.put("filesDeleted", result.filesDeleted());
      details.put("eventsDeleted", result.eventsDeleted());
      details.put("pendingEventsDeleted", pending);
      details.put("componentsReset", reset);
      details.put("consentDeleted", consentDeleted);
      details.put("durationMs", durationMs);
      record(DeletionAction.DELETION_COMPLETED, details);

      totalDeletions++;
      totalFilesDeleted += result.filesDeleted();
      totalEventsDeleted += result.eventsDeleted();
      lastDeletionAt = result.completedAt();
      lastResult = result;
      return result;
    } catch (Exception e) {
      log.error("Analytics data deletion failed", e);
      return failed(started, 0, pending, ExceptionUtil.describe(e));
    }
  }

  public synchronized DeletionStats getStats() {
    return new DeletionStats(
        totalDeletions, totalFilesDeleted, totalEventsDeleted, lastDeletionAt, lastResult);
  }

  public List<DeletionLogEntry> getDeletionLogs() {
    synchronized (logs) {
      return List.copyOf(logs);
    }
  }

  public void clearDeletionLogs() {
    synchronized (logs) {
      logs.clear();
    }
  }

  public void setLogSink(DeletionLogSink sink) {
    this.sink = sink;
  }

  /** Text shown before asking the user to confirm a deletion. */
  public String getConfirmationPrompt() {
    return String.join(
        "\n",
        "This permanently deletes all locally stored usage analytics:",
        "  - every daily analytics file in " + context.storage().getStoragePath(),
        "  - events recorded in this session that have not been saved yet",
        "",
        "Your consent choice is kept unless you also ask to delete it.",
        "This cannot be undone. Continue?");
  }

  public String getSuccessMessage(DeletionResult result) {
    return "Deleted %d event(s) from %d file(s)."
        .formatted(result.eventsDeleted(), result.filesDeleted());
  }

  public String formatResult(DeletionResult result) {
    if (!result.success()) {
      return "Analytics deletion failed: " + result.error();
    }
    StringBuilder sb = new StringBuilder(getSuccessMessage(result));
    if (result.componentsReset()) {
      sb.append("\nAnalytics components were reset.");
    }
    if (result.consentDeleted()) {
      sb.append("\nConsent record deleted; you will be asked again on next start.");
    }
    sb.append("\nCompleted in ").append(result.durationMs()).append("ms.");
    return sb.toString();
  }

  private DeletionResult failed(long started, int files, int events, String error) {
    DeletionResult result =
        new DeletionResult(false, files, events, false, false, elapsed(started), now(), error);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("error", String.valueOf(error));
    details.put("filesDeleted", files);
    details.put("eventsDeleted", events);
    record(DeletionAction.DELETION_FAILED, details);
    return result;
  }

  private void record(DeletionAction action, Map<String, Object> details) {
    DeletionLogEntry entry = new DeletionLogEntry(now(), action, details);
    synchronized (logs) {
      logs.addLast(entry);
      while (logs.size() > MAX_LOG_ENTRIES) {
        logs.removeFirst();
      }
    }
    DeletionLogSink current = sink;
    if (current != null) {
      try {
        current.accept(entry);
      } catch (Exception e) {
        log.debug("Deletion log sink failed: {}", e.getMessage());
      }
    }
  }

  private static long elapsed(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }

  private String now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
  }
}
