package com.gentoro.thinkmcp.analytics.retention;

import com.gentoro.thinkmcp.analytics.collector.AnalyticsCollector;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.CleanupResult;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Deletes partitions that have aged past the retention window and keeps an audit log of every
 * run.
 *
 * <p>A partition is expired when its date is on or before {@code today - retentionDays}. Real
 * runs also drop in-memory events of the collector that fall in the expired range, so they are
 * not written back into a deleted partition later. Statistics only accumulate for successful
 * non-dry runs.
 */
public class RetentionPolicyEnforcer {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(RetentionPolicyEnforcer.class);

  public static final int MAX_LOG_ENTRIES = 100;
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(24);

  private final AnalyticsStorage storage;
  private final AnalyticsCollector collector;
  private final Clock clock;
  private final boolean autoCleanupOnInit;

  private final Deque<CleanupLogEntry> logs = new ArrayDeque<>();
  private volatile CleanupLogSink sink;
  private boolean initialized;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> scheduledCleanup;

  private long totalCleanups;
  private long totalFilesDeleted;
  private long totalEventsDeleted;
  private String lastCleanupAt;
  private RetentionCleanupResult lastResult;

  /**
   * @param storage storage whose partitions are enforced
   * @param collector collector whose pending events are checked too; may be {@code null}
   * @param clock clock for audit timestamps
   * @param autoCleanupOnInit run a cleanup from {@link #initialize()}
   */
  public RetentionPolicyEnforcer(
      AnalyticsStorage storage,
      AnalyticsCollector collector,
      Clock clock,
      boolean autoCleanupOnInit) {
    this.storage = storage;
    this.collector = collector;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.autoCleanupOnInit = autoCleanupOnInit;
    this.sink = new LoggingCleanupLogSink();
  }

  /**
   * Run the initial cleanup once. Later calls do nothing and return {@code null}, as does a call
   * when automatic cleanup on init is off.
   */
  public RetentionCleanupResult initialize() {
    synchronized (this) {
      if (initialized) {
        return null;
      }
      initialized = true;
    }
    return autoCleanupOnInit ? runCleanup(false) : null;
  }

  public RetentionCleanupResult runCleanup() {
    return runCleanup(false);
  }

  public RetentionCleanupResult runCleanup(boolean dryRun) {
    long started = System.nanoTime();
    int retentionDays = storage.getRetentionDays();
    LocalDate cutoff = storage.today().minusDays(retentionDays);

    Map<String, Object> startDetails = new LinkedHashMap<>();
    startDetails.put("retentionDays", retentionDays);
    startDetails.put("cutoffDate", cutoff.toString());
    startDetails.put("dryRun", dryRun);
    record(CleanupAction.CLEANUP_STARTED, startDetails);

    CleanupResult result;
    try {
      result = storage.runCleanup(dryRun);
    } catch (Exception e) {
      result = CleanupResult.failed(0, 0, ExceptionUtil.describe(e));
    }

    int pending = 0;
    if (result.success() && collector != null) {
      pending =
          dryRun
              ? collector.countPendingOnOrBefore(cutoff)
              : collector.discardPendingOnOrBefore(cutoff);
    }

    long durationMs = (System.nanoTime() - started) / 1_000_000L;
    RetentionCleanupResult outcome =
        new RetentionCleanupResult(
            result.success(),
            result.filesDeleted(),
            result.eventsDeleted(),
            pending,
            retentionDays,
            cutoff.toString(),
            durationMs,
            dryRun,
            result.error());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("filesDeleted", outcome.filesDeleted());
    details.put("eventsDeleted", outcome.eventsDeleted());
    details.put("pendingEventsDiscarded", pending);
    details.put("retentionDays", retentionDays);
    details.put("cutoffDate", cutoff.toString());
    details.put("dryRun", dryRun);
    if (!result.success()) {
      details.put("error", String.valueOf(result.error()));
      record(CleanupAction.CLEANUP_FAILED, details);
    } else if (dryRun) {
      record(CleanupAction.DRY_RUN, details);
    } else {
      record(CleanupAction.CLEANUP_COMPLETED, details);
      synchronized (this) {
        totalCleanups++;
        totalFilesDeleted += outcome.filesDeleted();
        totalEventsDeleted += outcome.eventsDeleted();
        lastCleanupAt = now();
        lastResult = outcome;
      }
    }
    return outcome;
  }

  public void startScheduledCleanup() {
    startScheduledCleanup(DEFAULT_CLEANUP_INTERVAL);
  }

  /** Run a cleanup every {@code interval}; replaces any schedule already running. */
  public synchronized void startScheduledCleanup(Duration interval) {
    stopScheduledCleanup();
    if (scheduler == null) {
      scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "analytics-retention");
                t.setDaemon(true);
                return t;
              });
    }
    long millis = Math.max(1, interval.toMillis());
    scheduledCleanup =
        scheduler.scheduleAtFixedRate(
            this::scheduledRun, millis, millis, TimeUnit.MILLISECONDS);
    log.debug("Scheduled analytics retention cleanup every {}", interval);
  }

  public synchronized void stopScheduledCleanup() {
    if (scheduledCleanup != null) {
      scheduledCleanup.cancel(false);
      scheduledCleanup = null;
    }
  }

  public synchronized boolean isScheduledCleanupActive() {
    return scheduledCleanup != null;
  }

  /** Stop the schedule and run one final cleanup. */
  public RetentionCleanupResult shutdown() {
    synchronized (this) {
      stopScheduledCleanup();
      if (scheduler != null) {
        scheduler.shutdownNow();
        scheduler = null;
      }
    }
    return runCleanup(false);
  }

  /** Forget statistics and logs and allow {@link #initialize()} to run again. */
  public synchronized void reset() {
    stopScheduledCleanup();
    initialized = false;
    totalCleanups = 0;
    totalFilesDeleted = 0;
    totalEventsDeleted = 0;
    lastCleanupAt = null;
    lastResult = null;
    synchronized (logs) {
      logs.clear();
    }
  }

  public synchronized RetentionStats getStats() {
    return new RetentionStats(
        totalCleanups,
        totalFilesDeleted,
        totalEventsDeleted,
        lastCleanupAt,
        lastResult,
        scheduledCleanup != null,
        storage.getRetentionDays());
  }

  public List<CleanupLogEntry> getCleanupLogs() {
    synchronized (logs) {
      return List.copyOf(logs);
    }
  }

  public void clearCleanupLogs() {
    synchronized (logs) {
      logs.clear();
    }
  }

  /** Replace the audit sink; {@code null} turns forwarding off. */
  public void setLogSink(CleanupLogSink sink) {
    this.sink = sink;
  }

  private void scheduledRun() {
    try {
      runCleanup(false);
    } catch (Exception e) {
      log.warn("Scheduled retention cleanup failed", e);
    }
  }

  private void record(CleanupAction action, Map<String, Object> details) {
    CleanupLogEntry entry = new CleanupLogEntry(now(), action, details);
    synchronized (logs) {
      logs.addLast(entry);
      while (logs.size() > MAX_LOG_ENTRIES) {
        logs.removeFirst();
      }
    }
    CleanupLogSink current = sink;
    if (current != null) {
      try {
        current.accept(entry);
      } catch (Exception e) {
        log.debug("Retention log sink failed: {}", e.getMessage());
      }
    }
  }

  private String now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
  }
}
