package com.gentoro.thinkmcp.analytics.collector;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfig;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import com.gentoro.thinkmcp.analytics.consent.ConsentManager;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.WriteResult;
import com.gentoro.thinkmcp.exception.ConfigException;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers analytics events in memory and persists them in batches.
 *
 * <p>Recording happens only while {@link #isEnabled()} holds, i.e. the configuration flag is set
 * and consent is given. The pending batch is guarded by a single lock: appending an event and
 * swapping the batch out for a flush are both single critical sections, so concurrent flushes
 * never write the same event and no event is lost between a flush and a racing {@code track}.
 *
 * <p>Storage I/O never runs on the tracking caller's thread. Size-triggered flushes and the
 * periodic timer flush run on one daemon worker thread, created lazily on the first recorded
 * event and stopped by {@link #shutdown()}. A failed write puts its unwritten events back at the
 * front of the batch, so they are retried by the next flush.
 */
public class AnalyticsCollector {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(AnalyticsCollector.class);

  private static final CompletableFuture<FlushResult> NOT_FLUSHED =
      CompletableFuture.completedFuture(FlushResult.empty());
  private static final String SESSION_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
  private static final int SESSION_ID_LENGTH = 16;
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final AnalyticsConfigManager configManager;
  private final ConsentManager consentManager;
  private final AnalyticsStorage storage;
  private final Clock clock;
  private final String sessionId;

  private final Object batchLock = new Object();
  private List<AnalyticsEvent> batch = new ArrayList<>();
  private ScheduledExecutorService worker;
  private ScheduledFuture<?> flushTimer;

  private final AtomicLong totalEventsTracked = new AtomicLong();
  private final AtomicLong totalEventsFlushed = new AtomicLong();
  private final AtomicLong totalFlushErrors = new AtomicLong();
  private final AtomicLong totalEventsDiscarded = new AtomicLong();
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
  private volatile boolean shuttingDown;
  private volatile boolean configErrorReported;

  public AnalyticsCollector(
      AnalyticsConfigManager configManager,
      ConsentManager consentManager,
      AnalyticsStorage storage,
      Clock clock) {
    this.configManager = configManager;
    this.consentManager = consentManager;
    this.storage = storage;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.sessionId = generateSessionId();
  }

  /** Recording is allowed: analytics is enabled in configuration and consent is given. */
  public boolean isEnabled() {
    AnalyticsConfig config = currentConfig();
    return config != null && config.enabled() && consentManager.isConsentGiven();
  }

  /**
   * Record one invocation.
   *
   * <p>When recording is not allowed, or the collector is shutting down, nothing is recorded and
   * an already-completed future is returned. When the event fills the batch, the batch is handed
   * to the worker thread and the returned future completes once it has been written.
   */
  public CompletableFuture<FlushResult> track(TrackOptions options) {
    if (shuttingDown || !isEnabled()) {
      return NOT_FLUSHED;
    }
    AnalyticsConfig config = currentConfig();
    AnalyticsEvent event = toEvent(options);
    List<AnalyticsEvent> full = null;
    synchronized (batchLock) {
      if (shuttingDown) {
        return NOT_FLUSHED;
      }
      batch.add(event);
      totalEventsTracked.incrementAndGet();
      if (batch.size() >= config.batchSize()) {
        full = batch;
        batch = new ArrayList<>();
      } else {
        ensureFlushTimer(config.flushIntervalMs());
      }
    }
    if (full == null) {
      return NOT_FLUSHED;
    }
    List<AnalyticsEvent> toWrite = full;
    try {
      return CompletableFuture.supplyAsync(() -> write(toWrite), worker());
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(write(toWrite));
    }
  }

  /** Fire-and-forget variant of {@link #track}; never throws and never waits for I/O. */
  public void trackSync(TrackOptions options) {
    try {
      track(options);
    } catch (Exception e) {
      log.debug("Dropping analytics event: {}", e.getMessage());
    }
  }

  /** Write all pending events on the calling thread. */
  public FlushResult flush() {
    List<AnalyticsEvent> events;
    synchronized (batchLock) {
      if (batch.isEmpty()) {
        return FlushResult.empty();
      }
      events = batch;
      batch = new ArrayList<>();
    }
    return write(events);
  }

  /** {@link #flush()} on the worker thread. */
  public CompletableFuture<FlushResult> flushAsync() {
    try {
      return CompletableFuture.supplyAsync(this::flush, worker());
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(flush());
    }
  }

  /**
   * Stop accepting events, cancel the timer and write what is pending. Safe to call more than
   * once; later calls return an empty result.
   */
  public FlushResult shutdown() {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return FlushResult.empty();
    }
    ScheduledExecutorService executor;
    synchronized (batchLock) {
      shuttingDown = true;
      if (flushTimer != null) {
        flushTimer.cancel(false);
        flushTimer = null;
      }
      executor = worker;
    }
    if (executor != null) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Analytics flush worker did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    }
    FlushResult result = flush();
    log.debug(
        "Analytics collector stopped: flushed {}, discarded {}, pending {}",
        result.eventsFlushed(),
        result.eventsDiscarded(),
        pendingCount());
    return result;
  }

  public boolean isShutdown() {
    return shuttingDown;
  }

  /**
   * Drop every pending event without writing it.
   *
   * @return number of events dropped
   */
  public int discardPending() {
    int count;
    synchronized (batchLock) {
      count = batch.size();
      batch = new ArrayList<>();
    }
    totalEventsDiscarded.addAndGet(count);
    return count;
  }

  /**
   * Wait until batches already handed to the worker thread have been written. Returns at once
   * when no worker was started or it has been stopped.
   */
  public void awaitQueuedWrites() {
    ScheduledExecutorService executor;
    synchronized (batchLock) {
      executor = worker;
    }
    if (executor == null || executor.isShutdown()) {
      return;
    }
    try {
      executor.submit(() -> {}).get(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
      log.warn("Queued analytics writes did not settle: {}", ExceptionUtil.describe(e));
    }
  }

  /** Drop pending events whose partition date is on or before {@code cutoff}. */
  public int discardPendingOnOrBefore(LocalDate cutoff) {
    int removed;
    synchronized (batchLock) {
      int before = batch.size();
      batch.removeIf(e -> !e.partitionDate().isAfter(cutoff));
      removed = before - batch.size();
    }
    totalEventsDiscarded.addAndGet(removed);
    return removed;
  }

  public int countPendingOnOrBefore(LocalDate cutoff) {
    synchronized (batchLock) {
      return (int) batch.stream().filter(e -> !e.partitionDate().isAfter(cutoff)).count();
    }
  }

  public int pendingCount() {
    synchronized (batchLock) {
      return batch.size();
    }
  }

  public CollectorStats getStats() {
    AnalyticsConfig config = currentConfig();
    return new CollectorStats(
        isEnabled(),
        pendingCount(),
        totalEventsTracked.get(),
        totalEventsFlushed.get(),
        totalFlushErrors.get(),
        totalEventsDiscarded.get(),
        sessionId,
        config == null ? AnalyticsConfig.DEFAULT_BATCH_SIZE : config.batchSize(),
        config == null ? AnalyticsConfig.DEFAULT_FLUSH_INTERVAL_MS : config.flushIntervalMs());
  }

  public String getSessionId() {
    return sessionId;
  }

  private FlushResult write(List<AnalyticsEvent> events) {
    if (!isEnabled()) {
      totalEventsDiscarded.addAndGet(events.size());
      log.debug("Analytics disabled; discarded {} pending event(s)", events.size());
      return FlushResult.discarded(events.size());
    }
    WriteResult result;
    try {
      result = storage.appendEvents(events);
    } catch (Exception e) {
      result = WriteResult.failed(0, ExceptionUtil.describe(e));
    }
    if (result.success()) {
      totalEventsFlushed.addAndGet(result.eventsWritten());
      return FlushResult.flushed(result.eventsWritten());
    }
    // Partitions are written oldest first, so the written events are a prefix by date.
    List<AnalyticsEvent> unwritten =
        events.stream()
            .sorted(Comparator.comparing(AnalyticsEvent::partitionDate))
            .skip(Math.max(0, result.eventsWritten()))
            .toList();
    totalEventsFlushed.addAndGet(events.size() - unwritten.size());
    synchronized (batchLock) {
      List<AnalyticsEvent> restored = new ArrayList<>(unwritten.size() + batch.size());
      restored.addAll(unwritten);
      restored.addAll(batch);
      batch = restored;
    }
    totalFlushErrors.incrementAndGet();
    log.warn(
        "Analytics flush failed, {} event(s) kept for retry: {}",
        unwritten.size(),
        result.error());
    return FlushResult.failed(result.error());
  }

  private void timerFlush() {
    try {
      flush();
    } catch (Exception e) {
      log.warn("Scheduled analytics flush failed", e);
    }
  }

  // Caller holds batchLock.
  private void ensureFlushTimer(long intervalMs) {
    if (flushTimer == null) {
      flushTimer =
          worker()
              .scheduleWithFixedDelay(
                  this::timerFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }
  }

  private ScheduledExecutorService worker() {
    synchronized (batchLock) {
      if (worker == null) {
        worker =
            Executors.newSingleThreadScheduledExecutor(
                r -> {
                  Thread t = new Thread(r, "analytics-collector");
                  t.setDaemon(true);
                  return t;
                });
      }
      return worker;
    }
  }

  private AnalyticsEvent toEvent(TrackOptions options) {
    String timestamp =
        options.timestamp() != null
            ? options.timestamp()
            : Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
    return new AnalyticsEvent(
        options.toolName(),
        timestamp,
        options.success(),
        options.durationMs(),
        options.success() ? null : options.errorCategory(),
        options.sessionId() != null ? options.sessionId() : sessionId);
  }

  private AnalyticsConfig currentConfig() {
    try {
      return configManager.getConfig();
    } catch (ConfigException e) {
      if (!configErrorReported) {
        configErrorReported = true;
        log.warn("Analytics disabled because the configuration is invalid: {}", e.getMessage());
      }
      return null;
    }
  }

  private static String generateSessionId() {
    SecureRandom random = new SecureRandom();
    StringBuilder sb = new StringBuilder(SESSION_ID_LENGTH);
    for (int i = 0; i < SESSION_ID_LENGTH; i++) {
      sb.append(SESSION_ALPHABET.charAt(random.nextInt(SESSION_ALPHABET.length())));
    }
    return sb.toString();
  }
}
