package com.gentoro.thinkmcp.analytics.tracking;

import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.collector.AnalyticsCollector;
import com.gentoro.thinkmcp.analytics.collector.TrackOptions;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Measures tool invocations and reports them to the {@link AnalyticsCollector}.
 *
 * <p>Tracking never changes the outcome of the wrapped call: results are returned as-is and
 * exceptions are rethrown unchanged after being recorded. When recording is not allowed a shared
 * no-op handle is returned.
 */
public class ToolInvocationTracker {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(ToolInvocationTracker.class);

  private final AnalyticsCollector collector;
  private final Map<ToolName, TrackedInvocation> noOps = new EnumMap<>(ToolName.class);

  private final AtomicInteger active = new AtomicInteger();
  private final AtomicLong started = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  public ToolInvocationTracker(AnalyticsCollector collector) {
    this.collector = collector;
    for (ToolName tool : ToolName.values()) {
      noOps.put(tool, new NoOpInvocation(tool));
    }
  }

  public TrackedInvocation startInvocation(ToolName toolName) {
    if (!collector.isEnabled()) {
      return noOps.get(toolName);
    }
    started.incrementAndGet();
    active.incrementAndGet();
    return new TimedInvocation(toolName, System.nanoTime());
  }

  /** Run {@code handler}, record its outcome and return its result or rethrow its exception. */
  public <T> T trackInvocation(ToolName toolName, Callable<T> handler) throws Exception {
    TrackedInvocation invocation = startInvocation(toolName);
    T result;
    try {
      result = handler.call();
    } catch (Exception | Error e) {
      invocation.fail(e);
      throw e;
    }
    invocation.succeed();
    return result;
  }

  /**
   * Asynchronous variant of {@link #trackInvocation}. The returned future completes exactly like
   * the handler's future.
   */
  public <T> CompletableFuture<T> trackInvocationAsync(
      ToolName toolName, Supplier<CompletableFuture<T>> handler) {
    TrackedInvocation invocation = startInvocation(toolName);
    CompletableFuture<T> future;
    try {
      future = handler.get();
    } catch (RuntimeException | Error e) {
      invocation.fail(e);
      throw e;
    }
    return future.whenComplete(
        (value, error) -> {
          if (error == null) {
            invocation.succeed();
          } else {
            invocation.fail(unwrap(error));
          }
        });
  }

  public TrackerStats getStats() {
    return new TrackerStats(
        active.get(), started.get(), completed.get(), successes.get(), errors.get());
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private final class TimedInvocation implements TrackedInvocation {
    private final ToolName toolName;
    private final long startNanos;
    private final AtomicBoolean done = new AtomicBoolean(false);

    private TimedInvocation(ToolName toolName, long startNanos) {
      this.toolName = toolName;
      this.startNanos = startNanos;
    }

    @Override
    public ToolName toolName() {
      return toolName;
    }

    @Override
    public void complete(boolean success, ErrorCategory errorCategory) {
      if (!done.compareAndSet(false, true)) {
        log.debug("Ignoring repeated completion of {} invocation", toolName);
        return;
      }
      long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
      active.decrementAndGet();
      completed.incrementAndGet();
      if (success) {
        successes.incrementAndGet();
        collector.trackSync(TrackOptions.success(toolName, durationMs));
      } else {
        errors.incrementAndGet();
        collector.trackSync(
            TrackOptions.failure(
                toolName,
                durationMs,
                errorCategory == null ? ErrorCategory.UNKNOWN : errorCategory));
      }
    }

    @Override
    public boolean isCompleted() {
      return done.get();
    }
  }

  private record NoOpInvocation(ToolName toolName) implements TrackedInvocation {
    @Override
    public void complete(boolean success, ErrorCategory errorCategory) {}

    @Override
    public boolean isCompleted() {
      return false;
    }
  }
}
