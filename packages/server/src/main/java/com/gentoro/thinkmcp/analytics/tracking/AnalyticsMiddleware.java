package com.gentoro.thinkmcp.analytics.tracking;

import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** Wraps tool handlers so every call is measured by a {@link ToolInvocationTracker}. */
public class AnalyticsMiddleware {

  /** A tool handler that may fail with any exception. */
  @FunctionalInterface
  public interface ToolHandler<I, O> {
    O handle(I input) throws Exception;
  }

  private final ToolInvocationTracker tracker;

  public AnalyticsMiddleware(ToolInvocationTracker tracker) {
    this.tracker = tracker;
  }

  public <I, O> ToolHandler<I, O> withAnalytics(ToolName toolName, ToolHandler<I, O> handler) {
    return input -> tracker.trackInvocation(toolName, () -> handler.handle(input));
  }

  public <I, O> Function<I, CompletableFuture<O>> withAnalyticsAsync(
      ToolName toolName, Function<I, CompletableFuture<O>> handler) {
    return input -> tracker.trackInvocationAsync(toolName, () -> handler.apply(input));
  }
}
