package com.gentoro.thinkmcp.analytics.collector;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a flush. {@code eventsDiscarded} counts pending events dropped because recording was
 * no longer allowed when the flush ran.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlushResult(boolean success, int eventsFlushed, int eventsDiscarded, String error) {

  private static final FlushResult EMPTY = new FlushResult(true, 0, 0, null);

  public static FlushResult empty() {
    return EMPTY;
  }

  public static FlushResult flushed(int count) {
    return new FlushResult(true, count, 0, null);
  }

  public static FlushResult discarded(int count) {
    return new FlushResult(true, 0, count, null);
  }

  public static FlushResult failed(String error) {
    return new FlushResult(false, 0, 0, error);
  }
}
