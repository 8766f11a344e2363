package com.gentoro.thinkmcp.analytics.collector;

import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.Objects;

/**
 * Input to {@link AnalyticsCollector#track}. {@code timestamp} and {@code sessionId} are optional
 * and default to "now" and the collector's session.
 */
public record TrackOptions(
    ToolName toolName,
    boolean success,
    long durationMs,
    ErrorCategory errorCategory,
    String timestamp,
    String sessionId) {

  public TrackOptions {
    Objects.requireNonNull(toolName, "toolName");
  }

  public static TrackOptions success(ToolName toolName, long durationMs) {
    return new TrackOptions(toolName, true, durationMs, null, null, null);
  }

  public static TrackOptions failure(
      ToolName toolName, long durationMs, ErrorCategory errorCategory) {
    return new TrackOptions(toolName, false, durationMs, errorCategory, null, null);
  }

  public TrackOptions withTimestamp(String value) {
    return new TrackOptions(toolName, success, durationMs, errorCategory, value, sessionId);
  }

  public TrackOptions withSessionId(String value) {
    return new TrackOptions(toolName, success, durationMs, errorCategory, timestamp, value);
  }
}
