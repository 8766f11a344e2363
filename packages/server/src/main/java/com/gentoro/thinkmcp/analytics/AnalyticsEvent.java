package com.gentoro.thinkmcp.analytics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A single recorded tool invocation.
 *
 * <p>The record deliberately has no room for arguments, outputs, error messages or any other
 * user content: tool name, timing, outcome, coarse error category and an opaque session token are
 * all that is ever persisted. {@code errorCategory} is only kept for failed invocations.
 *
 * @param toolName the invoked tool
 * @param timestamp ISO-8601 instant at which the invocation happened
 * @param success whether the invocation completed without error
 * @param durationMs wall-clock duration, clamped to zero
 * @param errorCategory category of the failure; {@code null} when {@code success} is true
 * @param sessionId random per-process token
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"toolName", "timestamp", "success", "durationMs", "errorCategory", "sessionId"})
public record AnalyticsEvent(
    ToolName toolName,
    String timestamp,
    boolean success,
    long durationMs,
    ErrorCategory errorCategory,
    String sessionId) {

  public AnalyticsEvent {
    Objects.requireNonNull(toolName, "toolName");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(sessionId, "sessionId");
    partitionDateOf(timestamp);
    durationMs = Math.max(0, durationMs);
    if (success) {
      errorCategory = null;
    } else if (errorCategory == null) {
      errorCategory = ErrorCategory.UNKNOWN;
    }
  }

  /** UTC calendar date of the event, which names the partition it is stored in. */
  @JsonIgnore
  public LocalDate partitionDate() {
    return partitionDateOf(timestamp);
  }

  /** Point in time of the event; orders events whose timestamp strings differ in precision. */
  @JsonIgnore
  public Instant instant() {
    return instantOf(timestamp);
  }

  /**
   * Parse the UTC calendar date of an ISO-8601 timestamp.
   *
   * @throws IllegalArgumentException when the value is not an ISO-8601 instant or offset date-time
   */
  public static LocalDate partitionDateOf(String timestamp) {
    return LocalDate.ofInstant(instantOf(timestamp), ZoneOffset.UTC);
  }

  /**
   * Parse an ISO-8601 instant or offset date-time.
   *
   * @throws IllegalArgumentException when the value is neither
   */
  public static Instant instantOf(String timestamp) {
    try {
      return Instant.parse(timestamp);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(timestamp).toInstant();
      } catch (DateTimeParseException inner) {
        throw new IllegalArgumentException("Invalid event timestamp: " + timestamp, inner);
      }
    }
  }
}
