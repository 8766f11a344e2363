package com.gentoro.thinkmcp.analytics.storage;

import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Durable store for analytics events, partitioned by calendar day.
 *
 * <p>Implementations never throw from these operations; failures are reported through the
 * {@code success}/{@code error} fields of the returned result.
 */
public interface AnalyticsStorage {

  /** Default look-back, in days, of {@link #readEvents} when no start date is given. */
  int DEFAULT_READ_WINDOW_DAYS = 30;

  /**
   * Create the storage directory if needed.
   *
   * @return false when the directory could not be created
   */
  boolean initialize();

  /**
   * Append events to the partitions named by their own timestamps. Partitions are written oldest
   * first and each one atomically; on failure {@link WriteResult#eventsWritten()} counts the
   * events of the partitions completed before it.
   */
  WriteResult appendEvents(List<AnalyticsEvent> events);

  /**
   * Read events whose partition date falls within {@code [start, end]}.
   *
   * @param start inclusive start; {@code null} means {@value #DEFAULT_READ_WINDOW_DAYS} days ago
   * @param end inclusive end; {@code null} means today
   */
  ReadResult readEvents(LocalDate start, LocalDate end);

  ReadResult readEventsForDate(LocalDate date);

  /** Remove partitions dated on or before {@code today - retentionDays}. */
  CleanupResult runCleanup(boolean dryRun);

  /** Remove every partition file. */
  CleanupResult deleteAllData();

  StorageInfo getStorageInfo();

  Path getStoragePath();

  int getRetentionDays();

  /** The current date as seen by this storage's clock. */
  LocalDate today();
}
