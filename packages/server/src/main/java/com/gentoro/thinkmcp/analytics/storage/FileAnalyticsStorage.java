package com.gentoro.thinkmcp.analytics.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.exception.ValidationException;
import com.gentoro.thinkmcp.utility.FileUtility;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link AnalyticsStorage} backed by one JSON file per UTC day.
 *
 * <p>Appends are read-modify-write cycles serialized per partition date inside this process; the
 * new content is written to a temp file and renamed over the partition, so a partition is either
 * fully updated or untouched. Deletions go through {@link Files#deleteIfExists}, which reports
 * success to exactly one caller when cleanups race.
 */
public class FileAnalyticsStorage implements AnalyticsStorage {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(FileAnalyticsStorage.class);

  private static final Pattern PARTITION_FILE =
      Pattern.compile("^analytics-(\\d{4}-\\d{2}-\\d{2})\\.json$");

  private final Path storagePath;
  private final int retentionDays;
  private final Clock clock;
  private final Map<LocalDate, Object> partitionLocks = new ConcurrentHashMap<>();

  /**
   * @throws ValidationException when {@code retentionDays} is below 1, which would put the
   *     cleanup cutoff on or after today
   */
  public FileAnalyticsStorage(Path storagePath, int retentionDays, Clock clock) {
    this.storagePath = Objects.requireNonNull(storagePath, "storagePath");
    if (retentionDays < 1) {
      throw new ValidationException(
          "Retention must be at least 1 day, got " + retentionDays,
          Map.of("retentionDays", retentionDays));
    }
    this.retentionDays = retentionDays;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public static String partitionFileName(LocalDate date) {
    return "analytics-" + date + ".json";
  }

  @Override
  public boolean initialize() {
    try {
      Files.createDirectories(storagePath);
      return true;
    } catch (IOException e) {
      log.error("Failed to create analytics storage directory {}", storagePath, e);
      return false;
    }
  }

  @Override
  public WriteResult appendEvents(List<AnalyticsEvent> events) {
    if (events == null || events.isEmpty()) {
      return WriteResult.ok(0);
    }
    if (!initialize()) {
      return WriteResult.failed(0, "Storage directory unavailable: " + storagePath);
    }

    Map<LocalDate, List<AnalyticsEvent>> byDate = new TreeMap<>();
    for (AnalyticsEvent event : events) {
      if (event == null) continue;
      byDate.computeIfAbsent(event.partitionDate(), d -> new ArrayList<>()).add(event);
    }

    int written = 0;
    for (Map.Entry<LocalDate, List<AnalyticsEvent>> entry : byDate.entrySet()) {
      LocalDate date = entry.getKey();
      try {
        synchronized (lockFor(date)) {
          Path file = partitionFile(date);
          List<AnalyticsEvent> merged = new ArrayList<>(readPartition(file));
          merged.addAll(entry.getValue());
          DailyPartition partition =
              new DailyPartition(DailyPartition.SCHEMA_VERSION, date.toString(), merged, now());
          FileUtility.writeAtomically(file, JacksonUtility.toJson(partition));
        }
        written += entry.getValue().size();
      } catch (Exception e) {
        log.warn("Failed to write analytics partition {}: {}", date, e.getMessage());
        return WriteResult.failed(
            written, "Failed to write partition " + date + ": " + ExceptionUtil.describe(e));
      }
    }
    log.debug("Appended {} analytics event(s) across {} partition(s)", written, byDate.size());
    return WriteResult.ok(written);
  }

  @Override
  public ReadResult readEvents(LocalDate start, LocalDate end) {
    LocalDate effectiveEnd = end == null ? today() : end;
    LocalDate effectiveStart =
        start == null ? today().minusDays(DEFAULT_READ_WINDOW_DAYS) : start;
    if (effectiveStart.isAfter(effectiveEnd)) {
      return new ReadResult(true, List.of(), effectiveStart, effectiveEnd, null);
    }
    try {
      List<AnalyticsEvent> events = new ArrayList<>();
      for (Map.Entry<LocalDate, Path> partition : listPartitions().entrySet()) {
        LocalDate date = partition.getKey();
        if (date.isBefore(effectiveStart) || date.isAfter(effectiveEnd)) continue;
        events.addAll(readPartition(partition.getValue()));
      }
      events.sort(Comparator.comparing(AnalyticsEvent::instant));
      return new ReadResult(true, events, effectiveStart, effectiveEnd, null);
    } catch (Exception e) {
      log.warn("Failed to read analytics events: {}", e.getMessage());
      return ReadResult.failed(effectiveStart, effectiveEnd, ExceptionUtil.describe(e));
    }
  }

  @Override
  public ReadResult readEventsForDate(LocalDate date) {
    return readEvents(date, date);
  }

  @Override
  public CleanupResult runCleanup(boolean dryRun) {
    LocalDate cutoff = today().minusDays(retentionDays);
    return deletePartitions(date -> !date.isAfter(cutoff), dryRun, "cleanup");
  }

  @Override
  public CleanupResult deleteAllData() {
    return deletePartitions(date -> true, false, "delete-all");
  }

  @Override
  public StorageInfo getStorageInfo() {
    int files = 0;
    int events = 0;
    long bytes = 0;
    String oldest = null;
    String newest = null;
    try {
      Map<LocalDate, Path> partitions = listPartitions();
      for (Map.Entry<LocalDate, Path> partition : partitions.entrySet()) {
        files++;
        events += readPartition(partition.getValue()).size();
        try {
          bytes += Files.size(partition.getValue());
        } catch (IOException e) {
          log.debug("Could not size {}", partition.getValue());
        }
        String date = partition.getKey().toString();
        if (oldest == null) oldest = date;
        newest = date;
      }
    } catch (Exception e) {
      log.warn("Failed to inspect analytics storage: {}", e.getMessage());
    }
    return new StorageInfo(
        storagePath.toString(), files, events, bytes, oldest, newest, retentionDays);
  }

  @Override
  public Path getStoragePath() {
    return storagePath;
  }

  @Override
  public int getRetentionDays() {
    return retentionDays;
  }

  @Override
  public LocalDate today() {
    return LocalDate.now(clock);
  }

  private CleanupResult deletePartitions(
      java.util.function.Predicate<LocalDate> selector, boolean dryRun, String operation) {
    int filesDeleted = 0;
    int eventsDeleted = 0;
    try {
      for (Map.Entry<LocalDate, Path> partition : listPartitions().entrySet()) {
        LocalDate date = partition.getKey();
        if (!selector.test(date)) continue;
        Path file = partition.getValue();
        synchronized (lockFor(date)) {
          int count = readPartition(file).size();
          if (dryRun) {
            if (Files.exists(file)) {
              filesDeleted++;
              eventsDeleted += count;
            }
          } else if (Files.deleteIfExists(file)) {
            filesDeleted++;
            eventsDeleted += count;
          }
        }
      }
      log.debug(
          "Analytics {}{}: {} file(s), {} event(s)",
          operation,
          dryRun ? " (dry run)" : "",
          filesDeleted,
          eventsDeleted);
      return CleanupResult.ok(filesDeleted, eventsDeleted);
    } catch (Exception e) {
      log.warn("Analytics {} failed: {}", operation, e.getMessage());
      return CleanupResult.failed(filesDeleted, eventsDeleted, ExceptionUtil.describe(e));
    }
  }

  /** Partition files keyed by date, oldest first. A missing directory yields an empty map. */
  private Map<LocalDate, Path> listPartitions() throws IOException {
    Map<LocalDate, Path> partitions = new TreeMap<>();
    if (!Files.isDirectory(storagePath)) {
      return partitions;
    }
    try (Stream<Path> files = Files.list(storagePath)) {
      files.forEach(
          file -> {
            Matcher matcher = PARTITION_FILE.matcher(file.getFileName().toString());
            if (!matcher.matches() || !Files.isRegularFile(file)) return;
            try {
              partitions.put(LocalDate.parse(matcher.group(1)), file);
            } catch (DateTimeParseException e) {
              log.debug("Skipping file with invalid date: {}", file.getFileName());
            }
          });
    }
    return partitions;
  }

  /** Valid events of a partition; a missing or corrupt file reads as empty. */
  private List<AnalyticsEvent> readPartition(Path file) {
    String content;
    try {
      content = FileUtility.readIfExists(file);
    } catch (Exception e) {
      log.warn("Failed to read analytics partition {}: {}", file.getFileName(), e.getMessage());
      return List.of();
    }
    if (content == null || content.isBlank()) {
      return List.of();
    }
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    JsonNode root;
    try {
      root = mapper.readTree(content);
    } catch (Exception e) {
      log.warn("Ignoring corrupt analytics partition {}", file.getFileName());
      return List.of();
    }
    JsonNode events = root == null ? null : root.get("events");
    if (events == null || !events.isArray()) {
      log.warn("Ignoring analytics partition {} without an events array", file.getFileName());
      return List.of();
    }
    List<AnalyticsEvent> result = new ArrayList<>(events.size());
    int skipped = 0;
    for (JsonNode node : events) {
      try {
        result.add(mapper.treeToValue(node, AnalyticsEvent.class));
      } catch (Exception e) {
        skipped++;
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} invalid event(s) in {}", skipped, file.getFileName());
    }
    return result;
  }

  private Path partitionFile(LocalDate date) {
    return storagePath.resolve(partitionFileName(date));
  }

  private Object lockFor(LocalDate date) {
    return partitionLocks.computeIfAbsent(date, d -> new Object());
  }

  private String now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
  }
}
