package com.gentoro.thinkmcp.analytics.storage;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.exception.ValidationException;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileAnalyticsStorage daily partitions")
class FileAnalyticsStorageTest {

  @TempDir Path dir;
  private FileAnalyticsStorage storage;

  @BeforeEach
  void setUp() {
    storage = new FileAnalyticsStorage(dir.resolve("analytics"), 30, CLOCK);
  }

  @Test
  @DisplayName("events land in the partition named by their own UTC date")
  void appendPartitionsByDate() throws Exception {
    WriteResult result =
        storage.appendEvents(
            List.of(
                ok(ToolName.TRACE, TODAY, 10),
                ok(ToolName.MODEL, TODAY.minusDays(1), 20),
                failed(ToolName.TRACE, TODAY, ErrorCategory.VALIDATION)));

    assertTrue(result.success());
    assertEquals(3, result.eventsWritten());

    Path todayFile = dir.resolve("analytics").resolve("analytics-2025-06-15.json");
    JsonNode root = JacksonUtility.getJsonMapper().readTree(Files.readString(todayFile));
    assertEquals("1.0.0", root.get("schemaVersion").asText());
    assertEquals("2025-06-15", root.get("date").asText());
    assertEquals(2, root.get("events").size());
    assertEquals("trace", root.get("events").get(0).get("toolName").asText());
    assertFalse(root.get("events").get(0).has("errorCategory"));
    assertEquals("validation", root.get("events").get(1).get("errorCategory").asText());
    assertTrue(Files.exists(dir.resolve("analytics").resolve("analytics-2025-06-14.json")));
  }

  @Test
  @DisplayName("a second append merges into the existing partition")
  void appendMerges() {
    store(storage, List.of(ok(ToolName.TRACE, TODAY, 10)));
    store(storage, List.of(ok(ToolName.DEBUG, TODAY, 30)));

    assertEquals(2, storage.readEventsForDate(TODAY).events().size());
  }

  @Test
  @DisplayName("an empty batch writes nothing")
  void appendEmpty() {
    WriteResult result = storage.appendEvents(List.of());
    assertTrue(result.success());
    assertEquals(0, result.eventsWritten());
    assertFalse(Files.exists(dir.resolve("analytics")));
  }

  @Test
  @DisplayName("reads are filtered to the inclusive range and sorted by timestamp")
  void readRangeSorted() {
    store(
        storage,
        List.of(
            new AnalyticsEvent(ToolName.MAP, at(TODAY, 9), true, 1, null, SESSION),
            new AnalyticsEvent(ToolName.TRACE, at(TODAY, 8), true, 1, null, SESSION),
            ok(ToolName.MODEL, TODAY.minusDays(2), 5),
            ok(ToolName.DEBATE, TODAY.minusDays(5), 5)));

    ReadResult result = storage.readEvents(TODAY.minusDays(2), TODAY);
    assertTrue(result.success());
    assertEquals(
        List.of(ToolName.MODEL, ToolName.TRACE, ToolName.MAP),
        result.events().stream().map(AnalyticsEvent::toolName).toList());
  }

  @Test
  @DisplayName("reading without bounds covers the last 30 days up to today")
  void readDefaultWindow() {
    store(
        storage,
        List.of(
            ok(ToolName.TRACE, TODAY.minusDays(30), 1),
            ok(ToolName.TRACE, TODAY.minusDays(31), 1),
            ok(ToolName.TRACE, TODAY, 1)));

    ReadResult result = storage.readEvents(null, null);
    assertEquals(TODAY.minusDays(30), result.start());
    assertEquals(TODAY, result.end());
    assertEquals(2, result.events().size());
  }

  @Test
  @DisplayName("a start after the end yields an empty successful read")
  void readInvertedRange() {
    store(storage, List.of(ok(ToolName.TRACE, TODAY, 1)));
    ReadResult result = storage.readEvents(TODAY, TODAY.minusDays(1));
    assertTrue(result.success());
    assertTrue(result.events().isEmpty());
  }

  @Test
  @DisplayName("corrupt partitions and invalid events are skipped, not fatal")
  void corruptFilesSkipped() throws Exception {
    store(storage, List.of(ok(ToolName.TRACE, TODAY, 1)));
    Path analytics = dir.resolve("analytics");
    Files.writeString(
        analytics.resolve("analytics-2025-06-14.json"), "{broken", StandardCharsets.UTF_8);
    Files.writeString(
        analytics.resolve("analytics-2025-06-13.json"),
        """
        {"schemaVersion":"1.0.0","date":"2025-06-13","events":[
          {"toolName":"trace","timestamp":"2025-06-13T10:00:00Z","success":true,"durationMs":4,"sessionId":"s"},
          {"toolName":"nope","timestamp":"2025-06-13T10:00:00Z","success":true,"durationMs":4,"sessionId":"s"}
        ]}
        """,
        StandardCharsets.UTF_8);
    Files.writeString(analytics.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

    ReadResult result = storage.readEvents(TODAY.minusDays(5), TODAY);
    assertTrue(result.success());
    assertEquals(2, result.events().size());
  }

  @Test
  @DisplayName("cleanup removes partitions dated on or before today minus retention")
  void cleanupBoundary() {
    store(
        storage,
        List.of(
            ok(ToolName.TRACE, TODAY.minusDays(31), 1),
            ok(ToolName.TRACE, TODAY.minusDays(30), 1),
            ok(ToolName.TRACE, TODAY.minusDays(30), 1),
            ok(ToolName.TRACE, TODAY.minusDays(29), 1)));

    CleanupResult dryRun = storage.runCleanup(true);
    assertEquals(2, dryRun.filesDeleted());
    assertEquals(3, dryRun.eventsDeleted());
    assertEquals(3, storage.getStorageInfo().totalFiles());

    CleanupResult result = storage.runCleanup(false);
    assertTrue(result.success());
    assertEquals(2, result.filesDeleted());
    assertEquals(3, result.eventsDeleted());

    StorageInfo info = storage.getStorageInfo();
    assertEquals(1, info.totalFiles());
    assertEquals(TODAY.minusDays(29).toString(), info.oldestDate());
  }

  @Test
  @DisplayName("concurrent cleanups count each deleted file exactly once")
  void concurrentCleanup() throws Exception {
    List<AnalyticsEvent> old = new ArrayList<>();
    for (int i = 31; i < 41; i++) {
      old.add(ok(ToolName.TRACE, TODAY.minusDays(i), 1));
    }
    store(storage, old);

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Callable<CleanupResult>> tasks = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        tasks.add(() -> storage.runCleanup(false));
      }
      int files = 0;
      int events = 0;
      for (Future<CleanupResult> future : pool.invokeAll(tasks)) {
        files += future.get().filesDeleted();
        events += future.get().eventsDeleted();
      }
      assertEquals(10, files);
      assertEquals(10, events);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("deleteAllData removes every partition and reports the totals")
  void deleteAll() {
    store(
        storage,
        List.of(
            ok(ToolName.TRACE, TODAY, 1),
            ok(ToolName.TRACE, TODAY, 1),
            ok(ToolName.MODEL, TODAY.minusDays(3), 1)));

    CleanupResult result = storage.deleteAllData();
    assertEquals(2, result.filesDeleted());
    assertEquals(3, result.eventsDeleted());
    assertEquals(0, storage.getStorageInfo().totalEvents());
  }

  @Test
  @DisplayName("storage info on a missing directory is empty")
  void infoOnMissingDirectory() {
    StorageInfo info = storage.getStorageInfo();
    assertEquals(0, info.totalFiles());
    assertNull(info.oldestDate());
    assertEquals(30, info.retentionDays());
  }

  @Test
  @DisplayName("reads order events by instant when the text drops zero milliseconds")
  void readOrdersByInstant() {
    String whole = Instant.parse("2025-06-15T12:00:00.000Z").toString();
    String half = Instant.parse("2025-06-15T12:00:00.500Z").toString();
    store(
        storage,
        List.of(
            new AnalyticsEvent(ToolName.TRACE, half, true, 1, null, SESSION),
            new AnalyticsEvent(ToolName.MODEL, whole, true, 1, null, SESSION)));

    List<String> order =
        storage.readEventsForDate(TODAY).events().stream()
            .map(AnalyticsEvent::timestamp)
            .toList();
    assertEquals(List.of("2025-06-15T12:00:00Z", "2025-06-15T12:00:00.500Z"), order);
  }

  @Test
  @DisplayName("a retention below one day is rejected")
  void rejectsNonPositiveRetention() {
    assertThrows(ValidationException.class, () -> new FileAnalyticsStorage(dir, 0, CLOCK));
    assertThrows(ValidationException.class, () -> new FileAnalyticsStorage(dir, -7, CLOCK));
  }
}
