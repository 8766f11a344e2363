package com.gentoro.thinkmcp.analytics.retention;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.collector.AnalyticsCollector;
import com.gentoro.thinkmcp.analytics.collector.TrackOptions;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import com.gentoro.thinkmcp.analytics.consent.ConsentManager;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RetentionPolicyEnforcer")
class RetentionPolicyEnforcerTest {

  @TempDir Path dir;
  private FileAnalyticsStorage storage;
  private AnalyticsCollector collector;
  private RetentionPolicyEnforcer enforcer;

  @BeforeEach
  void setUp() {
    AnalyticsConfigManager configManager = enabledConfigManager(dir, 100);
    ConsentManager consent = new ConsentManager(configManager, CLOCK);
    consent.grantConsent(false);
    storage = new FileAnalyticsStorage(dir.resolve("analytics"), 7, CLOCK);
    collector = new AnalyticsCollector(configManager, consent, storage, CLOCK);
    enforcer = new RetentionPolicyEnforcer(storage, collector, CLOCK, true);
    enforcer.setLogSink(null);

    store(
        storage,
        List.of(
            ok(ToolName.TRACE, TODAY.minusDays(10), 1),
            ok(ToolName.TRACE, TODAY.minusDays(7), 1),
            ok(ToolName.TRACE, TODAY.minusDays(6), 1),
            ok(ToolName.TRACE, TODAY, 1)));
  }

  @AfterEach
  void tearDown() {
    enforcer.stopScheduledCleanup();
    collector.shutdown();
  }

  @Test
  @DisplayName("expired partitions are removed and the run is accounted for")
  void cleanup() {
    RetentionCleanupResult result = enforcer.runCleanup(false);

    assertTrue(result.success());
    assertEquals(2, result.filesDeleted());
    assertEquals(2, result.eventsDeleted());
    assertEquals("2025-06-08", result.cutoffDate());
    assertEquals(7, result.retentionDays());
    assertEquals(2, storage.getStorageInfo().totalFiles());

    RetentionStats stats = enforcer.getStats();
    assertEquals(1, stats.totalCleanups());
    assertEquals(2, stats.totalFilesDeleted());
    assertEquals("2025-06-15T12:00:00Z", stats.lastCleanupAt());
  }

  @Test
  @DisplayName("a dry run deletes nothing and leaves the statistics alone")
  void dryRun() {
    RetentionCleanupResult result = enforcer.runCleanup(true);

    assertTrue(result.dryRun());
    assertEquals(2, result.filesDeleted());
    assertEquals(4, storage.getStorageInfo().totalFiles());
    assertEquals(0, enforcer.getStats().totalCleanups());
    assertEquals(
        CleanupAction.DRY_RUN,
        enforcer.getCleanupLogs().get(enforcer.getCleanupLogs().size() - 1).action());
  }

  @Test
  @DisplayName("expired events still pending in memory are discarded too")
  void pendingEventsDiscarded() {
    collector.track(
        TrackOptions.success(ToolName.MAP, 1).withTimestamp(at(TODAY.minusDays(9), 8)));
    collector.track(TrackOptions.success(ToolName.MAP, 1));

    RetentionCleanupResult result = enforcer.runCleanup(false);
    assertEquals(1, result.pendingEventsDiscarded());
    assertEquals(1, collector.pendingCount());
  }

  @Test
  @DisplayName("initialize cleans up once")
  void initializeOnce() {
    assertNotNull(enforcer.initialize());
    assertNull(enforcer.initialize());
    assertEquals(1, enforcer.getStats().totalCleanups());

    RetentionPolicyEnforcer manual = new RetentionPolicyEnforcer(storage, null, CLOCK, false);
    assertNull(manual.initialize());
  }

  @Test
  @DisplayName("storage failures are reported, logged and not counted")
  void failure() {
    AnalyticsStorage broken = mock(AnalyticsStorage.class);
    when(broken.getRetentionDays()).thenReturn(7);
    when(broken.today()).thenReturn(TODAY);
    when(broken.runCleanup(false)).thenThrow(new IllegalStateException("disk gone"));
    RetentionPolicyEnforcer failing = new RetentionPolicyEnforcer(broken, null, CLOCK, false);
    List<CleanupLogEntry> seen = new ArrayList<>();
    failing.setLogSink(seen::add);

    RetentionCleanupResult result = failing.runCleanup(false);
    assertFalse(result.success());
    assertNotNull(result.error());
    assertEquals(0, failing.getStats().totalCleanups());
    assertEquals(CleanupAction.CLEANUP_STARTED, seen.get(0).action());
    assertEquals(CleanupAction.CLEANUP_FAILED, seen.get(1).action());
  }

  @Test
  @DisplayName("the audit log holds counts and dates only and is bounded")
  void auditLog() {
    for (int i = 0; i < 60; i++) {
      enforcer.runCleanup(true);
    }
    List<CleanupLogEntry> logs = enforcer.getCleanupLogs();
    assertEquals(RetentionPolicyEnforcer.MAX_LOG_ENTRIES, logs.size());
    Map<String, Object> details = logs.get(logs.size() - 1).details();
    assertEquals("2025-06-08", details.get("cutoffDate"));
    assertEquals(Boolean.TRUE, details.get("dryRun"));

    enforcer.clearCleanupLogs();
    assertTrue(enforcer.getCleanupLogs().isEmpty());
  }

  @Test
  @DisplayName("a schedule can be started, replaced and stopped")
  void schedule() {
    enforcer.startScheduledCleanup(Duration.ofHours(1));
    assertTrue(enforcer.isScheduledCleanupActive());
    assertTrue(enforcer.getStats().scheduledCleanupActive());

    enforcer.startScheduledCleanup(Duration.ofHours(2));
    assertTrue(enforcer.isScheduledCleanupActive());

    RetentionCleanupResult last = enforcer.shutdown();
    assertFalse(enforcer.isScheduledCleanupActive());
    assertTrue(last.success());
  }
}
