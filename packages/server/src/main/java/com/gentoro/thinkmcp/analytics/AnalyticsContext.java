package com.gentoro.thinkmcp.analytics;

import com.gentoro.thinkmcp.analytics.aggregation.AnalyticsExporter;
import com.gentoro.thinkmcp.analytics.aggregation.ErrorTracker;
import com.gentoro.thinkmcp.analytics.aggregation.InsightOptions;
import com.gentoro.thinkmcp.analytics.aggregation.InsightsGenerator;
import com.gentoro.thinkmcp.analytics.aggregation.UsageAggregator;
import com.gentoro.thinkmcp.analytics.collector.AnalyticsCollector;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfig;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import com.gentoro.thinkmcp.analytics.consent.ConsentManager;
import com.gentoro.thinkmcp.analytics.deletion.DataDeletionManager;
import com.gentoro.thinkmcp.analytics.retention.RetentionPolicyEnforcer;
import com.gentoro.thinkmcp.analytics.storage.AnalyticsStorage;
import com.gentoro.thinkmcp.analytics.storage.FileAnalyticsStorage;
import com.gentoro.thinkmcp.analytics.tracking.AnalyticsMiddleware;
import com.gentoro.thinkmcp.analytics.tracking.ToolInvocationTracker;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Owns one instance of every analytics component for the lifetime of the process.
 *
 * <p>Configuration, consent and the deletion manager live as long as the context. Storage, the
 * collector and everything reading from them are rebuilt by {@link #resetComponents()}, which
 * first shuts the previous collector down so nothing pending is lost. {@link #shutdown()} flushes
 * the collector and then lets the retention enforcer run its final cleanup.
 */
public class AnalyticsContext implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(AnalyticsContext.class);

  private final AnalyticsConfigManager configManager;
  private final ConsentManager consentManager;
  private final DataDeletionManager deletionManager;
  private final Clock clock;
  private final boolean autoCleanupOnInit;
  private final InsightOptions insightOptions;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  private volatile Components components;

  private record Components(
      AnalyticsStorage storage,
      AnalyticsCollector collector,
      ToolInvocationTracker tracker,
      AnalyticsMiddleware middleware,
      RetentionPolicyEnforcer retentionEnforcer,
      UsageAggregator usageAggregator,
      ErrorTracker errorTracker,
      InsightsGenerator insightsGenerator,
      AnalyticsExporter exporter) {}

  public AnalyticsContext(AnalyticsConfigManager configManager, Clock clock) {
    this(configManager, clock, true, InsightOptions.defaults());
  }

  public AnalyticsContext(
      AnalyticsConfigManager configManager,
      Clock clock,
      boolean autoCleanupOnInit,
      InsightOptions insightOptions) {
    this.configManager = configManager;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.autoCleanupOnInit = autoCleanupOnInit;
    this.insightOptions = insightOptions;
    this.consentManager = new ConsentManager(configManager, this.clock);
    this.deletionManager = new DataDeletionManager(this, this.clock);
    this.components = build();
  }

  /** Context wired to the process environment and the {@code analytics.*} application keys. */
  public static AnalyticsContext create(Configuration application) {
    AnalyticsConfigManager configManager =
        new AnalyticsConfigManager(
            application,
            AnalyticsConfigManager.defaultConfigDir(application),
            System.getenv());
    boolean autoCleanup =
        application == null || application.getBoolean("analytics.auto-cleanup-on-init", true);
    return new AnalyticsContext(
        configManager, Clock.systemUTC(), autoCleanup, InsightOptions.defaults());
  }

  /**
   * Rebuild storage, collector and dependent components from the current configuration. The
   * previous collector is shut down first, flushing whatever it still holds.
   */
  public synchronized void resetComponents() {
    Components previous = components;
    previous.retentionEnforcer().stopScheduledCleanup();
    previous.collector().shutdown();
    configManager.reload();
    consentManager.clearCache();
    components = build();
    log.debug("Analytics components rebuilt");
  }

  /** Flush pending events, then run the final retention pass. Runs once. */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    Components current = components;
    try {
      current.collector().shutdown();
    } catch (Exception e) {
      log.warn("Analytics collector shutdown failed", e);
    }
    try {
      current.retentionEnforcer().shutdown();
    } catch (Exception e) {
      log.warn("Analytics retention shutdown failed", e);
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public AnalyticsConfigManager configManager() {
    return configManager;
  }

  public ConsentManager consentManager() {
    return consentManager;
  }

  public DataDeletionManager deletionManager() {
    return deletionManager;
  }

  public AnalyticsStorage storage() {
    return components.storage();
  }

  public AnalyticsCollector collector() {
    return components.collector();
  }

  public ToolInvocationTracker tracker() {
    return components.tracker();
  }

  public AnalyticsMiddleware middleware() {
    return components.middleware();
  }

  public RetentionPolicyEnforcer retentionEnforcer() {
    return components.retentionEnforcer();
  }

  public UsageAggregator usageAggregator() {
    return components.usageAggregator();
  }

  public ErrorTracker errorTracker() {
    return components.errorTracker();
  }

  public InsightsGenerator insightsGenerator() {
    return components.insightsGenerator();
  }

  public AnalyticsExporter exporter() {
    return components.exporter();
  }

  public Clock clock() {
    return clock;
  }

  private Components build() {
    // Recording stays off while the configuration is invalid; storage still needs a safe
    // location and retention so reads and cleanup keep working.
    AnalyticsConfig config = configManager.resolve().config();
    int retentionDays = config.retentionDays();
    if (retentionDays < 1) {
      log.warn(
          "Invalid analytics retention of {} day(s); using {}",
          retentionDays,
          AnalyticsConfig.DEFAULT_RETENTION_DAYS);
      retentionDays = AnalyticsConfig.DEFAULT_RETENTION_DAYS;
    }
    Path storagePath = config.storagePath();
    if (storagePath == null || storagePath.toString().isBlank()) {
      storagePath = configManager.configDir().resolve("analytics");
    }
    AnalyticsStorage storage = new FileAnalyticsStorage(storagePath, retentionDays, clock);
    AnalyticsCollector collector =
        new AnalyticsCollector(configManager, consentManager, storage, clock);
    ToolInvocationTracker tracker = new ToolInvocationTracker(collector);
    RetentionPolicyEnforcer retention =
        new RetentionPolicyEnforcer(storage, collector, clock, autoCleanupOnInit);
    UsageAggregator aggregator = new UsageAggregator(storage);
    ErrorTracker errorTracker = new ErrorTracker(storage);
    InsightsGenerator insights =
        new InsightsGenerator(aggregator, errorTracker, insightOptions, clock);
    AnalyticsExporter exporter =
        new AnalyticsExporter(
            storage,
            aggregator,
            errorTracker,
            insights,
            () -> configManager.resolve().config().enabled() && consentManager.isConsentGiven(),
            clock);
    return new Components(
        storage,
        collector,
        tracker,
        new AnalyticsMiddleware(tracker),
        retention,
        aggregator,
        errorTracker,
        insights,
        exporter);
  }
}
