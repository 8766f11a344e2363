package com.gentoro.thinkmcp;

import com.gentoro.thinkmcp.actuator.ActuatorService;
import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.cli.AnalyticsCommands;
import com.gentoro.thinkmcp.analytics.cli.CommandResult;
import com.gentoro.thinkmcp.analytics.retention.RetentionPolicyEnforcer;
import com.gentoro.thinkmcp.exception.ExecutionException;
import com.gentoro.thinkmcp.exception.StateException;
import com.gentoro.thinkmcp.http.EmbeddedJettyServer;
import com.gentoro.thinkmcp.mcp.McpServer;
import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

public class ThinkMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(ThinkMcp.class);

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private AnalyticsContext analytics;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public ThinkMcp(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), System.out);
  }

  public ThinkMcp(StartupParameters startupParameters, PrintStream out) {
    this.startupParameters = startupParameters;
    this.out = out;
  }

  /**
   * Load configuration and run the selected mode.
   *
   * @return process exit code; {@code 0} for server mode once it is listening
   */
  public int initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if ("help".equals(startupParameters.mode())) {
      out.println(usage());
      return CommandResult.EXIT_OK;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.thinkmcp.logging.LoggingService.applyConfiguration(configuration());
    this.analytics = createAnalytics(configuration());

    switch (startupParameters.mode()) {
      case "server":
        startServer();
        return CommandResult.EXIT_OK;
      case "analytics":
        try {
          CommandResult result = new AnalyticsCommands(analytics).run(startupParameters);
          out.println(result.message());
          return result.exitCode();
        } finally {
          shutdown();
        }
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  /** Hook for tests to supply a context with a fixed clock or directory. */
  protected AnalyticsContext createAnalytics(Configuration configuration) {
    return AnalyticsContext.create(configuration);
  }

  private void startServer() {
    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();

    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }

    if (analytics.collector().isEnabled()) {
      RetentionPolicyEnforcer retention = analytics.retentionEnforcer();
      retention.initialize();
      retention.startScheduledCleanup(
          Duration.ofHours(configuration().getLong("analytics.cleanup-interval-hours", 24L)));
      log.info(
          "Usage analytics enabled (session {}), data kept {} days",
          analytics.collector().getSessionId(),
          analytics.storage().getRetentionDays());
    } else if (analytics.consentManager().isFirstRun()) {
      log.info("Usage analytics are off. Enable with --mode analytics --command enable");
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    // Register a JVM shutdown hook once
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "think-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Release resources: pending analytics are flushed before the HTTP server stops. Safe to call
   * multiple times; executed only once.
   */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(analytics);
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ThinkMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public AnalyticsContext analytics() {
    return analytics;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: think-mcp [--mode server|analytics|help] [--config-file <location>] [options]",
        "",
        "Modes:",
        "  server      Serve the reasoning tools over MCP (default)",
        "  analytics   Run one analytics command and exit",
        "  help        Show this text",
        "",
        "Analytics commands (--command):",
        "  enable | disable [--delete-data] [--reason <text>]",
        "  status [--verbose]",
        "  export [--start YYYY-MM-DD] [--end YYYY-MM-DD] [--raw-events] [--format json|csv]"
            + " [--output <file>]",
        "  clear [--delete-consent] [--reason <text>]",
        "  cleanup [--dry-run]",
        "  insights [--start YYYY-MM-DD] [--end YYYY-MM-DD]",
        "  privacy [--brief]");
  }
}
