package com.gentoro.thinkmcp.http;

import com.gentoro.thinkmcp.ThinkMcp;
import com.gentoro.thinkmcp.exception.ConfigException;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join) and exposes the {@link
 * ServletContextHandler} so the actuator and MCP endpoints can register their servlets before the
 * server starts. Binding is read from {@code http.hostname} and {@code http.port}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private static final String NETWORK_HINT =
      "Please, check if the chosen port and hostname are available and that this process has"
          + " the proper permission to start a new listener on these configurations";

  private final ThinkMcp thinkMcp;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(ThinkMcp thinkMcp) {
    this.thinkMcp = thinkMcp;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = thinkMcp.configuration().getInt("http.port", 8080);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = thinkMcp.configuration().getString("http.hostname", "0.0.0.0");
        if (hostname == null || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }
      log.trace("Binding Jetty to {}:{}", hostname, port);

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. " + NETWORK_HINT,
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() throws Exception {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. " + NETWORK_HINT,
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // Logged only, so the remaining services still get to stop.
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return thinkMcp.configuration().getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
