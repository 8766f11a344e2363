package com.gentoro.thinkmcp.actuator;

import com.gentoro.thinkmcp.ThinkMcp;
import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.collector.CollectorStats;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the shape of Spring Boot's actuator health endpoint.
 *
 * <p>Registers a servlet at path: /actuator/health
 *
 * <p>Response body: {"status":"UP","analytics":{"enabled":false,"pendingEvents":0}}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final ThinkMcp thinkMcp;

  public ActuatorService(ThinkMcp thinkMcp) {
    this.thinkMcp = thinkMcp;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    thinkMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet(this)), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  /** Current health document. */
  public Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    AnalyticsContext analytics = thinkMcp.analytics();
    if (analytics != null) {
      CollectorStats stats = analytics.collector().getStats();
      Map<String, Object> section = new LinkedHashMap<>();
      section.put("enabled", stats.enabled());
      section.put("pendingEvents", stats.pendingEvents());
      body.put("analytics", section);
    }
    return body;
  }

  private static class ActuatorServlet extends HttpServlet {
    private final transient ActuatorService service;

    ActuatorServlet(ActuatorService service) {
      this.service = service;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toCompactJson(service.health()));
      }
    }
  }
}
