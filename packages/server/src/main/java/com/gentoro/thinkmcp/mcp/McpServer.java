package com.gentoro.thinkmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.thinkmcp.ThinkMcp;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.exception.ValidationException;
import com.gentoro.thinkmcp.tools.ReasoningToolHandler;
import com.gentoro.thinkmcp.tools.ToolCatalog;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * MCP endpoint exposing the reasoning tools over the streamable HTTP transport.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) – server name reported to clients; default:
 *       "think-mcp"
 *   <li><b>http.mcp.server.version</b> (string) – server version reported to clients; default:
 *       "1.0.0"
 * </ul>
 *
 * <p>Every tool call runs through the analytics middleware of the current {@link
 * com.gentoro.thinkmcp.analytics.AnalyticsContext}. The middleware is looked up per call because a
 * data deletion may rebuild the analytics components while the server is running.
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(McpServer.class);

  private final ThinkMcp thinkMcp;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(ThinkMcp thinkMcp) {
    this.thinkMcp = thinkMcp;
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void register() {
    String endpoint =
        normalizeEndpoint(thinkMcp.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = thinkMcp.configuration().getBoolean("http.mcp.disallow-delete", false);
    String serverName = thinkMcp.configuration().getString("http.mcp.server.name", "think-mcp");
    String serverVersion = thinkMcp.configuration().getString("http.mcp.server.version", "1.0.0");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecifications())
            .build();

    thinkMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{} with {} tools",
        thinkMcp.httpServer().getPort(),
        endpoint,
        ToolCatalog.all().size());
  }

  /** One tool specification per catalog entry. */
  public List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
    return ToolCatalog.all().stream()
        .map(
            definition ->
                McpServerFeatures.SyncToolSpecification.builder()
                    .tool(
                        McpSchema.Tool.builder()
                            .name(definition.name())
                            .description(definition.description())
                            .inputSchema(
                                new McpSchema.JsonSchema(
                                    "object",
                                    definition.properties(),
                                    definition.required(),
                                    false,
                                    Collections.emptyMap(),
                                    Collections.emptyMap()))
                            .build())
                    .callHandler(
                        (exchange, request) -> call(definition.toolName(), request.arguments()))
                    .build())
        .toList();
  }

  /**
   * Run one tool call through the analytics middleware. Failures are reported to the client as an
   * error result; the failure itself has already been recorded by the middleware.
   */
  public McpSchema.CallToolResult call(ToolName toolName, Map<String, Object> arguments) {
    try {
      ReasoningToolHandler.Ack ack =
          thinkMcp
              .analytics()
              .middleware()
              .withAnalytics(toolName, new ReasoningToolHandler(toolName))
              .handle(arguments);
      return McpSchema.CallToolResult.builder()
          .addTextContent(JacksonUtility.toJson(ack))
          .isError(false)
          .build();
    } catch (ValidationException e) {
      log.debug("Rejected {} call: {}", toolName, e.getMessage());
      return errorResult(e.getMessage());
    } catch (Exception e) {
      log.error("Failed to handle {} tool request", toolName, e);
      return errorResult(ExceptionUtil.describe(e));
    }
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } catch (Exception e) {
        log.warn("MCP server did not close gracefully", e);
      } finally {
        mcpServer = null;
      }
    }
    servletTransport = null;
  }

  private static McpSchema.CallToolResult errorResult(String message) {
    return McpSchema.CallToolResult.builder().addTextContent(message).isError(true).build();
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
