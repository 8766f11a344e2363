package com.gentoro.thinkmcp.mcp;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.thinkmcp.ThinkMcp;
import com.gentoro.thinkmcp.analytics.AnalyticsContext;
import com.gentoro.thinkmcp.analytics.AnalyticsEvent;
import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.aggregation.InsightOptions;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("McpServer tool calls")
class McpServerTest {

  @TempDir Path dir;
  private AnalyticsContext analytics;
  private McpServer server;

  @BeforeEach
  void setUp() {
    analytics =
        new AnalyticsContext(
            enabledConfigManager(dir, 100), CLOCK, false, InsightOptions.defaults());
    analytics.consentManager().grantConsent(false);
    ThinkMcp thinkMcp = mock(ThinkMcp.class);
    when(thinkMcp.analytics()).thenReturn(analytics);
    server = new McpServer(thinkMcp);
  }

  @AfterEach
  void tearDown() {
    analytics.shutdown();
  }

  private static String text(McpSchema.CallToolResult result) {
    return ((McpSchema.TextContent) result.content().get(0)).text();
  }

  @Test
  @DisplayName("every tool is registered with its input schema")
  void toolRegistrations() {
    List<McpServerFeatures.SyncToolSpecification> specs = server.toolSpecifications();

    assertEquals(11, specs.size());
    McpSchema.Tool debate = specs.get(9).tool();
    assertEquals("debate", debate.name());
    assertEquals("object", debate.inputSchema().type());
    assertTrue(debate.inputSchema().required().contains("claim"));
  }

  @Test
  @DisplayName("a valid call is acknowledged and recorded")
  void validCall() {
    McpSchema.CallToolResult result =
        server.call(
            ToolName.DEBATE,
            Map.of(
                "claim", "Monorepos speed up refactoring",
                "premises", List.of("one build", "atomic commits"),
                "conclusion", "Adopt a monorepo",
                "argumentType", "thesis",
                "confidence", 0.7,
                "nextArgumentNeeded", false));

    assertFalse(result.isError());
    assertTrue(text(result).contains("\"status\" : \"processed\""), text(result));

    analytics.collector().flush();
    List<AnalyticsEvent> events = analytics.storage().readEventsForDate(TODAY).events();
    assertEquals(1, events.size());
    assertEquals(ToolName.DEBATE, events.get(0).toolName());
    assertTrue(events.get(0).success());
  }

  @Test
  @DisplayName("invalid arguments return an error result and a validation event")
  void invalidCall() {
    McpSchema.CallToolResult result = server.call(ToolName.REFLECT, Map.of("task", "review"));

    assertTrue(result.isError());
    assertTrue(text(result).startsWith("Invalid reflect arguments:"), text(result));

    analytics.collector().flush();
    List<AnalyticsEvent> events = analytics.storage().readEventsForDate(TODAY).events();
    assertEquals(1, events.size());
    assertFalse(events.get(0).success());
    assertEquals(ErrorCategory.VALIDATION, events.get(0).errorCategory());
  }
}
