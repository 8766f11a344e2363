package com.gentoro.thinkmcp.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.thinkmcp.analytics.ToolName;
import com.gentoro.thinkmcp.analytics.tracking.AnalyticsMiddleware;
import com.gentoro.thinkmcp.exception.ValidationException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validates the arguments of one reasoning tool call against its {@link ToolCatalog} entry and
 * acknowledges what was received.
 *
 * <p>Required properties must be present and non-null; required strings must not be blank and
 * required string arrays must not be empty. Values must match the declared JSON type.
 */
public class ReasoningToolHandler
    implements AnalyticsMiddleware.ToolHandler<Map<String, Object>, ReasoningToolHandler.Ack> {

  /** Acknowledgement returned to the client. {@code itemCounts} holds the size of array fields. */
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public record Ack(
      ToolName tool, String status, List<String> providedFields, Map<String, Integer> itemCounts) {}

  public static final String STATUS_PROCESSED = "processed";

  private final ToolCatalog.ToolDefinition definition;

  public ReasoningToolHandler(ToolName toolName) {
    this.definition = ToolCatalog.definition(toolName);
  }

  public ToolName toolName() {
    return definition.toolName();
  }

  @Override
  public Ack handle(Map<String, Object> arguments) {
    Map<String, Object> args = arguments == null ? Map.of() : arguments;
    for (String field : definition.required()) {
      Object value = args.get(field);
      if (value == null) {
        throw invalid(field, "is required");
      }
      if (value instanceof String s && s.isBlank()) {
        throw invalid(field, "must not be blank");
      }
    }

    Map<String, Integer> itemCounts = new TreeMap<>();
    for (Map.Entry<String, Object> entry : new TreeMap<>(args).entrySet()) {
      Object schema = definition.properties().get(entry.getKey());
      if (!(schema instanceof Map<?, ?> property) || entry.getValue() == null) {
        continue;
      }
      checkType(entry.getKey(), property, entry.getValue());
      if (entry.getValue() instanceof Collection<?> items) {
        itemCounts.put(entry.getKey(), items.size());
      }
    }

    List<String> provided =
        args.keySet().stream().filter(k -> args.get(k) != null).sorted().toList();
    return new Ack(definition.toolName(), STATUS_PROCESSED, provided, itemCounts);
  }

  private void checkType(String field, Map<?, ?> property, Object value) {
    String type = String.valueOf(property.get("type"));
    boolean matches =
        switch (type) {
          case "string" -> value instanceof String;
          case "boolean" -> value instanceof Boolean;
          case "integer" ->
              value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue());
          case "number" -> value instanceof Number;
          case "array" -> value instanceof Collection<?>;
          case "object" -> value instanceof Map<?, ?>;
          default -> true;
        };
    if (!matches) {
      throw invalid(field, "must be of type " + type);
    }
    if (property.get("minimum") instanceof Number min
        && value instanceof Number n
        && n.doubleValue() < min.doubleValue()) {
      throw invalid(field, "must be at least " + min);
    }
    if (property.get("minItems") instanceof Number minItems
        && value instanceof Collection<?> items
        && items.size() < minItems.intValue()) {
      throw invalid(field, "must contain at least " + minItems + " item(s)");
    }
  }

  private ValidationException invalid(String field, String problem) {
    return new ValidationException(
        "Invalid %s arguments: '%s' %s".formatted(definition.name(), field, problem),
        Map.of("tool", definition.name(), "field", field));
  }
}
