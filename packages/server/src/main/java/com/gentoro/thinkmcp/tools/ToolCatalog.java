package com.gentoro.thinkmcp.tools;

import com.gentoro.thinkmcp.analytics.ToolName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input contracts of the reasoning tools: the JSON schema properties each tool accepts and which
 * of them are required.
 */
public final class ToolCatalog {

  /** Input contract of one tool. {@code properties} is a JSON-schema properties object. */
  public record ToolDefinition(
      ToolName toolName, Map<String, Object> properties, List<String> required) {

    public String name() {
      return toolName.value();
    }

    public String description() {
      return toolName.description();
    }
  }

  private static final Map<ToolName, ToolDefinition> DEFINITIONS = new EnumMap<>(ToolName.class);

  static {
    define(
        ToolName.TRACE,
        new Schema()
            .string("thought", "The content of the thought", true)
            .integer("thoughtNumber", "Current thought number (1-indexed)", true)
            .integer("totalThoughts", "Total expected thoughts", true)
            .bool("nextThoughtNeeded", "Whether another thought is needed", true)
            .bool("isRevision", "Whether this thought revises a previous one", false)
            .integer("revisesThought", "Number of the thought being revised", false)
            .integer("branchFromThought", "Thought number this branch starts from", false)
            .string("branchId", "Identifier of the branch", false)
            .bool("needsMoreThoughts", "Whether more thoughts are needed than estimated", false));
    define(
        ToolName.MODEL,
        new Schema()
            .string("modelName", "The name of the mental model being applied", true)
            .string("problem", "The problem or scenario being analyzed", true)
            .strings("steps", "Steps for applying this mental model", true)
            .string("reasoning", "The reasoning process and analysis", true)
            .string(
                "conclusion", "The conclusion or insight gained from applying the model", true));
    define(
        ToolName.PATTERN,
        new Schema()
            .string("patternName", "The name of the design pattern", true)
            .string("context", "The context or problem where this pattern applies", true)
            .strings("implementation", "Steps or components for implementing the pattern", true)
            .strings("benefits", "Benefits of using this pattern", true)
            .strings("tradeoffs", "Tradeoffs or considerations when using this pattern", true)
            .string("codeExample", "Code example demonstrating the pattern", false)
            .string("languages", "Languages the example applies to", false));
    define(
        ToolName.PARADIGM,
        new Schema()
            .string("paradigmName", "The name of the programming paradigm", true)
            .string("problem", "The problem or situation being addressed", true)
            .strings("approach", "Steps or characteristics of the paradigm approach", true)
            .strings("benefits", "Benefits of using this paradigm", true)
            .strings("limitations", "Limitations or constraints of this paradigm", true)
            .string("codeExample", "Code example demonstrating the paradigm", false));
    define(
        ToolName.DEBUG,
        new Schema()
            .string("approachName", "The name of the debugging approach being used", true)
            .string("issue", "Description of the issue or bug being debugged", true)
            .strings("steps", "Steps taken to debug and diagnose the issue", true)
            .string("findings", "Key findings and observations from the debugging process", true)
            .string("resolution", "The resolution or solution to the issue", true));
    define(
        ToolName.COUNCIL,
        new Schema()
            .string("topic", "The topic being discussed", true)
            .objects("personas", "Personas participating in the discussion", true)
            .objects("contributions", "Contributions made during the discussion", true)
            .string("stage", "Current stage of the collaborative reasoning", true)
            .string("activePersonaId", "ID of the currently active persona", true)
            .string("sessionId", "Unique identifier for this reasoning session", true)
            .integer("iteration", "Current iteration number", true)
            .bool("nextContributionNeeded", "Whether another contribution is needed", true)
            .string(
                "finalRecommendation", "Final recommendation once a decision is reached", false));
    define(
        ToolName.DECIDE,
        new Schema()
            .string("decisionStatement", "Statement of the decision to be made", true)
            .objects("options", "Available options", true)
            .string("analysisType", "Type of analysis being performed", true)
            .string("stage", "Current stage of the decision process", true)
            .string("decisionId", "Unique identifier for this decision", true)
            .integer("iteration", "Current iteration number", true)
            .bool("nextStageNeeded", "Whether another stage is needed", true)
            .objects("criteria", "Criteria used to evaluate options", false)
            .string("recommendation", "Final recommendation", false));
    define(
        ToolName.REFLECT,
        new Schema()
            .string("task", "The task being monitored", true)
            .string("stage", "Current stage of metacognitive monitoring", true)
            .number("overallConfidence", "Overall confidence score (0-1)", true)
            .strings("uncertaintyAreas", "Areas of uncertainty", true)
            .string("recommendedApproach", "Recommended approach for the task", true)
            .string("monitoringId", "Unique identifier for this monitoring session", true)
            .integer("iteration", "Current iteration number", true)
            .bool("nextAssessmentNeeded", "Whether another assessment is needed", true));
    define(
        ToolName.HYPOTHESIS,
        new Schema()
            .string("stage", "Current stage of scientific inquiry", true)
            .string("inquiryId", "Unique identifier for this inquiry session", true)
            .integer("iteration", "Current iteration number", true)
            .bool("nextStageNeeded", "Whether another stage is needed", true)
            .string("observation", "Observation for the observation stage", false)
            .string("question", "Research question for the question stage", false)
            .object("hypothesis", "Hypothesis under consideration", false)
            .object("experiment", "Experiment designed to test the hypothesis", false)
            .string("analysis", "Analysis for the analysis stage", false)
            .string("conclusion", "Conclusion for the conclusion stage", false));
    define(
        ToolName.DEBATE,
        new Schema()
            .string("claim", "The main claim being made", true)
            .strings("premises", "Premises supporting the claim", true)
            .string("conclusion", "The conclusion drawn from the premises", true)
            .string("argumentType", "Type of argument (thesis, antithesis, synthesis, ...)", true)
            .number("confidence", "Confidence level (0-1)", true)
            .bool("nextArgumentNeeded", "Whether another argument is needed", true)
            .string("respondsTo", "ID of the argument this one responds to", false));
    define(
        ToolName.MAP,
        new Schema()
            .string(
                "operation",
                "Type of operation (create, update, delete, transform, observe)",
                true)
            .string("diagramId", "Unique identifier for this diagram", true)
            .string("diagramType", "Type of diagram (graph, flowchart, conceptMap, ...)", true)
            .integer("iteration", "Current iteration number", true)
            .bool("nextOperationNeeded", "Whether another operation is needed", true)
            .objects("elements", "Visual elements affected by the operation", false)
            .string("observation", "Observation about the diagram", false)
            .string("insight", "Insight gained from the diagram", false));
  }

  private ToolCatalog() {}

  public static ToolDefinition definition(ToolName toolName) {
    return DEFINITIONS.get(toolName);
  }

  /** Definitions of every tool, in declaration order of {@link ToolName}. */
  public static List<ToolDefinition> all() {
    return List.copyOf(DEFINITIONS.values());
  }

  private static void define(ToolName toolName, Schema schema) {
    DEFINITIONS.put(
        toolName,
        new ToolDefinition(
            toolName,
            Collections.unmodifiableMap(schema.properties),
            List.copyOf(schema.required)));
  }

  private static final class Schema {
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();

    Schema string(String name, String description, boolean mandatory) {
      return add(name, Map.of("type", "string", "description", description), mandatory);
    }

    Schema integer(String name, String description, boolean mandatory) {
      return add(
          name, Map.of("type", "integer", "minimum", 0, "description", description), mandatory);
    }

    Schema number(String name, String description, boolean mandatory) {
      return add(name, Map.of("type", "number", "description", description), mandatory);
    }

    Schema bool(String name, String description, boolean mandatory) {
      return add(name, Map.of("type", "boolean", "description", description), mandatory);
    }

    Schema strings(String name, String description, boolean mandatory) {
      return add(
          name,
          Map.of(
              "type", "array",
              "items", Map.of("type", "string"),
              "minItems", 1,
              "description", description),
          mandatory);
    }

    Schema objects(String name, String description, boolean mandatory) {
      return add(
          name,
          Map.of("type", "array", "items", Map.of("type", "object"), "description", description),
          mandatory);
    }

    Schema object(String name, String description, boolean mandatory) {
      return add(name, Map.of("type", "object", "description", description), mandatory);
    }

    private Schema add(String name, Map<String, Object> schema, boolean mandatory) {
      properties.put(name, schema);
      if (mandatory) {
        required.add(name);
      }
      return this;
    }
  }
}
