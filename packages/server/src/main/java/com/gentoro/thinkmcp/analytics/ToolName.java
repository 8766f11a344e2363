package com.gentoro.thinkmcp.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** The closed set of reasoning tools whose invocations can be recorded. */
public enum ToolName {
  TRACE(
      "trace",
      "Step-by-step sequential thinking with revisions and branches",
      "Break a complex problem into numbered thoughts and revise them as you learn more."),
  MODEL(
      "model",
      "Apply a mental model such as first principles or opportunity cost",
      "Frame a decision through an established mental model before committing to it."),
  PATTERN(
      "pattern",
      "Apply a software design pattern to a problem",
      "Check whether a known design pattern already solves the structure you are building."),
  PARADIGM(
      "paradigm",
      "Reason within a programming paradigm",
      "Compare functional, object-oriented or reactive framings of the same problem."),
  DEBUG(
      "debug",
      "Apply a systematic debugging approach",
      "Use binary search, divide and conquer or backtracking when a bug resists quick fixes."),
  COUNCIL(
      "council",
      "Collaborative reasoning among several expert personas",
      "Gather perspectives from several expert viewpoints on a contested design."),
  DECIDE(
      "decide",
      "Structured decision analysis across options and criteria",
      "Score options against explicit criteria when a choice has lasting consequences."),
  REFLECT(
      "reflect",
      "Metacognitive monitoring of a reasoning process",
      "Step back and assess confidence, gaps and biases in the current line of reasoning."),
  HYPOTHESIS(
      "hypothesis",
      "Scientific method: hypotheses, predictions and experiments",
      "Turn an assumption into a falsifiable hypothesis and plan how to test it."),
  DEBATE(
      "debate",
      "Structured argumentation with claims, premises and rebuttals",
      "Lay out the strongest arguments for and against a position before deciding."),
  MAP(
      "map",
      "Visual reasoning with diagrams of elements and relations",
      "Sketch the elements and relationships of a system to spot missing pieces.");

  private final String value;
  private final String description;
  private final String suggestion;

  ToolName(String value, String description, String suggestion) {
    this.value = value;
    this.description = description;
    this.suggestion = suggestion;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public String description() {
    return description;
  }

  /** A one-line hint on when the tool is worth reaching for. */
  public String suggestion() {
    return suggestion;
  }

  /**
   * Resolve a tool from its wire name.
   *
   * @throws IllegalArgumentException when the name is not one of the known tools
   */
  @JsonCreator
  public static ToolName fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ToolName tool : values()) {
        if (tool.value.equals(normalized)) {
          return tool;
        }
      }
    }
    throw new IllegalArgumentException("Unknown tool name: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
