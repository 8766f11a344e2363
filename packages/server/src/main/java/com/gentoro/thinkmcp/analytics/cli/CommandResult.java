package com.gentoro.thinkmcp.analytics.cli;

import java.util.Map;

/**
 * Outcome of one analytics command: the text shown to the operator, the process exit code and an
 * optional structured payload.
 */
public record CommandResult(
    boolean success, String message, int exitCode, Map<String, Object> data) {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  public CommandResult {
    data = data == null ? Map.of() : data;
  }

  public static CommandResult ok(String message) {
    return new CommandResult(true, message, EXIT_OK, Map.of());
  }

  public static CommandResult ok(String message, Map<String, Object> data) {
    return new CommandResult(true, message, EXIT_OK, data);
  }

  public static CommandResult failed(String message) {
    return new CommandResult(false, message, EXIT_FAILURE, Map.of());
  }

  public static CommandResult usage(String message) {
    return new CommandResult(false, message, EXIT_USAGE, Map.of());
  }
}
