package com.gentoro.thinkmcp;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line parameters in {@code --name value} form.
 *
 * <p>A parameter followed directly by another {@code --name} (or by nothing) is a flag and reads
 * as {@code "true"}.
 */
public class StartupParameters {

  public static final Set<String> MODES = Set.of("server", "analytics", "help");
  public static final Set<String> COMMANDS =
      Set.of(
          "enable", "disable", "status", "export", "clear", "cleanup", "insights", "privacy");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "server"); // server, analytics, help
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = "true";

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("analytics".equals(mode)) {
      Object command = parameters.get("command");
      if (command == null || !COMMANDS.contains(command.toString())) {
        throw new IllegalArgumentException(
            "Invalid analytics command: %s (expected one of %s)"
                .formatted(command, String.join(", ", COMMANDS.stream().sorted().toList())));
      }
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/think-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  /** True when the flag is present and not explicitly set to false. */
  public boolean isFlagSet(String name) {
    Object value = parameters.get(name);
    return value != null && !"false".equalsIgnoreCase(value.toString());
  }
}
