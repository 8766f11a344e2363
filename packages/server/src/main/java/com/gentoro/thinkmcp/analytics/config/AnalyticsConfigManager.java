package com.gentoro.thinkmcp.analytics.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.thinkmcp.exception.ConfigException;
import com.gentoro.thinkmcp.exception.IoException;
import com.gentoro.thinkmcp.exception.ValidationException;
import com.gentoro.thinkmcp.utility.FileUtility;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolves the effective {@link AnalyticsConfig} from layered sources.
 *
 * <p>Precedence, highest first: explicit overrides set through {@link #setOverride}, environment
 * variables ({@code THINK_MCP_ANALYTICS_*}), the persisted {@code analytics.json} in the config
 * directory, the {@code analytics.*} keys of the application configuration, built-in defaults.
 *
 * <p>The resolved configuration is cached until {@link #reload()}, {@link #setOverride} or
 * {@link #clearOverrides()} invalidate it. Environment values that cannot be parsed are ignored;
 * values that parse but are out of range surface as validation errors.
 */
public class AnalyticsConfigManager {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(AnalyticsConfigManager.class);

  public static final String CONFIG_FILE_NAME = "analytics.json";
  public static final String DEFAULT_CONFIG_DIR = "~/.think-mcp";

  static final int MAX_RECOMMENDED_RETENTION_DAYS = 365;
  static final int MAX_RECOMMENDED_BATCH_SIZE = 1000;
  static final long MIN_FLUSH_INTERVAL_MS = 1000L;
  static final long MAX_RECOMMENDED_FLUSH_INTERVAL_MS = 300_000L;

  private final Configuration application;
  private final Path configDir;
  private final Map<String, String> environment;
  private final Map<ConfigField, Object> overrides = new EnumMap<>(ConfigField.class);
  private volatile Resolved cached;

  /**
   * @param application application configuration; may be {@code null}
   * @param configDir directory holding {@code analytics.json} and {@code consent.json}
   * @param environment environment variables, usually {@link System#getenv()}
   */
  public AnalyticsConfigManager(
      Configuration application, Path configDir, Map<String, String> environment) {
    this.application = application;
    this.configDir = Objects.requireNonNull(configDir, "configDir");
    this.environment = environment == null ? Collections.emptyMap() : Map.copyOf(environment);
  }

  /** Config directory named by {@code analytics.config-dir}, defaulting to ~/.think-mcp. */
  public static Path defaultConfigDir(Configuration application) {
    String location =
        application == null
            ? DEFAULT_CONFIG_DIR
            : application.getString("analytics.config-dir", DEFAULT_CONFIG_DIR);
    if (location == null || location.isBlank()) {
      location = DEFAULT_CONFIG_DIR;
    }
    return FileUtility.expandHome(location);
  }

  /** A resolved configuration together with the layer that supplied each field. */
  public record Resolved(
      AnalyticsConfig config,
      Map<ConfigField, ConfigSource> sources,
      ConfigValidationResult validation) {}

  /**
   * Returns the cached effective configuration.
   *
   * @throws ConfigException when the configuration fails validation; the exception context lists
   *     every offending field
   */
  public AnalyticsConfig getConfig() {
    Resolved resolved = resolve();
    ConfigValidationResult validation = resolved.validation();
    if (!validation.valid()) {
      List<String> errors = validation.errors().stream().map(Object::toString).toList();
      throw new ConfigException(
          "Invalid analytics configuration: " + String.join("; ", errors),
          Map.of("errors", errors));
    }
    return resolved.config();
  }

  public Resolved resolve() {
    Resolved current = cached;
    if (current == null) {
      synchronized (this) {
        current = cached;
        if (current == null) {
          current = computeResolved();
          cached = current;
        }
      }
    }
    return current;
  }

  public Map<ConfigField, ConfigSource> getSources() {
    return resolve().sources();
  }

  /** Validate the current resolution without throwing. */
  public ConfigValidationResult validate() {
    return resolve().validation();
  }

  public static ConfigValidationResult validate(AnalyticsConfig config) {
    List<ConfigValidationResult.FieldIssue> errors = new ArrayList<>();
    List<ConfigValidationResult.FieldIssue> warnings = new ArrayList<>();

    if (config.retentionDays() < 1) {
      errors.add(issue(ConfigField.RETENTION_DAYS, "must be at least 1"));
    } else if (config.retentionDays() > MAX_RECOMMENDED_RETENTION_DAYS) {
      warnings.add(
          issue(
              ConfigField.RETENTION_DAYS,
              "is greater than " + MAX_RECOMMENDED_RETENTION_DAYS + " days"));
    }

    if (config.storagePath() == null || config.storagePath().toString().isBlank()) {
      errors.add(issue(ConfigField.STORAGE_PATH, "must not be empty"));
    }

    if (config.batchSize() < 1) {
      errors.add(issue(ConfigField.BATCH_SIZE, "must be at least 1"));
    } else if (config.batchSize() > MAX_RECOMMENDED_BATCH_SIZE) {
      warnings.add(
          issue(ConfigField.BATCH_SIZE, "is greater than " + MAX_RECOMMENDED_BATCH_SIZE));
    }

    if (config.flushIntervalMs() < MIN_FLUSH_INTERVAL_MS) {
      errors.add(
          issue(ConfigField.FLUSH_INTERVAL_MS, "must be at least " + MIN_FLUSH_INTERVAL_MS + "ms"));
    } else if (config.flushIntervalMs() > MAX_RECOMMENDED_FLUSH_INTERVAL_MS) {
      warnings.add(
          issue(
              ConfigField.FLUSH_INTERVAL_MS,
              "is greater than " + MAX_RECOMMENDED_FLUSH_INTERVAL_MS + "ms"));
    }

    return new ConfigValidationResult(errors.isEmpty(), errors, warnings);
  }

  /**
   * Set an explicit override that wins over every other layer.
   *
   * @throws ValidationException when the value cannot be converted to the field's type
   */
  public void setOverride(ConfigField field, Object value) {
    Object normalized = normalize(field, value);
    if (normalized == null) {
      throw new ValidationException(
          "Invalid value for %s: %s".formatted(field.key(), value),
          Map.of("field", field.key()));
    }
    synchronized (this) {
      overrides.put(field, normalized);
      cached = null;
    }
  }

  public void setOverride(String key, Object value) {
    setOverride(ConfigField.fromKey(key), value);
  }

  public synchronized void clearOverrides() {
    overrides.clear();
    cached = null;
  }

  /** Drop the cached resolution so the next read consults every layer again. */
  public void reload() {
    cached = null;
  }

  /**
   * Persist the fields of {@code config} that differ from the defaults into {@code
   * analytics.json}.
   */
  public void save(AnalyticsConfig config) {
    AnalyticsConfig baseline = baseline();
    Map<String, Object> values = new LinkedHashMap<>();
    if (config.enabled() != baseline.enabled()) {
      values.put(ConfigField.ENABLED.key(), config.enabled());
    }
    if (config.retentionDays() != baseline.retentionDays()) {
      values.put(ConfigField.RETENTION_DAYS.key(), config.retentionDays());
    }
    if (!Objects.equals(config.storagePath(), baseline.storagePath())) {
      values.put(ConfigField.STORAGE_PATH.key(), String.valueOf(config.storagePath()));
    }
    if (config.batchSize() != baseline.batchSize()) {
      values.put(ConfigField.BATCH_SIZE.key(), config.batchSize());
    }
    if (config.flushIntervalMs() != baseline.flushIntervalMs()) {
      values.put(ConfigField.FLUSH_INTERVAL_MS.key(), config.flushIntervalMs());
    }
    FileUtility.writeAtomically(configFile(), JacksonUtility.toJson(values));
    log.debug("Saved analytics configuration with {} non-default field(s)", values.size());
    reload();
  }

  /** Persist {@code enabled=true} in the config file. */
  public void enable() {
    persistEnabled(true);
  }

  /** Persist {@code enabled=false} in the config file. */
  public void disable() {
    persistEnabled(false);
  }

  /**
   * Create the storage directory of the effective configuration if needed.
   *
   * @return the storage directory
   */
  public Path ensureStorageExists() {
    Path storage = getConfig().storagePath();
    try {
      Files.createDirectories(storage);
      return storage;
    } catch (IOException e) {
      throw new IoException("Failed to create analytics storage directory: " + storage, e);
    }
  }

  public Path configDir() {
    return configDir;
  }

  public Path configFile() {
    return configDir.resolve(CONFIG_FILE_NAME);
  }

  private void persistEnabled(boolean enabled) {
    ObjectNode node = readFileNode();
    if (node == null) {
      node = JacksonUtility.getJsonMapper().createObjectNode();
    }
    node.put(ConfigField.ENABLED.key(), enabled);
    FileUtility.writeAtomically(configFile(), JacksonUtility.toJson(node));
    reload();
    ConfigSource winner = getSources().get(ConfigField.ENABLED);
    if (winner == ConfigSource.ENVIRONMENT || winner == ConfigSource.OVERRIDE) {
      log.warn(
          "Analytics enabled={} saved, but the value from {} takes precedence",
          enabled,
          winner.name().toLowerCase(Locale.ROOT));
    } else {
      log.info("Analytics {}", enabled ? "enabled" : "disabled");
    }
  }

  private AnalyticsConfig baseline() {
    Map<ConfigField, Object> values = defaults();
    applyApplicationLayer(values, new EnumMap<>(ConfigField.class));
    return toConfig(values);
  }

  private Resolved computeResolved() {
    Map<ConfigField, Object> values = defaults();
    Map<ConfigField, ConfigSource> sources = new EnumMap<>(ConfigField.class);
    for (ConfigField field : ConfigField.values()) {
      sources.put(field, ConfigSource.DEFAULT);
    }

    applyApplicationLayer(values, sources);

    ObjectNode file = readFileNode();
    if (file != null) {
      for (ConfigField field : ConfigField.values()) {
        JsonNode node = file.get(field.key());
        if (node == null || node.isNull()) continue;
        Object value = normalize(field, node.isTextual() ? node.asText() : toPlain(node));
        if (value == null) {
          log.warn("Ignoring invalid {} value in {}", field.key(), configFile());
          continue;
        }
        values.put(field, value);
        sources.put(field, ConfigSource.FILE);
      }
    }

    for (ConfigField field : ConfigField.values()) {
      String raw = environment.get(field.environmentVariable());
      if (raw == null || raw.isBlank()) continue;
      Object value = normalize(field, raw);
      if (value == null) {
        log.debug("Ignoring unparseable {}", field.environmentVariable());
        continue;
      }
      if (!inRange(field, value)) {
        log.debug("Ignoring out-of-range {}={}", field.environmentVariable(), raw);
        continue;
      }
      values.put(field, value);
      sources.put(field, ConfigSource.ENVIRONMENT);
    }

    synchronized (this) {
      overrides.forEach(
          (field, value) -> {
            values.put(field, value);
            sources.put(field, ConfigSource.OVERRIDE);
          });
    }

    AnalyticsConfig config = toConfig(values);
    ConfigValidationResult validation = validate(config);
    validation.warnings().forEach(w -> log.warn("Analytics configuration warning: {}", w));
    return new Resolved(config, Collections.unmodifiableMap(sources), validation);
  }

  private Map<ConfigField, Object> defaults() {
    Map<ConfigField, Object> values = new EnumMap<>(ConfigField.class);
    values.put(ConfigField.ENABLED, AnalyticsConfig.DEFAULT_ENABLED);
    values.put(ConfigField.RETENTION_DAYS, AnalyticsConfig.DEFAULT_RETENTION_DAYS);
    values.put(ConfigField.STORAGE_PATH, configDir.resolve("analytics").toString());
    values.put(ConfigField.BATCH_SIZE, AnalyticsConfig.DEFAULT_BATCH_SIZE);
    values.put(ConfigField.FLUSH_INTERVAL_MS, AnalyticsConfig.DEFAULT_FLUSH_INTERVAL_MS);
    return values;
  }

  private void applyApplicationLayer(
      Map<ConfigField, Object> values, Map<ConfigField, ConfigSource> sources) {
    if (application == null) return;
    for (ConfigField field : ConfigField.values()) {
      if (!application.containsKey(field.applicationKey())) continue;
      String raw = application.getString(field.applicationKey(), null);
      if (raw == null || raw.isBlank()) continue;
      Object value = normalize(field, raw);
      if (value == null) {
        log.warn("Ignoring invalid application setting {}={}", field.applicationKey(), raw);
        continue;
      }
      values.put(field, value);
      sources.put(field, ConfigSource.APPLICATION);
    }
  }

  private ObjectNode readFileNode() {
    try {
      String content = FileUtility.readIfExists(configFile());
      if (content == null || content.isBlank()) {
        return null;
      }
      JsonNode node = JacksonUtility.getJsonMapper().readTree(content);
      if (node instanceof ObjectNode objectNode) {
        return objectNode;
      }
      log.warn("Ignoring analytics config file {}: not a JSON object", configFile());
      return null;
    } catch (Exception e) {
      log.warn("Ignoring unreadable analytics config file {}: {}", configFile(), e.getMessage());
      return null;
    }
  }

  private static Object toPlain(JsonNode node) {
    if (node.isBoolean()) return node.booleanValue();
    if (node.isIntegralNumber()) return node.longValue();
    if (node.isNumber()) return node.doubleValue();
    return null;
  }

  private static AnalyticsConfig toConfig(Map<ConfigField, Object> values) {
    String storage = (String) values.get(ConfigField.STORAGE_PATH);
    return new AnalyticsConfig(
        (Boolean) values.get(ConfigField.ENABLED),
        (Integer) values.get(ConfigField.RETENTION_DAYS),
        storage.isBlank() ? Path.of("") : FileUtility.expandHome(storage),
        (Integer) values.get(ConfigField.BATCH_SIZE),
        (Long) values.get(ConfigField.FLUSH_INTERVAL_MS));
  }

  /** True when a normalized value passes the field's hard limits. */
  static boolean inRange(ConfigField field, Object value) {
    return switch (field) {
      case RETENTION_DAYS, BATCH_SIZE -> (Integer) value >= 1;
      case FLUSH_INTERVAL_MS -> (Long) value >= MIN_FLUSH_INTERVAL_MS;
      case STORAGE_PATH -> !value.toString().isBlank();
      case ENABLED -> true;
    };
  }

  /** Convert a raw value to the field's canonical type, or {@code null} when it does not fit. */
  static Object normalize(ConfigField field, Object raw) {
    if (raw == null) return null;
    return switch (field) {
      case ENABLED -> parseBoolean(raw);
      case RETENTION_DAYS, BATCH_SIZE -> {
        Long value = parseLong(raw);
        yield value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE
            ? null
            : Integer.valueOf(value.intValue());
      }
      case FLUSH_INTERVAL_MS -> parseLong(raw);
      case STORAGE_PATH -> raw instanceof String || raw instanceof Path ? raw.toString() : null;
    };
  }

  static Boolean parseBoolean(Object raw) {
    if (raw instanceof Boolean b) return b;
    if (!(raw instanceof String s)) return null;
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> Boolean.TRUE;
      case "false", "0", "no", "off" -> Boolean.FALSE;
      default -> null;
    };
  }

  static Long parseLong(Object raw) {
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof Number n) {
      double d = n.doubleValue();
      return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
    }
    if (raw instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static ConfigValidationResult.FieldIssue issue(ConfigField field, String message) {
    return new ConfigValidationResult.FieldIssue(field.key(), field.key() + " " + message);
  }
}
