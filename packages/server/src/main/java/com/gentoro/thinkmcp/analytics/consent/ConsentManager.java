package com.gentoro.thinkmcp.analytics.consent;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import com.gentoro.thinkmcp.exception.ExceptionUtil;
import com.gentoro.thinkmcp.utility.FileUtility;
import com.gentoro.thinkmcp.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Owns the single consent record stored as {@code consent.json} in the config directory.
 *
 * <p>A missing file means the user has never been asked (first run). A file that cannot be parsed
 * or lacks the required fields is treated as "no consent" rather than as an error. Reads are
 * cached; mutations write the file atomically and refresh the cache. Mutations never throw, they
 * report failures through {@link ConsentResult}.
 */
public class ConsentManager {
  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(ConsentManager.class);

  public static final String CURRENT_POLICY_VERSION = "1.0.0";
  public static final String CONSENT_FILE_NAME = "consent.json";

  private final AnalyticsConfigManager configManager;
  private final Path consentFile;
  private final Clock clock;
  private final Object lock = new Object();

  // null until loaded; Holder.record() is null when no valid record exists
  private volatile Holder cached;

  private record Holder(ConsentRecord record) {}

  public ConsentManager(AnalyticsConfigManager configManager, Clock clock) {
    this(configManager, configManager.configDir().resolve(CONSENT_FILE_NAME), clock);
  }

  public ConsentManager(AnalyticsConfigManager configManager, Path consentFile, Clock clock) {
    this.configManager = configManager;
    this.consentFile = Objects.requireNonNull(consentFile, "consentFile");
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /** True when a valid record exists and consent has not been withdrawn. */
  public boolean isConsentGiven() {
    ConsentRecord record = getRecord();
    return record != null && record.hasConsented();
  }

  /** The current record, or {@code null} when none exists or the file is invalid. */
  public ConsentRecord getRecord() {
    Holder holder = cached;
    if (holder == null) {
      synchronized (lock) {
        holder = cached;
        if (holder == null) {
          holder = new Holder(load());
          cached = holder;
        }
      }
    }
    return holder.record();
  }

  /** The consent file has never been written. */
  public boolean isFirstRun() {
    return !Files.exists(consentFile);
  }

  /** Consent was given under a policy version other than the current one. */
  public boolean needsReConsent() {
    ConsentRecord record = getRecord();
    return record != null
        && record.hasConsented()
        && !CURRENT_POLICY_VERSION.equals(record.policyVersion());
  }

  public ConsentStatus getConsentStatus() {
    ConsentRecord record = getRecord();
    return new ConsentStatus(
        record != null && record.hasConsented(),
        record == null ? null : record.consentedAt(),
        record == null ? null : record.withdrawnAt(),
        record == null ? CURRENT_POLICY_VERSION : record.policyVersion(),
        needsReConsent(),
        isFirstRun());
  }

  public ConsentResult grantConsent() {
    return grantConsent(true);
  }

  /**
   * Record consent under the current policy version.
   *
   * @param enableAnalytics also persist {@code enabled=true} in the analytics configuration
   */
  public ConsentResult grantConsent(boolean enableAnalytics) {
    synchronized (lock) {
      try {
        ConsentRecord existing = getRecord();
        ConsentRecord updated =
            new ConsentRecord(
                true,
                now(),
                existing == null ? null : existing.withdrawnAt(),
                CURRENT_POLICY_VERSION);
        write(updated);
        if (enableAnalytics && configManager != null) {
          configManager.enable();
        }
        log.info("Analytics consent granted (policy {})", CURRENT_POLICY_VERSION);
        return ConsentResult.ok();
      } catch (Exception e) {
        log.error("Failed to grant analytics consent", e);
        return ConsentResult.failed(ExceptionUtil.describe(e));
      }
    }
  }

  public ConsentResult withdrawConsent() {
    return withdrawConsent(true);
  }

  /**
   * Withdraw consent. The original grant timestamp is kept.
   *
   * @param disableAnalytics also persist {@code enabled=false} in the analytics configuration
   */
  public ConsentResult withdrawConsent(boolean disableAnalytics) {
    synchronized (lock) {
      try {
        ConsentRecord existing = getRecord();
        ConsentRecord updated =
            new ConsentRecord(
                false,
                existing == null ? null : existing.consentedAt(),
                now(),
                existing == null ? CURRENT_POLICY_VERSION : existing.policyVersion());
        write(updated);
        if (disableAnalytics && configManager != null) {
          configManager.disable();
        }
        log.info("Analytics consent withdrawn");
        return ConsentResult.ok();
      } catch (Exception e) {
        log.error("Failed to withdraw analytics consent", e);
        return ConsentResult.failed(ExceptionUtil.describe(e));
      }
    }
  }

  public ConsentResult setConsent(boolean consented) {
    return consented ? grantConsent() : withdrawConsent();
  }

  /** Re-confirm an existing consent under the current policy version. */
  public ConsentResult updateConsentForNewPolicy() {
    synchronized (lock) {
      ConsentRecord existing = getRecord();
      if (existing == null || !existing.hasConsented()) {
        return ConsentResult.failed("No existing consent to update");
      }
      try {
        write(new ConsentRecord(true, now(), existing.withdrawnAt(), CURRENT_POLICY_VERSION));
        return ConsentResult.ok();
      } catch (Exception e) {
        log.error("Failed to update analytics consent", e);
        return ConsentResult.failed(ExceptionUtil.describe(e));
      }
    }
  }

  /**
   * Remove the consent file entirely, returning the process to first-run state.
   *
   * @return true when a file was removed
   */
  public boolean deleteConsentRecord() {
    synchronized (lock) {
      boolean deleted = FileUtility.deleteQuietly(consentFile);
      cached = null;
      return deleted;
    }
  }

  public void clearCache() {
    cached = null;
  }

  public Path consentFile() {
    return consentFile;
  }

  private void write(ConsentRecord record) {
    FileUtility.writeAtomically(consentFile, JacksonUtility.toJson(record));
    cached = new Holder(record);
  }

  private ConsentRecord load() {
    try {
      String content = FileUtility.readIfExists(consentFile);
      if (content == null) {
        return null;
      }
      JsonNode node = JacksonUtility.getJsonMapper().readTree(content);
      if (node == null
          || !node.isObject()
          || !node.path("hasConsented").isBoolean()
          || !node.path("policyVersion").isTextual()) {
        log.warn("Consent file {} is invalid; treating as no consent", consentFile);
        return null;
      }
      return new ConsentRecord(
          node.get("hasConsented").booleanValue(),
          textOrNull(node, "consentedAt"),
          textOrNull(node, "withdrawnAt"),
          node.get("policyVersion").asText());
    } catch (Exception e) {
      log.warn("Consent file {} is unreadable; treating as no consent", consentFile);
      return null;
    }
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  private String now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
  }
}
