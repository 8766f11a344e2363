package com.gentoro.thinkmcp.analytics.consent;

import static com.gentoro.thinkmcp.analytics.AnalyticsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.thinkmcp.analytics.config.AnalyticsConfigManager;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConsentManager lifecycle")
class ConsentManagerTest {

  @TempDir Path dir;
  private AnalyticsConfigManager configManager;
  private ConsentManager consent;

  @BeforeEach
  void setUp() {
    configManager = configManager(dir);
    consent = new ConsentManager(configManager, CLOCK);
  }

  @Test
  @DisplayName("a fresh install is a first run without consent")
  void firstRun() {
    assertTrue(consent.isFirstRun());
    assertFalse(consent.isConsentGiven());
    assertNull(consent.getRecord());

    ConsentStatus status = consent.getConsentStatus();
    assertFalse(status.hasConsented());
    assertTrue(status.isFirstRun());
    assertEquals(ConsentManager.CURRENT_POLICY_VERSION, status.policyVersion());
  }

  @Test
  @DisplayName("granting writes consent.json and enables analytics in the config file")
  void grant() {
    ConsentResult result = consent.grantConsent();

    assertTrue(result.success());
    assertFalse(consent.isFirstRun());
    assertTrue(consent.isConsentGiven());
    assertEquals("2025-06-15T12:00:00Z", consent.getRecord().consentedAt());
    assertTrue(configManager.getConfig().enabled());
    assertTrue(Files.exists(dir.resolve("consent.json")));
  }

  @Test
  @DisplayName("withdrawing keeps the grant timestamp and disables analytics")
  void withdraw() {
    consent.grantConsent();
    ConsentResult result = consent.withdrawConsent();

    assertTrue(result.success());
    ConsentRecord record = consent.getRecord();
    assertFalse(record.hasConsented());
    assertEquals("2025-06-15T12:00:00Z", record.consentedAt());
    assertEquals("2025-06-15T12:00:00Z", record.withdrawnAt());
    assertFalse(configManager.getConfig().enabled());
  }

  @Test
  @DisplayName("the record survives a new manager instance")
  void persisted() {
    consent.grantConsent(false);
    ConsentManager reloaded = new ConsentManager(configManager, CLOCK);
    assertTrue(reloaded.isConsentGiven());
    assertFalse(configManager.getConfig().enabled());
  }

  @Test
  @DisplayName("corrupt or incomplete files read as no consent")
  void corruptFile() throws Exception {
    Path file = dir.resolve("consent.json");
    Files.writeString(file, "not json at all", StandardCharsets.UTF_8);
    assertFalse(consent.isConsentGiven());
    assertFalse(consent.isFirstRun());

    Files.writeString(file, "{\"hasConsented\": true}", StandardCharsets.UTF_8);
    consent.clearCache();
    assertFalse(consent.isConsentGiven());
  }

  @Test
  @DisplayName("consent under an older policy needs to be renewed")
  void reConsent() throws Exception {
    Files.writeString(
        dir.resolve("consent.json"),
        "{\"hasConsented\": true, \"consentedAt\": \"2024-01-01T00:00:00Z\","
            + " \"policyVersion\": \"0.9.0\"}",
        StandardCharsets.UTF_8);

    assertTrue(consent.isConsentGiven());
    assertTrue(consent.needsReConsent());

    assertTrue(consent.updateConsentForNewPolicy().success());
    assertFalse(consent.needsReConsent());
    assertEquals(ConsentManager.CURRENT_POLICY_VERSION, consent.getRecord().policyVersion());
  }

  @Test
  @DisplayName("renewal without an existing grant fails")
  void reConsentWithoutGrant() {
    ConsentResult result = consent.updateConsentForNewPolicy();
    assertFalse(result.success());
    assertNotNull(result.error());
  }

  @Test
  @DisplayName("deleting the record returns to the first-run state")
  void deleteRecord() {
    consent.grantConsent(false);
    assertTrue(consent.deleteConsentRecord());
    assertTrue(consent.isFirstRun());
    assertFalse(consent.isConsentGiven());
    assertFalse(consent.deleteConsentRecord());
  }
}
