package com.gentoro.thinkmcp;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StartupParameters")
class StartupParametersTest {

  @Test
  @DisplayName("defaults to server mode with the bundled configuration")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertFalse(params.isParameterPresent("command"));
  }

  @Test
  @DisplayName("a parameter without a value reads as a flag")
  void flags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "analytics", "--command", "disable", "--delete-data", "--reason", "moving"
            });

    assertEquals("disable", params.getParameter("command", String.class));
    assertTrue(params.isFlagSet("delete-data"));
    assertEquals("moving", params.getOptionalParameter("reason", String.class).orElseThrow());
    assertFalse(params.isFlagSet("verbose"));
  }

  @Test
  @DisplayName("an explicit false switches a flag off")
  void explicitFalse() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "analytics", "--command", "status", "--verbose", "false"});

    assertTrue(params.isParameterPresent("verbose"));
    assertFalse(params.isFlagSet("verbose"));
  }

  @Test
  @DisplayName("unknown modes and analytics commands are rejected")
  void invalid() {
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"--mode", "x"}));

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                new StartupParameters(new String[] {"--mode", "analytics", "--command", "purge"}));
    assertTrue(e.getMessage().contains("purge"));

    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "analytics"}));
  }
}
