package com.gentoro.thinkmcp.analytics.config;

/** Layer that supplied a configuration value, lowest precedence first. */
public enum ConfigSource {
  DEFAULT,
  APPLICATION,
  FILE,
  ENVIRONMENT,
  OVERRIDE
}
