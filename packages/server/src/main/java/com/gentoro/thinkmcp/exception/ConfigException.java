package com.gentoro.thinkmcp.exception;

/** Configuration is missing, unreadable or invalid. */
public class ConfigException extends ThinkMcpException {
  public ConfigException(String message) {
    super(ThinkMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(String message, java.util.Map<String, ?> context) {
    super(ThinkMcpErrorCode.CONFIGURATION_ERROR, message, context);
  }
}
