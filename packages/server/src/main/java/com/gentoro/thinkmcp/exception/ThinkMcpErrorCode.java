package com.gentoro.thinkmcp.exception;

/**
 * Canonical error codes for think-mcp. Codes are stable and suitable for logs and tool responses.
 * Prefer the most specific code that reflects the failure origin.
 */
public enum ThinkMcpErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Runtime
  EXECUTION_ERROR,
  NETWORK_ERROR,
}
