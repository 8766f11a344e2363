package com.gentoro.thinkmcp.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends ThinkMcpException {
  public ValidationException(String message) {
    super(ThinkMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, java.util.Map<String, ?> context) {
    super(ThinkMcpErrorCode.INVALID_ARGUMENT, message, context);
  }
}
