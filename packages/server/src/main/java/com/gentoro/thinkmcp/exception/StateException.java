package com.gentoro.thinkmcp.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends ThinkMcpException {
  public StateException(String message) {
    super(ThinkMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
