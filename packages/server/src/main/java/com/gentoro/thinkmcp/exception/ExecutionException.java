package com.gentoro.thinkmcp.exception;

/** Runtime failure while executing a command or tool. */
public class ExecutionException extends ThinkMcpException {
  public ExecutionException(String message) {
    super(ThinkMcpErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.EXECUTION_ERROR, message, cause);
  }
}
