package com.gentoro.thinkmcp.exception;

/** I/O operation failed (filesystem, classpath, streams). */
public class IoException extends ThinkMcpException {
  public IoException(String message) {
    super(ThinkMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.IO_ERROR, message, cause);
  }
}
