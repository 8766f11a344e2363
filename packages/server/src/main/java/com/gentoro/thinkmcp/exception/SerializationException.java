package com.gentoro.thinkmcp.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends ThinkMcpException {
  public SerializationException(String message) {
    super(ThinkMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
