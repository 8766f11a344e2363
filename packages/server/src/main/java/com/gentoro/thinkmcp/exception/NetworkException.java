package com.gentoro.thinkmcp.exception;

/** Listener or transport failure. */
public class NetworkException extends ThinkMcpException {
  public NetworkException(String message) {
    super(ThinkMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ThinkMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
