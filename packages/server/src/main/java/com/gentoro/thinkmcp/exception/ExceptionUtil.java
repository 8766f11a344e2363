package com.gentoro.thinkmcp.exception;

import java.util.function.Function;

/** Utility helpers for turning exceptions into messages and into {@link ThinkMcpException}s. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /** Message of the throwable, or its simple class name when it carries none. */
  public static String describe(Throwable t) {
    if (t == null) return "unknown error";
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  public static ThinkMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ThinkMcpException> supplier) {
    if (t instanceof ThinkMcpException) {
      return (ThinkMcpException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
