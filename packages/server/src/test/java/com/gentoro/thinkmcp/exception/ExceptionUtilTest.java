package com.gentoro.thinkmcp.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExceptionUtil")
class ExceptionUtilTest {

  @Test
  @DisplayName("describe prefers the message and falls back to the class name")
  void describe() {
    assertEquals("disk full", ExceptionUtil.describe(new IllegalStateException("disk full")));
    assertEquals("IllegalStateException", ExceptionUtil.describe(new IllegalStateException()));
    assertEquals("IllegalStateException", ExceptionUtil.describe(new IllegalStateException(" ")));
    assertEquals("unknown error", ExceptionUtil.describe(null));
  }

  @Test
  @DisplayName("own exceptions pass through while foreign ones are wrapped")
  void rethrowIfUnchecked() {
    StateException own = new StateException("already running");
    assertSame(own, ExceptionUtil.rethrowIfUnchecked(own, t -> new IoException("wrapped", t)));

    UncheckedIOException foreign = new UncheckedIOException("boom", new IOException());
    ThinkMcpException wrapped =
        ExceptionUtil.rethrowIfUnchecked(foreign, t -> new IoException("wrapped", t));
    assertInstanceOf(IoException.class, wrapped);
    assertSame(foreign, wrapped.getCause());
  }
}
