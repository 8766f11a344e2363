package com.gentoro.thinkmcp.analytics.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WriteResult(boolean success, int eventsWritten, String error) {

  public static WriteResult ok(int eventsWritten) {
    return new WriteResult(true, eventsWritten, null);
  }

  public static WriteResult failed(int eventsWritten, String error) {
    return new WriteResult(false, eventsWritten, error);
  }
}
