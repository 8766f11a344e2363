package com.gentoro.thinkmcp.analytics.consent;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Outcome of a consent mutation. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsentResult(boolean success, String error) {

  public static ConsentResult ok() {
    return new ConsentResult(true, null);
  }

  public static ConsentResult failed(String error) {
    return new ConsentResult(false, error);
  }
}
