package com.gentoro.thinkmcp.analytics.tracking;

import com.gentoro.thinkmcp.analytics.ErrorCategory;
import com.gentoro.thinkmcp.analytics.ToolName;

/** Handle for one in-flight tool invocation. Only the first completion is recorded. */
public interface TrackedInvocation {

  ToolName toolName();

  /**
   * Record the outcome.
   *
   * @param success whether the tool call succeeded
   * @param errorCategory failure category; ignored on success, {@code null} means unknown
   */
  void complete(boolean success, ErrorCategory errorCategory);

  default void succeed() {
    complete(true, null);
  }

  default void fail(Throwable error) {
    complete(false, ErrorCategorizer.categorize(error));
  }

  boolean isCompleted();
}
