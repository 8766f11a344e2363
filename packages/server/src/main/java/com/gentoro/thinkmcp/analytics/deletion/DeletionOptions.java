package com.gentoro.thinkmcp.analytics.deletion;

/**
 * @param resetComponents rebuild the collector, storage and dependent components afterwards
 * @param deleteConsent also remove the consent record, returning to first-run state
 * @param reason free-form audit note supplied by the operator; may be {@code null}
 */
public record DeletionOptions(boolean resetComponents, boolean deleteConsent, String reason) {

  public static DeletionOptions defaults() {
    return new DeletionOptions(true, false, null);
  }

  public DeletionOptions withDeleteConsent(boolean value) {
    return new DeletionOptions(resetComponents, value, reason);
  }

  public DeletionOptions withReason(String value) {
    return new DeletionOptions(resetComponents, deleteConsent, value);
  }

  public DeletionOptions withResetComponents(boolean value) {
    return new DeletionOptions(value, deleteConsent, reason);
  }
}
