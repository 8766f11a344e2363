package com.gentoro.thinkmcp.analytics.consent;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted consent decision. {@code consentedAt} survives a withdrawal and {@code withdrawnAt}
 * survives a re-grant, so the file keeps a minimal audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsentRecord(
    boolean hasConsented, String consentedAt, String withdrawnAt, String policyVersion) {}
