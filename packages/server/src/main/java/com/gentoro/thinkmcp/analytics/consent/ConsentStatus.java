package com.gentoro.thinkmcp.analytics.consent;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Read-only view of the consent state for status output. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsentStatus(
    boolean hasConsented,
    String consentedAt,
    String withdrawnAt,
    String policyVersion,
    boolean needsReConsent,
    boolean isFirstRun) {}
