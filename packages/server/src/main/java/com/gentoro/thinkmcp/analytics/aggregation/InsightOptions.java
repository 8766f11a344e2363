package com.gentoro.thinkmcp.analytics.aggregation;

/**
 * Thresholds used by {@link InsightsGenerator}.
 *
 * @param errorRateThreshold error rate (fraction) from which a tool gets a reliability insight
 * @param slowResponseMs average duration above which a tool is reported as slow
 * @param trendChangePercent minimum absolute change for a usage trend insight
 * @param minInvocations invocations needed before anything beyond "collecting data" is reported
 */
public record InsightOptions(
    double errorRateThreshold, long slowResponseMs, double trendChangePercent, int minInvocations) {

  public static InsightOptions defaults() {
    return new InsightOptions(0.05, 1000L, 20.0, 10);
  }
}
