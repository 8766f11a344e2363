package com.gentoro.thinkmcp.analytics.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportResult(
    boolean success, DashboardExport data, String json, String filePath, String error) {

  public static ExportResult failed(String error) {
    return new ExportResult(false, null, null, null, error);
  }
}
