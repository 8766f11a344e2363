package com.gentoro.thinkmcp.analytics.cli;

import com.gentoro.thinkmcp.analytics.consent.ConsentManager;

/** Operator-facing privacy texts. Versioned together with the consent policy. */
public final class PrivacyNotice {

  public static final String VERSION = ConsentManager.CURRENT_POLICY_VERSION;

  public static final String SUMMARY =
      "Analytics track tool usage only (not content). Your data stays local.";

  public static final String BRIEF =
      String.join(
          "\n",
          "think-mcp can collect anonymous usage analytics to help improve the tool.",
          "",
          "What is collected:",
          "  - Which tools you use (e.g. trace, model, pattern)",
          "  - Success/error status (not error messages)",
          "  - Response times",
          "",
          "What is NOT collected:",
          "  - Your input content or arguments",
          "  - Personal information",
          "  - Error message text",
          "",
          "All data is stored locally on your machine and never transmitted.",
          "Default retention: 90 days.",
          "",
          "You can opt out at any time with: --mode analytics --command disable");

  public static final String FULL =
      String.join(
          "\n",
          "THINK-MCP PRIVACY NOTICE (version " + VERSION + ")",
          "",
          "Data collected, per tool invocation:",
          "  - Tool name",
          "  - Timestamp of invocation",
          "  - Success/error status",
          "  - Duration in milliseconds",
          "  - Error category (validation/runtime/timeout/unknown), never the message",
          "  - Random session id, regenerated on every start",
          "",
          "Data never collected:",
          "  - Tool arguments or input content",
          "  - Error messages or stack traces",
          "  - Username, host name, IP or machine identifiers",
          "  - File paths or file contents",
          "",
          "Storage: one JSON file per day in the local analytics directory.",
          "Retention: files older than the retention period are deleted automatically.",
          "Control: enable, disable, export and clear are available from the analytics commands.");

  public static final String QUICK_REFERENCE =
      String.join(
          "\n",
          "  --mode analytics --command enable      Opt in to analytics",
          "  --mode analytics --command disable     Opt out (add --delete-data to erase data)",
          "  --mode analytics --command status      Show settings and stored data",
          "  --mode analytics --command export      Export the dashboard document",
          "  --mode analytics --command clear       Delete all collected data",
          "  --mode analytics --command cleanup     Apply the retention policy now",
          "  --mode analytics --command insights    Show usage insights",
          "  --mode analytics --command privacy     Show this privacy notice");

  private PrivacyNotice() {}
}
