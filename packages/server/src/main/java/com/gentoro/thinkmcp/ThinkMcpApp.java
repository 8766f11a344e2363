package com.gentoro.thinkmcp;

public class ThinkMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.thinkmcp.logging.LoggingService.getLogger(ThinkMcpApp.class);

  public static void main(String[] args) {
    int exitCode;
    try {
      ThinkMcp app = new ThinkMcp(args);
      exitCode = app.initialize();
      if (exitCode == 0 && "server".equals(app.startupParameters().mode())) {
        app.waitShutdownSignal();
        return;
      }
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(ThinkMcp.usage());
      exitCode = 2;
    } catch (Exception e) {
      log.error("Application failed to start", e);
      exitCode = 1;
    }
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }
}
