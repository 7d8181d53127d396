package com.gentoro.recordbridge;

public class RecordBridgeApp {

  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(RecordBridgeApp.class);

  static final String USAGE =
      """
      Usage: recordbridge [--config-file <location>] [--mode server|help]

        --config-file  classpath:application.yaml (default), file:/path.yaml or a plain path
        --mode         server (default) starts the MCP endpoint; help prints this text
      """;

  public static void main(String[] args) {
    try {
      RecordBridge app = new RecordBridge(args);
      if (app.startupParameters().isHelpRequested()) {
        System.err.print(USAGE);
        return;
      }
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
