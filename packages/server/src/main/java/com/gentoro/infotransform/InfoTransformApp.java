package com.gentoro.infotransform;

public class InfoTransformApp {

  private static final org.slf4j.Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(InfoTransformApp.class);

  public static void main(String[] args) {
    try {
      InfoTransform app = new InfoTransform(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
