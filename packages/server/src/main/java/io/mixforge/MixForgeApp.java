package io.mixforge;

import io.mixforge.logging.LoggingService;
import org.slf4j.Logger;

public class MixForgeApp {
  private static final Logger log = LoggingService.getLogger(MixForgeApp.class);

  public static void main(String[] args) {
    try {
      MixForge app = new MixForge(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
