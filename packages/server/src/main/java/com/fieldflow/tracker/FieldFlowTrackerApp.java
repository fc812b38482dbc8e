package com.fieldflow.tracker;

import com.fieldflow.tracker.logging.LoggingService;
import org.slf4j.Logger;

public class FieldFlowTrackerApp {
  private static final Logger log = LoggingService.getLogger(FieldFlowTrackerApp.class);

  public static void main(String[] args) {
    try {
      FieldFlowTracker app = new FieldFlowTracker(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
