package com.m4brew;

public class M4BrewApp {

  private static final org.slf4j.Logger log =
      com.m4brew.logging.LoggingService.getLogger(M4BrewApp.class);

  public static void main(String[] args) {
    try {
      M4Brew app = new M4Brew(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
