package com.gentoro.keyimport;

public class KeyImportApp {

  private static final org.slf4j.Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(KeyImportApp.class);

  public static void main(String[] args) {
    int exitCode;
    try {
      KeyImport app = new KeyImport(args);
      app.initialize();
      try {
        exitCode = app.run();
      } finally {
        app.shutdown();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Import interrupted");
      exitCode = 2;
    } catch (Exception e) {
      log.error("Keystore import failed", e);
      exitCode = 1;
    }
    System.exit(exitCode);
  }
}
