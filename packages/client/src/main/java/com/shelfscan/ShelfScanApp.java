package com.shelfscan;

import com.shelfscan.model.ScanOutcome;
import java.util.List;

public class ShelfScanApp {

  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ShelfScanApp.class);

  public static void main(String[] args) {
    ShelfScan app = new ShelfScan(args);
    Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shelfscan-shutdown-hook"));
    int exitCode = 0;
    try {
      app.initialize();
      List<ScanOutcome> outcomes = app.run();
      long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
      log.info("Finished: {} scans, {} failed", outcomes.size(), failed);
      if (failed > 0) {
        exitCode = 2;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted, shutting down");
      exitCode = 130;
    } catch (Exception e) {
      log.error("Application failed", e);
      exitCode = 1;
    } finally {
      app.shutdown();
    }
    System.exit(exitCode);
  }
}
