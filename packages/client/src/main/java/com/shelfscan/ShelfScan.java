package com.shelfscan;

import com.shelfscan.cooldown.CooldownTracker;
import com.shelfscan.exception.ConfigException;
import com.shelfscan.exception.StateException;
import com.shelfscan.http.OkHttpFactory;
import com.shelfscan.model.BookMetadata;
import com.shelfscan.model.ScanOutcome;
import com.shelfscan.orchestrator.CaptureDisposition;
import com.shelfscan.orchestrator.DeviceIdentifier;
import com.shelfscan.orchestrator.ManualConnectivityMonitor;
import com.shelfscan.orchestrator.ScanOrchestrator;
import com.shelfscan.queue.FileSystemDurableQueue;
import com.shelfscan.stream.BackoffPolicy;
import com.shelfscan.stream.Sleeper;
import com.shelfscan.stream.StreamClient;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.lang3.StringUtils;

/** Application context: loads configuration and wires the scan pipeline. */
public class ShelfScan {

  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ShelfScan.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private OkHttpClient httpClient;
  private StreamClient streamClient;
  private FileSystemDurableQueue durableQueue;
  private ScanOrchestrator orchestrator;
  private String deviceIdentifier;
  private final List<ScanOutcome> outcomes = new ArrayList<>();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public ShelfScan(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.shelfscan.logging.LoggingService.applyConfiguration(configuration());
    Configuration config = configuration();

    String baseUrl = config.getString("service.baseUrl", null);
    if (StringUtils.isBlank(baseUrl)) {
      throw new ConfigException("service.baseUrl is required");
    }
    this.deviceIdentifier =
        DeviceIdentifier.loadOrCreate(
            Path.of(config.getString("device.idFile", ".shelfscan/device-id")));

    this.httpClient =
        OkHttpFactory.create(
            Duration.ofSeconds(positiveInt(config, "http.connectTimeoutSeconds", 30)),
            deviceIdentifier,
            config.getString("service.userAgent", "ShelfScan/1.0"));
    OkHttpClient streamHttp =
        OkHttpFactory.forStreaming(
            httpClient,
            Duration.ofSeconds(positiveInt(config, "http.streamReadTimeoutSeconds", 120)));
    BackoffPolicy backoff =
        new BackoffPolicy(
            positiveInt(config, "stream.maxAttempts", 3),
            Duration.ofSeconds(positiveInt(config, "stream.backoffBaseSeconds", 2)));
    this.streamClient =
        new StreamClient(
            baseUrl,
            httpClient,
            streamHttp,
            backoff,
            Duration.ofSeconds(positiveInt(config, "cooldown.defaultRetryAfterSeconds", 60)),
            Sleeper.SYSTEM);

    this.durableQueue =
        new FileSystemDurableQueue(
            Path.of(config.getString("queue.directory", ".shelfscan/queue")));

    this.orchestrator =
        ScanOrchestrator.builder()
            .client(streamClient)
            .cooldown(new CooldownTracker())
            .queue(durableQueue)
            .connectivity(new ManualConnectivityMonitor())
            .catalog(this::record)
            .deviceIdentifier(deviceIdentifier)
            .maxConcurrentStreams(positiveInt(config, "scheduler.maxConcurrentStreams", 5))
            .watchInterval(
                Duration.ofMillis(positiveInt(config, "cooldown.watchIntervalMillis", 1000)))
            .build();
    log.info(
        "ShelfScan ready: service {}, device {}, {} scans queued",
        baseUrl,
        deviceIdentifier,
        durableQueue.size());
  }

  /** Execute the mode selected on the command line, then wait for all scans to finish. */
  public List<ScanOutcome> run() throws InterruptedException {
    String mode = startupParameters.getParameter("mode", String.class);
    switch (mode) {
      case "scan" -> scanImages();
      case "drain" -> {
        int scheduled = orchestrator().drainQueue();
        log.info("Scheduled {} queued scans", scheduled);
      }
      default -> throw new ConfigException("Invalid mode: " + mode);
    }
    Duration timeout =
        Duration.ofSeconds(positiveInt(configuration(), "app.awaitTimeoutSeconds", 600));
    if (!orchestrator().awaitIdle(timeout)) {
      log.warn("Scans still running after {}s, canceling", timeout.toSeconds());
      orchestrator().cancelAll();
    }
    synchronized (outcomes) {
      return List.copyOf(outcomes);
    }
  }

  private void scanImages() {
    String images = startupParameters.getParameter("image", String.class);
    if (StringUtils.isBlank(images)) {
      throw new ConfigException("--image is required in scan mode");
    }
    for (String image : StringUtils.split(images, ',')) {
      Path path = Path.of(image.trim());
      byte[] bytes;
      try {
        bytes = Files.readAllBytes(path);
      } catch (IOException e) {
        throw new ConfigException("Cannot read image " + path, e);
      }
      CaptureDisposition disposition = orchestrator().handleCapture(bytes);
      log.info("{}: {}", path.getFileName(), disposition);
    }
  }

  private void record(ScanOutcome outcome) {
    synchronized (outcomes) {
      outcomes.add(outcome);
    }
    if (outcome.isSuccess()) {
      for (BookMetadata book : outcome.books()) {
        log.info("  {} by {}", book.title(), StringUtils.defaultIfBlank(book.author(), "unknown"));
      }
    }
  }

  /** Release resources. Safe to call multiple times. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    if (orchestrator != null) {
      orchestrator.close();
    }
    if (httpClient != null) {
      httpClient.dispatcher().executorService().shutdown();
      httpClient.connectionPool().evictAll();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ShelfScan not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ScanOrchestrator orchestrator() {
    if (orchestrator == null) {
      throw new StateException("ShelfScan not initialized. Call initialize() first.");
    }
    return orchestrator;
  }

  public StreamClient streamClient() {
    return streamClient;
  }

  public String deviceIdentifier() {
    return deviceIdentifier;
  }

  static int positiveInt(Configuration config, String key, int defaultValue) {
    int value;
    try {
      value = config.getInt(key, defaultValue);
    } catch (ConversionException e) {
      throw new ConfigException("Configuration key " + key + " must be a number", e);
    }
    if (value < 1) {
      throw new ConfigException("Configuration key " + key + " must be positive, got " + value);
    }
    return value;
  }
}
