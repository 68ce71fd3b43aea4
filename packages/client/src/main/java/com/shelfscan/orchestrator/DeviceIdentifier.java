package com.shelfscan.orchestrator;

import com.shelfscan.exception.ConfigException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;

/**
 * Stable per-install identifier sent with every upload. Generated once and kept in a small text
 * file so it survives restarts.
 */
public final class DeviceIdentifier {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(DeviceIdentifier.class);

  private DeviceIdentifier() {}

  /**
   * Read the id stored at {@code file}, creating the file with a fresh UUID when it is missing or
   * empty.
   */
  public static String loadOrCreate(Path file) {
    try {
      if (Files.isRegularFile(file)) {
        String stored = Files.readString(file, StandardCharsets.UTF_8).trim();
        if (StringUtils.isNotBlank(stored)) {
          return stored;
        }
      }
      String id = UUID.randomUUID().toString();
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(file, id, StandardCharsets.UTF_8);
      log.info("Generated new device identifier at {}", file);
      return id;
    } catch (IOException e) {
      throw new ConfigException("Cannot read or create device id file " + file, e);
    }
  }
}
