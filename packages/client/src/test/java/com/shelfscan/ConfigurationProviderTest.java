package com.shelfscan;

import static org.junit.jupiter.api.Assertions.*;

import com.shelfscan.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path temp;

  @Test
  @DisplayName("bundled configuration carries the documented defaults")
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(5, config.getInt("scheduler.maxConcurrentStreams"));
    assertEquals(3, config.getInt("stream.maxAttempts"));
    assertEquals(2, config.getInt("stream.backoffBaseSeconds"));
    assertEquals(60, config.getInt("cooldown.defaultRetryAfterSeconds"));
    assertEquals(1000, config.getInt("cooldown.watchIntervalMillis"));
  }

  @Test
  void loadsClasspathResource() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:/test-application.yaml");
    assertEquals("http://localhost:8080/api/", provider.config().getString("service.baseUrl"));
    assertEquals(4, provider.config().getInt("stream.maxAttempts"));
  }

  @Test
  void loadsPlainPathAndFileUri() throws Exception {
    Path file = temp.resolve("custom.yaml");
    Files.writeString(file, "scheduler:\n  maxConcurrentStreams: 9\n");

    assertEquals(
        9, new ConfigurationProvider(file.toString()).config().getInt("scheduler.maxConcurrentStreams"));
    assertEquals(
        9,
        new ConfigurationProvider(file.toUri().toString())
            .config()
            .getInt("scheduler.maxConcurrentStreams"));
  }

  @Test
  void missingConfigurationFails() {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider(temp.resolve("nope.yaml").toString()));
    assertThrows(ConfigException.class, () -> new ConfigurationProvider("classpath:nope.yaml"));
  }

  @Test
  void invalidNumbersAreConfigErrors() throws Exception {
    Path file = temp.resolve("bad.yaml");
    Files.writeString(file, "scheduler:\n  maxConcurrentStreams: lots\nstream:\n  maxAttempts: 0\n");
    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertThrows(
        ConfigException.class,
        () -> ShelfScan.positiveInt(config, "scheduler.maxConcurrentStreams", 5));
    assertThrows(ConfigException.class, () -> ShelfScan.positiveInt(config, "stream.maxAttempts", 3));
    assertEquals(42, ShelfScan.positiveInt(config, "absent.key", 42));
  }
}
