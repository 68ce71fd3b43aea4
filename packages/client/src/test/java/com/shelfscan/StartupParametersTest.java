package com.shelfscan;

import static org.junit.jupiter.api.Assertions.*;

import com.shelfscan.exception.ConfigException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("scan", params.getParameter("mode", String.class));
    assertEquals("classpath:application.yaml", params.configFile());
    assertNull(params.getParameter("image", String.class));
  }

  @Test
  void parsesNamedValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "drain", "--config-file", "/etc/shelfscan.yaml", "--retries", "4", "--verbose"
            });
    assertEquals("drain", params.getParameter("mode", String.class));
    assertEquals("/etc/shelfscan.yaml", params.configFile());
    assertEquals(4, params.getParameter("retries", Integer.class));
    assertTrue(params.getParameter("verbose", Boolean.class));
    assertEquals(4, params.asMap().size());
  }

  @Test
  void rejectsPositionalArguments() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"photo.jpg"}));
  }

  @Test
  void rejectsNonNumericInteger() {
    StartupParameters params = new StartupParameters(new String[] {"--retries", "many"});
    assertThrows(ConfigException.class, () -> params.getParameter("retries", Integer.class));
  }
}
