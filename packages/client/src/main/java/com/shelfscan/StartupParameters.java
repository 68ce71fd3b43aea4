package com.shelfscan;

import com.shelfscan.exception.ConfigException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Command-line arguments of the form {@code --name value}. A flag given without a value is stored
 * as {@code "true"}.
 */
public class StartupParameters {
  public static final String DEFAULT_CONFIG_FILE = "classpath:application.yaml";

  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    parameters.put("mode", "scan");
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(name, args[++i]);
      } else {
        parameters.put(name, "true");
      }
    }
  }

  public String configFile() {
    return parameters.getOrDefault("config-file", DEFAULT_CONFIG_FILE);
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(raw);
    }
    if (type == Integer.class) {
      try {
        return type.cast(Integer.valueOf(raw));
      } catch (NumberFormatException e) {
        throw new ConfigException("Parameter --" + name + " is not a number: " + raw, e);
      }
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(raw));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
