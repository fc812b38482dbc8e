package com.fieldflow.tracker;

import com.fieldflow.tracker.exception.ConfigException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line parameters in {@code --name=value} form. A bare {@code --flag} is recorded as
 * {@code "true"}.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unrecognized startup argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    return getParameter(name, type, null);
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    String raw = parameters.get(name);
    if (raw == null) {
      return defaultValue;
    }
    try {
      if (type == String.class) {
        return type.cast(raw);
      } else if (type == Integer.class) {
        return type.cast(Integer.valueOf(raw));
      } else if (type == Long.class) {
        return type.cast(Long.valueOf(raw));
      } else if (type == Boolean.class) {
        return type.cast(Boolean.valueOf(raw));
      }
    } catch (NumberFormatException e) {
      throw new ConfigException("Startup argument --%s is not a valid %s".formatted(name, type), e);
    }
    throw new ConfigException("Unsupported startup argument type: " + type.getName());
  }

  /** Path of the external YAML configuration, or {@code null} to use the bundled one. */
  public String configFile() {
    return parameters.get("config");
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
