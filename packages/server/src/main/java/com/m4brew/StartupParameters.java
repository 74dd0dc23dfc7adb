package com.m4brew;

import com.m4brew.exception.ConfigException;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line arguments of the form {@code --name=value} (or {@code --flag}, read as {@code
 * true}). {@code --config} points at an external {@code application.yaml}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unrecognized argument: " + arg);
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

  /** @return the config file given with {@code --config}, or {@code null} for the bundled one */
  public String configFile() {
    return parameters.get("config");
  }

  @SuppressWarnings("unchecked")
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    try {
      if (type == String.class) return (T) raw;
      if (type == Integer.class) return (T) Integer.valueOf(raw);
      if (type == Long.class) return (T) Long.valueOf(raw);
      if (type == Boolean.class) return (T) Boolean.valueOf(raw);
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Parameter --%s is not a valid %s".formatted(name, type.getSimpleName()), e);
    }
    throw new ConfigException("Unsupported parameter type " + type.getName());
  }

  /** Parameters other than {@code --config}, used as configuration overrides. */
  public Map<String, String> overrides() {
    Map<String, String> copy = new HashMap<>(parameters);
    copy.remove("config");
    return copy;
  }
}
