package com.gentoro.onegraph;

import com.gentoro.onegraph.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line parameters, given as {@code --name value} or {@code --name=value}. A flag without a
 * value is read as {@code true}.
 */
public class StartupParameters {

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unexpected argument '" + arg + "'");
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /**
   * Value of {@code name} converted to {@code type} ({@link String}, {@link Integer}, {@link
   * Long} or {@link Boolean}), or {@code null} when absent.
   */
  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    try {
      if (type == String.class) {
        return type.cast(value);
      } else if (type == Integer.class) {
        return type.cast(Integer.valueOf(value));
      } else if (type == Long.class) {
        return type.cast(Long.valueOf(value));
      } else if (type == Boolean.class) {
        return type.cast(Boolean.valueOf(value));
      }
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Parameter '" + name + "' is not a valid " + type.getSimpleName() + ": " + value, e);
    }
    throw new IllegalArgumentException("Unsupported parameter type " + type.getName());
  }

  /** Path given with {@code --config}, or {@code null} to use the bundled configuration. */
  public String configFile() {
    return getParameter("config", String.class);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
