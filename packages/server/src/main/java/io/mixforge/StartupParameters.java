package io.mixforge;

import io.mixforge.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line arguments of the form {@code --name=value}. A bare {@code --flag} is stored as
 * {@code "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
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

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) return null;
    if (type == String.class) return type.cast(value);
    if (type == Integer.class) return type.cast(Integer.valueOf(value));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(value));
    throw new ConfigException("Unsupported parameter type " + type.getSimpleName());
  }

  /** Path of an external configuration file, or null to use the bundled application.yaml. */
  public String configFile() {
    return parameters.get("config");
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
