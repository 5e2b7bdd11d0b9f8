package com.gentoro.infotransform;

import com.gentoro.infotransform.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments in {@code --name=value} form. A bare {@code --flag} is stored as {@code
 * true}.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (!arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      String name = StringUtils.substringBefore(body, "=");
      String value = body.contains("=") ? StringUtils.substringAfter(body, "=") : "true";
      parameters.put(name, value);
    }
  }

  /** Path given with {@code --config}, or null to use the bundled {@code application.yaml}. */
  public String configFile() {
    return StringUtils.trimToNull(parameters.get("config"));
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    if (type == String.class) return type.cast(raw);
    if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    throw new ConfigException("Unsupported parameter type " + type.getSimpleName());
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
