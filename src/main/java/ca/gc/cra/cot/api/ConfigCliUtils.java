package ca.gc.cra.cot.api;

import java.util.Map;

/**
 * Helpers for mixing CLI arguments with YAML and map-based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the configuration file argument.
   *
   * @param args mutable CLI map
   * @return trimmed {@code config} value, or {@code null} when absent or blank
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
