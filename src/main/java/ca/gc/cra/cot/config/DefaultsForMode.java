package ca.gc.cra.cot.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each archive command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command merged over the common defaults.
   *
   * @param mode command name ({@code import}, {@code show}, {@code list})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "import" -> buildImportDefaults();
      case "show" -> buildShowDefaults();
      case "list" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ArchiveConfig defaults = ArchiveConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dataDir", defaults.dataDir().toString());
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildImportDefaults() {
    ArchiveConfig defaults = ArchiveConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("contract", "");
    map.put("primarySection", defaults.primarySection());
    map.put("deduplicate", Boolean.toString(defaults.deduplicate()));
    return map;
  }

  private static Map<String, String> buildShowDefaults() {
    ArchiveConfig defaults = ArchiveConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("contract", "");
    map.put("weeks", Integer.toString(defaults.weeks()));
    map.put("positionType", defaults.positionType().code());
    return map;
  }
}
