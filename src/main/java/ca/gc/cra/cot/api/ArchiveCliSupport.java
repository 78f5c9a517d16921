package ca.gc.cra.cot.api;

import ca.gc.cra.cot.config.ArchiveConfig;
import ca.gc.cra.cot.config.ConfigMerger;
import ca.gc.cra.cot.config.DefaultsForMode;
import ca.gc.cra.cot.config.YamlConfigLoader;
import ca.gc.cra.cot.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared argument handling for the archive commands: key=value parsing, YAML loading, precedence merge, telemetry
 * settings, and typed configuration.
 */
final class ArchiveCliSupport {
  private ArchiveCliSupport() {
    // Utility class
  }

  /**
   * Resolves the effective settings of a command, logging and printing usage on failure.
   *
   * @param mode command name
   * @param input parsed command line of the command (without the command name)
   * @param usage one-line usage printed on invalid input
   * @param log logger of the calling command
   * @return resolved settings, or the exit code to return
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      return invalid(log, usage, "Invalid argument: {}", ex);
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration {}: {}", yamlPath, ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    String metricsExporter;
    ArchiveConfig config;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      if (ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
        LoggingConfigurator.enableVerboseLogging();
      }
      effective.remove("verbose");
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = ArchiveConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      return invalid(log, usage, "Invalid " + mode + " arguments: {}", ex);
    }
    return new Resolution(ExitCode.SUCCESS, Map.copyOf(effective), config, metricsExporter);
  }

  private static Resolution invalid(Logger log, String usage, String message, Exception ex) {
    log.error(message, ex.getMessage());
    CliPrinter.println(usage);
    return Resolution.failed(ExitCode.INVALID_ARGS);
  }

  /**
   * Outcome of argument resolution.
   *
   * @param status {@link ExitCode#SUCCESS} when the settings are usable
   * @param effective merged key/value settings, telemetry keys removed
   * @param config typed settings; {@code null} on failure
   * @param metricsExporter normalized exporter name; {@code null} on failure
   */
  record Resolution(ExitCode status, Map<String, String> effective, ArchiveConfig config, String metricsExporter) {
    static Resolution failed(ExitCode status) {
      return new Resolution(status, Map.of(), null, null);
    }

    boolean ok() {
      return status == ExitCode.SUCCESS;
    }
  }
}
