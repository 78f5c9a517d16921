package ca.gc.cra.cot.config;

import ca.gc.cra.cot.application.decode.ReportDecoder;
import ca.gc.cra.cot.domain.report.PositionType;
import ca.gc.cra.cot.validation.Numbers;
import ca.gc.cra.cot.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings shared by the archive commands.
 * <p><strong>Why:</strong> Gives use cases typed values once CLI, YAML, and defaults have been merged.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param dataDir directory holding one archive file per contract
 * @param primarySection section holding the current week's report
 * @param deduplicate whether appends collapse duplicate keys
 * @param weeks number of distinct report dates in the recent window
 * @param positionType position type shown by read-side commands
 * @param contract contract code restricting a command, when given
 * @since 0.1.0
 */
public record ArchiveConfig(
    Path dataDir,
    String primarySection,
    boolean deduplicate,
    int weeks,
    PositionType positionType,
    Optional<String> contract) {

  /** Longest window accepted; ten years of weekly reports. */
  public static final int MAX_WEEKS = 520;

  /**
   * Validates and normalizes the settings.
   *
   * @throws NullPointerException if a component is {@code null}
   * @throws IllegalArgumentException if a value is out of range or malformed
   */
  public ArchiveConfig {
    dataDir = Objects.requireNonNull(dataDir, "dataDir").normalize();
    primarySection = Strings.requireNonBlank("primarySection", primarySection);
    Numbers.requireRange("weeks", weeks, 1, MAX_WEEKS);
    Objects.requireNonNull(positionType, "positionType");
    contract = Objects.requireNonNull(contract, "contract").map(Strings::sanitizeContractCode);
  }

  /**
   * Returns the built-in settings.
   *
   * @return defaults: {@code ./data}, {@code Weekly_Report}, deduplication on, 13 weeks, total positions
   */
  public static ArchiveConfig defaults() {
    return new ArchiveConfig(
        Path.of("data"),
        ReportDecoder.DEFAULT_PRIMARY_SECTION,
        true,
        13,
        PositionType.TOTAL,
        Optional.empty());
  }

  /**
   * Creates settings from merged key/value pairs; missing or blank keys keep their defaults.
   *
   * @param options keys {@code dataDir}, {@code primarySection}, {@code deduplicate}, {@code weeks},
   *     {@code positionType}, {@code contract}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid; the message names the key
   */
  public static ArchiveConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ArchiveConfig defaults = defaults();
    return new ArchiveConfig(
        optional(options, "dataDir").map(value -> parsePath("dataDir", value)).orElse(defaults.dataDir()),
        optional(options, "primarySection").orElse(defaults.primarySection()),
        optional(options, "deduplicate").map(value -> parseBoolean("deduplicate", value))
            .orElse(defaults.deduplicate()),
        optional(options, "weeks").map(value -> parseInt("weeks", value)).orElse(defaults.weeks()),
        optional(options, "positionType").map(ArchiveConfig::parsePositionType).orElse(defaults.positionType()),
        optional(options, "contract"));
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static boolean parseBoolean(String name, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(name + " must be true or false (was " + value + ")");
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + value + ")", ex);
    }
  }

  private static PositionType parsePositionType(String value) {
    try {
      return PositionType.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("positionType must be one of risk_reducing, other, total (was "
          + value + ")", ex);
    }
  }
}
