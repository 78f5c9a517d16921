package ca.gc.cra.cot.domain.report;

import java.util.Locale;

/**
 * Split of a category's open positions; {@link #TOTAL} aggregates the other two.
 *
 * @since 0.1.0
 */
public enum PositionType {
  /** Positions reducing risks directly relating to commercial activity. */
  RISK_REDUCING("risk_reducing"),
  /** All other positions. */
  OTHER("other"),
  /** Sum of risk-reducing and other positions. */
  TOTAL("total");

  private final String code;

  PositionType(String code) {
    this.code = code;
  }

  /**
   * Returns the stable snake_case code persisted in archives.
   *
   * @return archive code such as {@code total}
   */
  public String code() {
    return code;
  }

  /**
   * Resolves a position type from its archive code (case-insensitive).
   *
   * @param code archive code; must not be {@code null}
   * @return matching position type
   * @throws IllegalArgumentException if no position type uses the code
   */
  public static PositionType fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("position type code must not be null");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (PositionType type : values()) {
      if (type.code.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown position type code: " + code);
  }
}
