package ca.gc.cra.cot.domain.report;

import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of market-participant classes reported by RTS 21 position reports.
 * <p><strong>Why:</strong> Gives decoder, store, and downstream readers one shared vocabulary instead of loose strings.</p>
 * <p><strong>Role:</strong> Domain enumeration; declaration order is the column order of the report layout.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum Category {
  /** Investment firms or credit institutions. */
  INVESTMENT_FIRMS("investment_firms", "Investment Firms or credit institutions"),
  /** Investment funds. */
  INVESTMENT_FUNDS("investment_funds", "Investment Funds"),
  /** Other financial institutions. */
  OTHER_FINANCIAL("other_financial", "Other Financial Institutions"),
  /** Commercial undertakings. */
  COMMERCIAL("commercial", "Commercial Undertakings"),
  /** Operators with compliance obligations under the EU emissions trading directive. */
  COMPLIANCE_OPERATORS(
      "compliance_operators", "Operators with compliance obligations under Directive 2003/87/EC");

  private final String code;
  private final String label;

  Category(String code, String label) {
    this.code = code;
    this.label = label;
  }

  /**
   * Returns the stable snake_case code persisted in archives.
   *
   * @return archive code such as {@code investment_funds}
   */
  public String code() {
    return code;
  }

  /**
   * Returns the regulatory display label printed on the report.
   *
   * @return human-readable label
   */
  public String label() {
    return label;
  }

  /**
   * Resolves a category from its archive code (case-insensitive).
   *
   * @param code archive code; must not be {@code null}
   * @return matching category
   * @throws IllegalArgumentException if no category uses the code
   */
  public static Category fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("category code must not be null");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (Category category : values()) {
      if (category.code.equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown category code: " + code);
  }
}
