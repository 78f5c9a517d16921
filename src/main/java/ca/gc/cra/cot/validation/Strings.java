package ca.gc.cra.cot.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for configuration values and contract codes.
 * <p><strong>Why:</strong> Contract codes become archive file names, so they are restricted to a file-safe
 * character set before any path is built from them.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern CONTRACT_CODE_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a contract code using the label {@code "contract"}.
   *
   * @param code candidate code such as {@code DEBM}; must not be {@code null}
   * @return trimmed code
   * @throws IllegalArgumentException if the code is blank or not composed of {@code [A-Za-z0-9._-]}
   */
  public static String sanitizeContractCode(String code) {
    return sanitizeContractCode("contract", code);
  }

  /**
   * Validates a contract code with a custom diagnostic label.
   *
   * @param name logical parameter name included in exception messages
   * @param code candidate code; must not be {@code null}
   * @return trimmed code matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the code is blank, is a relative path segment, or has unsupported characters
   */
  public static String sanitizeContractCode(String name, String code) {
    String sanitized = requireNonBlank(name, code);
    if (!CONTRACT_CODE_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return sanitized;
  }

  /**
   * Indicates whether a code would pass {@link #sanitizeContractCode(String)}.
   *
   * @param code candidate code; may be {@code null}
   * @return {@code true} when the code is usable as an archive name
   */
  public static boolean isValidContractCode(String code) {
    if (code == null) {
      return false;
    }
    String trimmed = code.trim();
    return CONTRACT_CODE_PATTERN.matcher(trimmed).matches()
        && !trimmed.equals(".")
        && !trimmed.equals("..");
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
