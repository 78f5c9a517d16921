package ca.gc.cra.cot.application.decode;

/**
 * Checked exception thrown when a report section cannot be interpreted with the configured layout.
 *
 * @since 0.1.0
 */
public final class DecodeException extends Exception {
  private final String section;

  /**
   * Creates an exception for a section.
   *
   * @param section section (sheet) name
   * @param msg human-readable error
   */
  public DecodeException(String section, String msg) {
    super(msg);
    this.section = section;
  }

  /**
   * Creates an exception for a section with an underlying cause.
   *
   * @param section section (sheet) name
   * @param msg human-readable error
   * @param cause parse failure
   */
  public DecodeException(String section, String msg, Throwable cause) {
    super(msg, cause);
    this.section = section;
  }

  /**
   * Returns the section that failed to decode.
   *
   * @return section name
   */
  public String section() {
    return section;
  }
}
