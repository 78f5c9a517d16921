package ca.gc.cra.cot.application.port;

import java.io.IOException;

/**
 * Checked exception thrown when a report source or one of its sections cannot be opened.
 *
 * @since 0.1.0
 */
public final class SourceUnavailableException extends IOException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public SourceUnavailableException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from the filesystem or spreadsheet library
   */
  public SourceUnavailableException(String msg, Throwable cause) { super(msg, cause); }
}
