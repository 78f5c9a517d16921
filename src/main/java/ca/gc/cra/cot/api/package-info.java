/**
 * <strong>Purpose:</strong> Command-line entry points for importing reports and inspecting the archive.
 * <p>Arguments are {@code key=value} pairs plus {@code --help} and {@code --verbose} flags; results go to stdout
 * through {@link ca.gc.cra.cot.api.CliPrinter} and diagnostics to the log.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cot.api;
