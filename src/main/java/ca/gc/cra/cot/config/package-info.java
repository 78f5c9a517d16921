/**
 * <strong>Purpose:</strong> Configuration for the archive commands: built-in defaults, YAML overrides, CLI
 * precedence, and the composition root that turns the merged settings into use cases.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cot.config;
