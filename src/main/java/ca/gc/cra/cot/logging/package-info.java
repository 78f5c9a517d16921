/**
 * <strong>Purpose:</strong> Logging utilities for the archive CLI: runtime level control and bounded echo of
 * report content.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cot.logging;
