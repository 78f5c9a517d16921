/**
 * Metrics adapters that bridge the archive's {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Metrics:</strong> Publishes under the {@code ingest.*}, {@code decode.*}, and {@code store.*}
 * namespaces.</p>
 */
package ca.gc.cra.cot.infrastructure.metrics;
