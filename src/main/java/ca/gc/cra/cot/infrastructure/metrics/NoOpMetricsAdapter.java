package ca.gc.cra.cot.infrastructure.metrics;

import ca.gc.cra.cot.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when the metrics exporter is {@code none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
