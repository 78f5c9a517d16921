package ca.gc.cra.cot.config;

import ca.gc.cra.cot.application.decode.ReportDecoder;
import ca.gc.cra.cot.application.pipeline.IngestUseCase;
import ca.gc.cra.cot.application.port.CellGridReader;
import ca.gc.cra.cot.application.port.MetricsPort;
import ca.gc.cra.cot.application.port.ObservationStore;
import ca.gc.cra.cot.domain.layout.ReportLayout;
import ca.gc.cra.cot.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.cot.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.cot.infrastructure.persistence.CsvObservationStore;
import ca.gc.cra.cot.infrastructure.spreadsheet.PoiCellGridReader;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Wires archive use cases to their concrete adapters.
 * <p><strong>Why:</strong> Keeps the CLI free of adapter construction and gives tests one seam to replace.</p>
 * <p><strong>Thread-safety:</strong> Build on the CLI thread; adapters it returns document their own guarantees.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final ArchiveConfig config;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter otel;

  /**
   * Creates a root for the given settings.
   *
   * @param config merged archive settings; must not be {@code null}
   * @param metricsExporter {@code otlp} to export metrics through OpenTelemetry; anything else disables metrics
   */
  public CompositionRoot(ArchiveConfig config, String metricsExporter) {
    this.config = Objects.requireNonNull(config, "config");
    if ("otlp".equals(metricsExporter == null ? "" : metricsExporter.trim().toLowerCase(Locale.ROOT))) {
      this.otel = new OpenTelemetryMetricsAdapter();
      this.metrics = otel;
    } else {
      this.otel = null;
      this.metrics = new NoOpMetricsAdapter();
    }
  }

  /**
   * Returns the settings this root was built from.
   *
   * @return archive settings
   */
  public ArchiveConfig config() {
    return config;
  }

  /**
   * Returns the shared metrics sink.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates the spreadsheet reader.
   *
   * @return workbook-backed grid reader
   */
  public CellGridReader cellGridReader() {
    return new PoiCellGridReader();
  }

  /**
   * Creates a decoder for the standard layout and the configured primary section.
   *
   * @return report decoder
   */
  public ReportDecoder reportDecoder() {
    return new ReportDecoder(cellGridReader(), ReportLayout.standard(), config.primarySection(), metrics);
  }

  /**
   * Creates the archive store rooted at the configured data directory.
   *
   * @return CSV-backed store
   */
  public ObservationStore observationStore() {
    return new CsvObservationStore(config.dataDir(), metrics);
  }

  /**
   * Creates the ingest use case, restricted to the configured contract when one is set.
   *
   * @return ingest use case
   */
  public IngestUseCase ingestUseCase() {
    return new IngestUseCase(
        reportDecoder(),
        observationStore(),
        metrics,
        config.deduplicate(),
        config.contract().map(Set::of).orElse(Set.of()));
  }

  /** Flushes and shuts down the metrics exporter when one is active. */
  @Override
  public void close() {
    if (otel != null) {
      otel.close();
    }
  }
}
