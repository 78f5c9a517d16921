package ca.gc.cra.cot.application.pipeline;

import ca.gc.cra.cot.application.decode.DecodeResult;
import ca.gc.cra.cot.application.decode.ReportDecoder;
import ca.gc.cra.cot.application.port.MetricsPort;
import ca.gc.cra.cot.application.port.ObservationStore;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.series.InstrumentSeries;
import ca.gc.cra.cot.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Decodes report files and appends their observations to per-contract archives.
 * <p><strong>Why:</strong> Operators import a week's report, or a backlog of them, in one run.</p>
 * <p><strong>Role:</strong> Application-layer use case wiring {@link ReportDecoder} to {@link ObservationStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode every section of each source and group the observations by contract code.</li>
 *   <li>Skip observations whose contract code is blank or unusable as an archive name.</li>
 *   <li>Log and count a failed source, then continue with the next one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.files.ok} and {@code ingest.files.failed}; sets MDC key
 * {@code ingest.source} while a source is processed.</p>
 *
 * @since 0.1.0
 */
public final class IngestUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestUseCase.class);

  private final ReportDecoder decoder;
  private final ObservationStore store;
  private final MetricsPort metrics;
  private final boolean deduplicate;
  private final Set<String> contractFilter;

  /**
   * Creates an ingest use case.
   *
   * @param decoder report decoder; must not be {@code null}
   * @param store archive store; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param deduplicate whether appends collapse duplicate keys
   * @param contractFilter contract codes to keep; empty keeps every contract
   */
  public IngestUseCase(
      ReportDecoder decoder,
      ObservationStore store,
      MetricsPort metrics,
      boolean deduplicate,
      Set<String> contractFilter) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.deduplicate = deduplicate;
    this.contractFilter = Set.copyOf(Objects.requireNonNull(contractFilter, "contractFilter"));
  }

  /**
   * Ingests the given sources in order.
   *
   * @param sources report files; must not be {@code null}
   * @return summary of stored rows and skipped inputs
   */
  public IngestReport ingest(Collection<Path> sources) {
    Objects.requireNonNull(sources, "sources");
    List<Path> ingested = new ArrayList<>();
    List<IngestReport.FileFailure> fileFailures = new ArrayList<>();
    List<IngestReport.SourceSectionFailure> sectionFailures = new ArrayList<>();
    Map<String, Integer> rows = new TreeMap<>();
    Map<String, LocalDate> latest = new TreeMap<>();

    for (Path source : sources) {
      MDC.put("ingest.source", String.valueOf(source.getFileName()));
      try {
        DecodeResult result = decoder.decodeAll(source);
        result.failures().forEach(f -> sectionFailures.add(new IngestReport.SourceSectionFailure(source, f)));
        for (Map.Entry<String, List<Observation>> group : groupByContract(source, result).entrySet()) {
          InstrumentSeries stored = store.append(group.getKey(), group.getValue(), deduplicate);
          rows.merge(group.getKey(), group.getValue().size(), Integer::sum);
          stored.latestDate().ifPresent(date -> latest.put(group.getKey(), date));
        }
        ingested.add(source);
        metrics.increment("ingest.files.ok");
        log.info("Ingested {} ({} sections, {} skipped)",
            source, result.reports().size(), result.failures().size());
      } catch (IOException | RuntimeException ex) {
        metrics.increment("ingest.files.failed");
        fileFailures.add(new IngestReport.FileFailure(source, ex.getMessage()));
        log.warn("Failed to ingest {}: {}", source, ex.getMessage(), ex);
      } finally {
        MDC.remove("ingest.source");
      }
    }

    IngestReport report = new IngestReport(ingested, fileFailures, sectionFailures, rows, latest);
    log.info("Ingest complete: {} files stored, {} failed, {} rows across {} contracts",
        ingested.size(), fileFailures.size(), report.totalRows(), rows.size());
    return report;
  }

  private Map<String, List<Observation>> groupByContract(Path source, DecodeResult result) {
    Map<String, List<Observation>> groups = new LinkedHashMap<>();
    int unusable = 0;
    for (Observation observation : result.observations()) {
      String code = observation.contractCode();
      if (!Strings.isValidContractCode(code)) {
        unusable++;
        continue;
      }
      if (!contractFilter.isEmpty() && !contractFilter.contains(code)) {
        continue;
      }
      groups.computeIfAbsent(code, k -> new ArrayList<>()).add(observation);
    }
    if (unusable > 0) {
      log.warn("Skipped {} observations from {} with a blank or unusable contract code", unusable, source);
    }
    return groups;
  }
}
