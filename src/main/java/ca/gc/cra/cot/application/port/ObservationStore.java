package ca.gc.cra.cot.application.port;

import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.series.InstrumentSeries;
import java.io.IOException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable per-contract storage of observation series.
 * <p><strong>Why:</strong> Weekly ingestion is read-modify-write over a contract's whole history; this port owns
 * that history and its merge rules.</p>
 * <p><strong>Role:</strong> Output port on the sink side of the ingestion pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load and atomically replace a contract's series.</li>
 *   <li>Append observations with key deduplication where the most recently appended value wins.</li>
 *   <li>Answer simple date queries without exposing the storage format.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not designed for concurrent writers; calls to {@link #append} for one
 * contract must be serialized by the caller.</p>
 * <p><strong>Observability:</strong> Implementations log saved row counts and emit {@code store.*} metrics.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.cot.domain.series.SeriesMerger
 */
public interface ObservationStore {
  /**
   * Loads the stored series of a contract.
   *
   * @param contractCode contract code
   * @return stored series, or empty when the contract has no archive yet
   * @throws IOException if the archive exists but cannot be read
   */
  Optional<InstrumentSeries> load(String contractCode) throws IOException;

  /**
   * Replaces the stored series of a contract.
   *
   * @param contractCode contract code
   * @param series series to persist
   * @throws IOException if the archive cannot be written; the previous archive stays intact
   */
  void save(String contractCode, InstrumentSeries series) throws IOException;

  /**
   * Merges observations into the stored series and persists the result.
   *
   * @param contractCode contract code
   * @param observations observations to append; every one must belong to {@code contractCode}
   * @param deduplicate whether key collisions collapse to the most recently appended value
   * @return series as persisted, newest first
   * @throws IOException if loading or saving fails
   */
  InstrumentSeries append(String contractCode, Collection<Observation> observations, boolean deduplicate)
      throws IOException;

  /**
   * Merges observations with deduplication enabled.
   *
   * @param contractCode contract code
   * @param observations observations to append
   * @return series as persisted, newest first
   * @throws IOException if loading or saving fails
   */
  default InstrumentSeries append(String contractCode, Collection<Observation> observations) throws IOException {
    return append(contractCode, observations, true);
  }

  /**
   * Returns the latest stored report date of a contract.
   *
   * @param contractCode contract code
   * @return latest date, or empty when nothing is stored
   * @throws IOException if the archive cannot be read
   */
  default Optional<LocalDate> latestDate(String contractCode) throws IOException {
    return load(contractCode).flatMap(InstrumentSeries::latestDate);
  }

  /**
   * Returns the stored observations within inclusive date bounds.
   *
   * @param contractCode contract code
   * @param start earliest date, or {@code null} for no lower bound
   * @param end latest date, or {@code null} for no upper bound
   * @return filtered series, or empty when the contract has no archive
   * @throws IOException if the archive cannot be read
   */
  default Optional<InstrumentSeries> range(String contractCode, LocalDate start, LocalDate end)
      throws IOException {
    return load(contractCode).map(series -> series.between(start, end));
  }

  /**
   * Lists the contracts that have an archive.
   *
   * @return sorted contract codes
   * @throws IOException if the storage location cannot be listed
   */
  List<String> contracts() throws IOException;
}
