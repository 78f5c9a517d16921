package ca.gc.cra.cot.domain.series;

import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Accumulated observation history of one contract.
 * <p><strong>Why:</strong> Unit of ownership of the archive: one series per contract code, read and written whole.</p>
 * <p><strong>Role:</strong> Domain aggregate returned by the observation store and consumed by read-side helpers.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; the observation list is copied.</p>
 *
 * @param contractCode contract the series belongs to
 * @param observations observations in storage order
 * @since 0.1.0
 */
public record InstrumentSeries(String contractCode, List<Observation> observations) {

  /** Date ascending, then category and position type in declaration order. */
  public static final Comparator<Observation> ASCENDING =
      Comparator.comparing(Observation::reportDate)
          .thenComparing(Observation::category)
          .thenComparing(Observation::positionType);

  /** Date descending, then category and position type in declaration order. */
  public static final Comparator<Observation> DESCENDING =
      Comparator.comparing(Observation::reportDate, Comparator.reverseOrder())
          .thenComparing(Observation::category)
          .thenComparing(Observation::positionType);

  /**
   * Copies the observations.
   *
   * @throws NullPointerException if an argument is {@code null}
   */
  public InstrumentSeries {
    Objects.requireNonNull(contractCode, "contractCode");
    observations = List.copyOf(Objects.requireNonNull(observations, "observations"));
  }

  /**
   * Creates a series with no observations.
   *
   * @param contractCode contract code
   * @return empty series
   */
  public static InstrumentSeries empty(String contractCode) {
    return new InstrumentSeries(contractCode, List.of());
  }

  /**
   * Indicates whether the series holds no observations.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return observations.isEmpty();
  }

  /**
   * Returns the number of observations.
   *
   * @return row count
   */
  public int size() {
    return observations.size();
  }

  /**
   * Returns the distinct report dates in ascending order.
   *
   * @return distinct dates
   */
  public List<LocalDate> reportDates() {
    TreeSet<LocalDate> dates = new TreeSet<>();
    for (Observation observation : observations) {
      dates.add(observation.reportDate());
    }
    return List.copyOf(dates);
  }

  /**
   * Returns the most recent report date.
   *
   * @return latest date, or empty for an empty series
   */
  public Optional<LocalDate> latestDate() {
    return observations.stream().map(Observation::reportDate).max(Comparator.naturalOrder());
  }

  /**
   * Returns the oldest report date.
   *
   * @return earliest date, or empty for an empty series
   */
  public Optional<LocalDate> earliestDate() {
    return observations.stream().map(Observation::reportDate).min(Comparator.naturalOrder());
  }

  /**
   * Returns a copy ordered by report date, oldest first.
   *
   * @return chronologically ordered series
   */
  public InstrumentSeries ascending() {
    return sorted(ASCENDING);
  }

  /**
   * Returns a copy ordered by report date, newest first (storage order).
   *
   * @return reverse-chronologically ordered series
   */
  public InstrumentSeries descending() {
    return sorted(DESCENDING);
  }

  /**
   * Keeps observations of one position type.
   *
   * @param positionType position split to keep; must not be {@code null}
   * @return filtered series preserving order
   */
  public InstrumentSeries filter(PositionType positionType) {
    Objects.requireNonNull(positionType, "positionType");
    return new InstrumentSeries(
        contractCode,
        observations.stream().filter(o -> o.positionType() == positionType).toList());
  }

  /**
   * Keeps observations whose report date lies within inclusive bounds.
   *
   * @param start earliest date to keep; {@code null} leaves the range open
   * @param end latest date to keep; {@code null} leaves the range open
   * @return filtered series preserving order
   */
  public InstrumentSeries between(LocalDate start, LocalDate end) {
    List<Observation> kept = new ArrayList<>();
    for (Observation observation : observations) {
      LocalDate date = observation.reportDate();
      if (start != null && date.isBefore(start)) {
        continue;
      }
      if (end != null && date.isAfter(end)) {
        continue;
      }
      kept.add(observation);
    }
    return new InstrumentSeries(contractCode, kept);
  }

  private InstrumentSeries sorted(Comparator<Observation> order) {
    List<Observation> copy = new ArrayList<>(observations);
    copy.sort(order);
    return new InstrumentSeries(contractCode, copy);
  }
}
