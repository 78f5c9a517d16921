package ca.gc.cra.cot.domain.report;

import java.time.LocalDate;
import java.util.Objects;

/**
 * <strong>What:</strong> Positions of one participant category for one contract, report date, and position type.
 * <p><strong>Why:</strong> Atomic unit of an instrument's time series; everything the archive stores is a list of these.</p>
 * <p><strong>Role:</strong> Domain value produced by the decoder and merged by the series store.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>{@code net == longPosition - shortPosition} and {@code netChange == longChange - shortChange} hold for every
 * instance; the canonical constructor rejects values that break them. Use
 * {@link #of(LocalDate, String, Category, PositionType, double, double, double, double, double, double)} to have
 * the derived fields computed.</p>
 *
 * @param reportDate report date of the snapshot
 * @param contractCode short instrument identifier
 * @param category participant category
 * @param positionType position split
 * @param longPosition long positions in contract volume units
 * @param shortPosition short positions in contract volume units
 * @param net long minus short
 * @param longChange week-over-week change of long positions
 * @param shortChange week-over-week change of short positions
 * @param netChange long change minus short change
 * @param longPct long positions as a percentage of total open interest
 * @param shortPct short positions as a percentage of total open interest
 * @since 0.1.0
 */
public record Observation(
    LocalDate reportDate,
    String contractCode,
    Category category,
    PositionType positionType,
    double longPosition,
    double shortPosition,
    double net,
    double longChange,
    double shortChange,
    double netChange,
    double longPct,
    double shortPct) {

  /**
   * Validates identity fields and the derived-value invariants.
   *
   * @throws NullPointerException if an identity field is {@code null}
   * @throws IllegalArgumentException if {@code net} or {@code netChange} disagree with their operands
   */
  public Observation {
    Objects.requireNonNull(reportDate, "reportDate");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(positionType, "positionType");
    contractCode = contractCode == null ? "" : contractCode.trim();
    if (Double.compare(net, longPosition - shortPosition) != 0) {
      throw new IllegalArgumentException(
          "net must equal long - short (long=" + longPosition + ", short=" + shortPosition + ", net=" + net + ")");
    }
    if (Double.compare(netChange, longChange - shortChange) != 0) {
      throw new IllegalArgumentException(
          "netChange must equal longChange - shortChange (longChange=" + longChange
              + ", shortChange=" + shortChange + ", netChange=" + netChange + ")");
    }
  }

  /**
   * Builds an observation deriving {@code net} and {@code netChange}.
   *
   * @param reportDate report date of the snapshot
   * @param contractCode short instrument identifier
   * @param category participant category
   * @param positionType position split
   * @param longPosition long positions
   * @param shortPosition short positions
   * @param longChange change of long positions
   * @param shortChange change of short positions
   * @param longPct long share of open interest
   * @param shortPct short share of open interest
   * @return new observation
   */
  public static Observation of(
      LocalDate reportDate,
      String contractCode,
      Category category,
      PositionType positionType,
      double longPosition,
      double shortPosition,
      double longChange,
      double shortChange,
      double longPct,
      double shortPct) {
    return new Observation(
        reportDate,
        contractCode,
        category,
        positionType,
        longPosition,
        shortPosition,
        longPosition - shortPosition,
        longChange,
        shortChange,
        longChange - shortChange,
        longPct,
        shortPct);
  }

  /**
   * Returns the key that must be unique within one contract's archive.
   *
   * @return series key of this observation
   */
  public ObservationKey key() {
    return new ObservationKey(reportDate, category, positionType);
  }
}
