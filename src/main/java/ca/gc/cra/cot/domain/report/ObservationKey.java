package ca.gc.cra.cot.domain.report;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of an observation inside one contract's series.
 *
 * @param reportDate report date
 * @param category participant category
 * @param positionType position split
 * @since 0.1.0
 */
public record ObservationKey(LocalDate reportDate, Category category, PositionType positionType) {

  /** Orders keys by date, then category and position type in declaration order. */
  public static final Comparator<ObservationKey> CHRONOLOGICAL =
      Comparator.comparing(ObservationKey::reportDate)
          .thenComparing(ObservationKey::category)
          .thenComparing(ObservationKey::positionType);

  /**
   * Requires every component.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public ObservationKey {
    Objects.requireNonNull(reportDate, "reportDate");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(positionType, "positionType");
  }
}
