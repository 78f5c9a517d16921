package ca.gc.cra.cot.infrastructure.persistence;

import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

/**
 * One line of a contract archive file. Column names and order are the on-disk format.
 *
 * <p>{@code net} and {@code net_change} are written for readers of the file but re-derived from the long and short
 * columns on load.</p>
 */
@JsonPropertyOrder({
    "report_date", "contract_code", "category", "position_type",
    "long", "short", "net", "long_change", "short_change", "net_change", "long_pct", "short_pct"
})
@JsonIgnoreProperties(ignoreUnknown = true)
final class ObservationRow {
  @JsonProperty("report_date")
  public String reportDate;
  @JsonProperty("contract_code")
  public String contractCode;
  @JsonProperty("category")
  public String category;
  @JsonProperty("position_type")
  public String positionType;
  @JsonProperty("long")
  public Double longPosition;
  @JsonProperty("short")
  public Double shortPosition;
  @JsonProperty("net")
  public Double net;
  @JsonProperty("long_change")
  public Double longChange;
  @JsonProperty("short_change")
  public Double shortChange;
  @JsonProperty("net_change")
  public Double netChange;
  @JsonProperty("long_pct")
  public Double longPct;
  @JsonProperty("short_pct")
  public Double shortPct;

  static ObservationRow from(Observation observation) {
    ObservationRow row = new ObservationRow();
    row.reportDate = observation.reportDate().toString();
    row.contractCode = observation.contractCode();
    row.category = observation.category().code();
    row.positionType = observation.positionType().code();
    row.longPosition = observation.longPosition();
    row.shortPosition = observation.shortPosition();
    row.net = observation.net();
    row.longChange = observation.longChange();
    row.shortChange = observation.shortChange();
    row.netChange = observation.netChange();
    row.longPct = observation.longPct();
    row.shortPct = observation.shortPct();
    return row;
  }

  /**
   * Converts the row back into an observation.
   *
   * @return observation with derived net values
   * @throws IllegalArgumentException if the date, category, or position type is not recognized
   */
  Observation toObservation() {
    if (reportDate == null || reportDate.length() < 10) {
      throw new IllegalArgumentException("report_date missing or too short: " + reportDate);
    }
    // Archives written by other tools may carry a time component after the date.
    LocalDate date = LocalDate.parse(reportDate.substring(0, 10));
    return Observation.of(
        date,
        contractCode,
        Category.fromCode(category),
        PositionType.fromCode(positionType),
        orZero(longPosition),
        orZero(shortPosition),
        orZero(longChange),
        orZero(shortChange),
        orZero(longPct),
        orZero(shortPct));
  }

  private static double orZero(Double value) {
    return value == null || !Double.isFinite(value) ? 0d : value;
  }
}
