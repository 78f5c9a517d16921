package ca.gc.cra.cot.domain.report;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Header block of one weekly position report.
 * <p><strong>Why:</strong> Identifies the venue, contract, and snapshot date every observation of a sheet belongs to.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code ReportDecoder}; immutable once decoded.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param tradingVenue name of the trading venue
 * @param venueIdentifier venue MIC or similar identifier
 * @param reportDate calendar date the report describes; natural key of a snapshot
 * @param publishedAt publication timestamp when the header cell holds a recognizable date-time
 * @param contractName long contract name
 * @param contractCode short instrument identifier, e.g. {@code DEBM}
 * @param reportStatus report status text (e.g. new, amended)
 * @param reportType report type text
 * @since 0.1.0
 */
public record ReportMetadata(
    String tradingVenue,
    String venueIdentifier,
    LocalDate reportDate,
    Optional<LocalDateTime> publishedAt,
    String contractName,
    String contractCode,
    String reportStatus,
    String reportType) {

  /**
   * Normalizes text fields to non-null trimmed values and requires a report date.
   *
   * @throws NullPointerException if {@code reportDate} is {@code null}
   */
  public ReportMetadata {
    Objects.requireNonNull(reportDate, "reportDate");
    tradingVenue = text(tradingVenue);
    venueIdentifier = text(venueIdentifier);
    publishedAt = publishedAt == null ? Optional.empty() : publishedAt;
    contractName = text(contractName);
    contractCode = text(contractCode);
    reportStatus = text(reportStatus);
    reportType = text(reportType);
  }

  /**
   * Returns the report date in ISO {@code YYYY-MM-DD} form.
   *
   * @return ISO date text
   */
  public String isoReportDate() {
    return reportDate.toString();
  }

  private static String text(String value) {
    return value == null ? "" : value.trim();
  }
}
