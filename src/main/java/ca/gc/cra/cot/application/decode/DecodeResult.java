package ca.gc.cra.cot.application.decode;

import ca.gc.cra.cot.domain.report.DecodedReport;
import ca.gc.cra.cot.domain.report.Observation;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of decoding every section of one source: the sections that decoded and the ones that did not.
 *
 * @param source decoded file
 * @param reports successfully decoded sections in source order
 * @param failures sections skipped because they could not be decoded
 * @since 0.1.0
 */
public record DecodeResult(Path source, List<DecodedReport> reports, List<SectionFailure> failures) {

  /**
   * A section that was skipped.
   *
   * @param section section name
   * @param reason failure description
   */
  public record SectionFailure(String section, String reason) {}

  /**
   * Copies the lists.
   *
   * @throws NullPointerException if an argument is {@code null}
   */
  public DecodeResult {
    Objects.requireNonNull(source, "source");
    reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  /**
   * Returns the observations of every decoded section, section by section.
   *
   * @return accumulated observations; empty when no section decoded
   */
  public List<Observation> observations() {
    return reports.stream().flatMap(report -> report.observations().stream()).toList();
  }

  /**
   * Indicates whether at least one section decoded.
   *
   * @return {@code true} when any section produced a report
   */
  public boolean hasReports() {
    return !reports.isEmpty();
  }
}
