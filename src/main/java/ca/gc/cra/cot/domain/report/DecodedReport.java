package ca.gc.cra.cot.domain.report;

import java.util.List;
import java.util.Objects;

/**
 * Metadata and observations decoded from one report section.
 *
 * @param metadata header block of the section
 * @param observations observations in layout order (position type, then category)
 * @since 0.1.0
 */
public record DecodedReport(ReportMetadata metadata, List<Observation> observations) {

  /**
   * Copies the observation list.
   *
   * @throws NullPointerException if an argument is {@code null}
   */
  public DecodedReport {
    Objects.requireNonNull(metadata, "metadata");
    observations = List.copyOf(Objects.requireNonNull(observations, "observations"));
  }

  /**
   * Returns the observations of one position type in layout order.
   *
   * @param positionType position split to keep
   * @return filtered observations
   */
  public List<Observation> observations(PositionType positionType) {
    return observations.stream()
        .filter(observation -> observation.positionType() == positionType)
        .toList();
  }
}
