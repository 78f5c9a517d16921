package ca.gc.cra.cot.domain.series;

import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-side selections over an {@link InstrumentSeries} for charting and reporting collaborators.
 *
 * @since 0.1.0
 */
public final class SeriesWindow {
  private static final Logger log = LoggerFactory.getLogger(SeriesWindow.class);

  private SeriesWindow() {}

  /**
   * Selects the observations of the {@code weekCount} most recent distinct report dates for one position type.
   *
   * <p>A date counts once no matter how many category rows it carries. When the series holds fewer dates than
   * requested, every available date is returned.</p>
   *
   * @param series source series; must not be {@code null}
   * @param positionType position split to keep; must not be {@code null}
   * @param weekCount number of distinct report dates; must be positive
   * @return matching observations ordered oldest first
   * @throws IllegalArgumentException if {@code weekCount} is not positive
   */
  public static List<Observation> recent(InstrumentSeries series, PositionType positionType, int weekCount) {
    Objects.requireNonNull(series, "series");
    Objects.requireNonNull(positionType, "positionType");
    if (weekCount < 1) {
      throw new IllegalArgumentException("weekCount must be >= 1 (was " + weekCount + ")");
    }
    InstrumentSeries filtered = series.filter(positionType);
    List<LocalDate> dates = filtered.reportDates();
    if (dates.size() < weekCount) {
      log.info("Series {} holds {} {} report dates; {} requested",
          series.contractCode(), dates.size(), positionType.code(), weekCount);
    }
    Set<LocalDate> window = dates.stream()
        .sorted(Comparator.reverseOrder())
        .limit(weekCount)
        .collect(Collectors.toSet());
    return filtered.observations().stream()
        .filter(observation -> window.contains(observation.reportDate()))
        .sorted(InstrumentSeries.ASCENDING)
        .toList();
  }

  /**
   * Returns the observations of the latest report date for one position type, in category order.
   *
   * @param series source series; must not be {@code null}
   * @param positionType position split to keep; must not be {@code null}
   * @return latest snapshot, empty when the series has no observation of that type
   */
  public static List<Observation> latestSnapshot(InstrumentSeries series, PositionType positionType) {
    InstrumentSeries filtered = Objects.requireNonNull(series, "series")
        .filter(Objects.requireNonNull(positionType, "positionType"));
    Optional<LocalDate> latest = filtered.latestDate();
    if (latest.isEmpty()) {
      return List.of();
    }
    LocalDate date = latest.get();
    return filtered.observations().stream()
        .filter(observation -> observation.reportDate().equals(date))
        .sorted(InstrumentSeries.ASCENDING)
        .toList();
  }
}
