package ca.gc.cra.cot.domain.series;

import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.ObservationKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Folds newly decoded observations into an existing instrument series.
 * <p><strong>Why:</strong> Weekly files are re-ingested, corrected, and arrive out of order; the archive must stay
 * free of duplicate keys and converge to the same content regardless.</p>
 * <p><strong>Role:</strong> Pure domain service used by observation store adapters.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>With deduplication enabled, observations are keyed by {@link ObservationKey}. Existing observations are laid
 * down first and incoming ones second, so on a key collision the most recently appended value replaces the stored
 * one; within the incoming batch a later element wins over an earlier one. The result is ordered by
 * {@link InstrumentSeries#DESCENDING}.</p>
 *
 * @since 0.1.0
 */
public final class SeriesMerger {
  private SeriesMerger() {}

  /**
   * Merges incoming observations into an existing series.
   *
   * @param existing stored series; must not be {@code null}
   * @param incoming observations to append; must not be {@code null}
   * @param deduplicate whether to collapse key collisions (last write wins)
   * @return merged series in storage order
   */
  public static InstrumentSeries merge(
      InstrumentSeries existing, Collection<Observation> incoming, boolean deduplicate) {
    Objects.requireNonNull(existing, "existing");
    Objects.requireNonNull(incoming, "incoming");
    List<Observation> combined;
    if (deduplicate) {
      Map<ObservationKey, Observation> byKey = new LinkedHashMap<>();
      for (Observation observation : existing.observations()) {
        byKey.put(observation.key(), observation);
      }
      for (Observation observation : incoming) {
        byKey.put(Objects.requireNonNull(observation, "observation").key(), observation);
      }
      combined = new ArrayList<>(byKey.values());
    } else {
      combined = new ArrayList<>(existing.size() + incoming.size());
      combined.addAll(existing.observations());
      for (Observation observation : incoming) {
        combined.add(Objects.requireNonNull(observation, "observation"));
      }
    }
    combined.sort(InstrumentSeries.DESCENDING);
    return new InstrumentSeries(existing.contractCode(), combined);
  }
}
