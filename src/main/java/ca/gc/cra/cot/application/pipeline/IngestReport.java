package ca.gc.cra.cot.application.pipeline;

import ca.gc.cra.cot.application.decode.DecodeResult.SectionFailure;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one ingestion run.
 *
 * @param filesIngested sources whose observations were stored
 * @param fileFailures sources skipped entirely, with the reason
 * @param sectionFailures sections skipped inside otherwise readable sources
 * @param rowsAppended observations appended per contract code
 * @param latestDates latest stored report date per contract code after the run
 * @since 0.1.0
 */
public record IngestReport(
    List<Path> filesIngested,
    List<FileFailure> fileFailures,
    List<SourceSectionFailure> sectionFailures,
    Map<String, Integer> rowsAppended,
    Map<String, LocalDate> latestDates) {

  /**
   * A source that could not be ingested.
   *
   * @param source report file
   * @param reason failure description
   */
  public record FileFailure(Path source, String reason) {}

  /**
   * A skipped section, tagged with its source.
   *
   * @param source report file
   * @param failure section name and reason
   */
  public record SourceSectionFailure(Path source, SectionFailure failure) {}

  /** Copies the collections. */
  public IngestReport {
    filesIngested = List.copyOf(Objects.requireNonNull(filesIngested, "filesIngested"));
    fileFailures = List.copyOf(Objects.requireNonNull(fileFailures, "fileFailures"));
    sectionFailures = List.copyOf(Objects.requireNonNull(sectionFailures, "sectionFailures"));
    rowsAppended = Map.copyOf(Objects.requireNonNull(rowsAppended, "rowsAppended"));
    latestDates = Map.copyOf(Objects.requireNonNull(latestDates, "latestDates"));
  }

  /**
   * Indicates whether every source was ingested.
   *
   * @return {@code true} when no source failed
   */
  public boolean succeeded() {
    return fileFailures.isEmpty();
  }

  /**
   * Returns the total number of appended observations.
   *
   * @return sum over all contracts
   */
  public int totalRows() {
    return rowsAppended.values().stream().mapToInt(Integer::intValue).sum();
  }
}
