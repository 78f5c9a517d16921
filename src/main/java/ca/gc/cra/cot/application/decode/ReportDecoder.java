package ca.gc.cra.cot.application.decode;

import ca.gc.cra.cot.application.port.CellGridReader;
import ca.gc.cra.cot.application.port.MetricsPort;
import ca.gc.cra.cot.application.port.SourceUnavailableException;
import ca.gc.cra.cot.domain.grid.CellGrid;
import ca.gc.cra.cot.domain.layout.ReportLayout;
import ca.gc.cra.cot.domain.layout.ReportLayout.Block;
import ca.gc.cra.cot.domain.layout.ReportLayout.ColumnPair;
import ca.gc.cra.cot.domain.layout.ReportLayout.HeaderField;
import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.DecodedReport;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import ca.gc.cra.cot.domain.report.ReportMetadata;
import ca.gc.cra.cot.logging.Logs;
import ca.gc.cra.cot.validation.Strings;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns fixed-layout report grids into metadata and normalized observations.
 * <p><strong>Why:</strong> Weekly position reports are positional spreadsheets; every number's meaning comes from
 * its row and column, so decoding is a table lookup that must not drift across report variants.</p>
 * <p><strong>Role:</strong> Application service between the {@link CellGridReader} port and the observation store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the header block into {@link ReportMetadata}; an unreadable report date fails the section.</li>
 *   <li>Read the positions, changes, and percentages blocks and join them per category and position type.</li>
 *   <li>Coerce blank or malformed numeric cells to {@code 0.0} instead of failing.</li>
 *   <li>Decode every section of a source, skipping the ones that fail.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 * <p><strong>Observability:</strong> Logs skipped sections at WARN and emits {@code decode.sections.ok} and
 * {@code decode.sections.failed}.</p>
 *
 * @implNote Zero-coercion cannot tell a true zero from a malformed cell; it is kept so one bad cell never drops an
 * otherwise valid report.
 * @since 0.1.0
 * @see ReportLayout
 */
public final class ReportDecoder {
  /** Name of the sheet carrying the current week's report. */
  public static final String DEFAULT_PRIMARY_SECTION = "Weekly_Report";

  private static final Logger log = LoggerFactory.getLogger(ReportDecoder.class);
  private static final int MAX_CELL_ECHO_BYTES = 64;

  private final CellGridReader reader;
  private final ReportLayout layout;
  private final String primarySection;
  private final MetricsPort metrics;

  /**
   * Creates a decoder for the standard layout and primary section.
   *
   * @param reader grid reader used for file-based operations; must not be {@code null}
   */
  public ReportDecoder(CellGridReader reader) {
    this(reader, ReportLayout.standard(), DEFAULT_PRIMARY_SECTION, MetricsPort.NO_OP);
  }

  /**
   * Creates a decoder with explicit layout and collaborators.
   *
   * @param reader grid reader used for file-based operations; must not be {@code null}
   * @param layout cell coordinates of the report; must not be {@code null}
   * @param primarySection name of the current-week section; must not be blank
   * @param metrics metrics sink; must not be {@code null}
   */
  public ReportDecoder(CellGridReader reader, ReportLayout layout, String primarySection, MetricsPort metrics) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.primarySection = Strings.requireNonBlank("primarySection", primarySection);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decodes the header block of a grid.
   *
   * @param grid report grid; must not be {@code null}
   * @return decoded metadata
   * @throws DecodeException if the grid is smaller than the layout or the report date cannot be parsed
   */
  public ReportMetadata decodeMetadata(CellGrid grid) throws DecodeException {
    Objects.requireNonNull(grid, "grid");
    requireFits(grid);
    Object dateCell = header(grid, HeaderField.REPORT_DATE);
    LocalDate reportDate = CellValues.dateTime(dateCell)
        .map(LocalDateTime::toLocalDate)
        .orElseThrow(() -> new DecodeException(grid.section(),
            "Unparseable report date '" + Logs.truncate(CellValues.text(dateCell), MAX_CELL_ECHO_BYTES)
                + "' in section " + grid.section()));
    Optional<LocalDateTime> publishedAt = CellValues.dateTime(header(grid, HeaderField.PUBLICATION_DATETIME));
    return new ReportMetadata(
        CellValues.text(header(grid, HeaderField.TRADING_VENUE)),
        CellValues.text(header(grid, HeaderField.VENUE_IDENTIFIER)),
        reportDate,
        publishedAt,
        CellValues.text(header(grid, HeaderField.CONTRACT_NAME)),
        CellValues.text(header(grid, HeaderField.CONTRACT_CODE)),
        CellValues.text(header(grid, HeaderField.REPORT_STATUS)),
        CellValues.text(header(grid, HeaderField.REPORT_TYPE)));
  }

  /**
   * Decodes one grid into metadata and observations.
   *
   * @param grid report grid; must not be {@code null}
   * @return one observation per position type and category, ordered by position type then category
   * @throws DecodeException if the grid is smaller than the layout or the report date cannot be parsed
   */
  public DecodedReport decode(CellGrid grid) throws DecodeException {
    ReportMetadata metadata = decodeMetadata(grid);
    List<Observation> observations = new ArrayList<>(
        layout.positionTypeOrder().size() * Category.values().length);
    for (PositionType positionType : layout.positionTypeOrder()) {
      int positionsRow = layout.row(Block.POSITIONS, positionType);
      int changesRow = layout.row(Block.CHANGES, positionType);
      int percentagesRow = layout.row(Block.PERCENTAGES, positionType);
      for (Category category : Category.values()) {
        ColumnPair columns = layout.columns(category);
        observations.add(Observation.of(
            metadata.reportDate(),
            metadata.contractCode(),
            category,
            positionType,
            number(grid, positionsRow, columns.longColumn()),
            number(grid, positionsRow, columns.shortColumn()),
            number(grid, changesRow, columns.longColumn()),
            number(grid, changesRow, columns.shortColumn()),
            number(grid, percentagesRow, columns.longColumn()),
            number(grid, percentagesRow, columns.shortColumn())));
      }
    }
    return new DecodedReport(metadata, observations);
  }

  /**
   * Decodes every section of a source, skipping sections that cannot be decoded.
   *
   * @param source report file; must not be {@code null}
   * @return decoded sections plus the skipped ones; no decoded section yields an empty result, not an error
   * @throws SourceUnavailableException if the source cannot be opened or read
   */
  public DecodeResult decodeAll(Path source) throws SourceUnavailableException {
    Objects.requireNonNull(source, "source");
    List<CellGrid> grids = reader.readAll(source);
    List<DecodedReport> reports = new ArrayList<>(grids.size());
    List<DecodeResult.SectionFailure> failures = new ArrayList<>();
    for (CellGrid grid : grids) {
      try {
        reports.add(decode(grid));
        metrics.increment("decode.sections.ok");
      } catch (DecodeException ex) {
        skip(source, grid.section(), ex.getMessage(), ex, failures);
      } catch (RuntimeException ex) {
        skip(source, grid.section(), ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex, failures);
      }
    }
    log.debug("Decoded {} of {} sections from {}", reports.size(), grids.size(), source);
    return new DecodeResult(source, reports, failures);
  }

  /**
   * Decodes only the primary section of a source.
   *
   * @param source report file; must not be {@code null}
   * @return decoded primary section
   * @throws SourceUnavailableException if the source or its primary section cannot be opened
   * @throws DecodeException if the primary section cannot be decoded
   */
  public DecodedReport decodePrimary(Path source) throws SourceUnavailableException, DecodeException {
    return decode(reader.read(Objects.requireNonNull(source, "source"), primarySection));
  }

  /**
   * Reads the header of the primary section.
   *
   * @param source report file; must not be {@code null}
   * @return decoded metadata
   * @throws SourceUnavailableException if the source or its primary section cannot be opened
   * @throws DecodeException if the report date cannot be parsed
   */
  public ReportMetadata metadata(Path source) throws SourceUnavailableException, DecodeException {
    return decodeMetadata(reader.read(Objects.requireNonNull(source, "source"), primarySection));
  }

  /**
   * Returns the primary section restricted to {@link PositionType#TOTAL} observations.
   *
   * @param source report file; must not be {@code null}
   * @return metadata with the total positions of each category
   * @throws SourceUnavailableException if the source or its primary section cannot be opened
   * @throws DecodeException if the primary section cannot be decoded
   */
  public DecodedReport latestReport(Path source) throws SourceUnavailableException, DecodeException {
    DecodedReport primary = decodePrimary(source);
    return new DecodedReport(primary.metadata(), primary.observations(PositionType.TOTAL));
  }

  /**
   * Returns the layout this decoder reads.
   *
   * @return report layout
   */
  public ReportLayout layout() {
    return layout;
  }

  private void skip(
      Path source,
      String section,
      String reason,
      Exception cause,
      List<DecodeResult.SectionFailure> failures) {
    log.warn("Skipping section '{}' of {}: {}", section, source, reason);
    log.debug("Section '{}' failure detail", section, cause);
    metrics.increment("decode.sections.failed");
    failures.add(new DecodeResult.SectionFailure(section, reason));
  }

  private void requireFits(CellGrid grid) throws DecodeException {
    if (grid.rowCount() < layout.requiredRows() || grid.columnCount() < layout.requiredColumns()) {
      throw new DecodeException(grid.section(),
          "Section " + grid.section() + " is " + grid.rowCount() + "x" + grid.columnCount()
              + "; layout needs at least " + layout.requiredRows() + "x" + layout.requiredColumns());
    }
  }

  private Object header(CellGrid grid, HeaderField field) {
    return grid.cell(layout.headerRow(field), layout.headerColumn());
  }

  private static double number(CellGrid grid, int row, int column) {
    return CellValues.number(grid.cell(row, column));
  }
}
