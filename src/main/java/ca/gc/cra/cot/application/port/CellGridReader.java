package ca.gc.cra.cot.application.port;

import ca.gc.cra.cot.domain.grid.CellGrid;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Port reading untyped cell grids out of a tabular report source.
 * <p><strong>Why:</strong> Keeps the layout decoder independent from spreadsheet libraries and file formats.</p>
 * <p><strong>Role:</strong> Input port on the source side of the ingestion pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List the sections (sheets) of a source in their stored order.</li>
 *   <li>Return one section as a zero-based grid of raw values without type coercion.</li>
 *   <li>Return every section of a source; implementations open the source once for this.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless between calls; each call opens and closes the
 * source.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.cot.infrastructure.spreadsheet.PoiCellGridReader
 */
public interface CellGridReader {
  /**
   * Lists the section names of a source.
   *
   * @param source path of the report file; must not be {@code null}
   * @return section names in stored order
   * @throws SourceUnavailableException if the source cannot be opened
   */
  List<String> sections(Path source) throws SourceUnavailableException;

  /**
   * Reads one section as a grid of raw cell values.
   *
   * @param source path of the report file; must not be {@code null}
   * @param section section name; must not be {@code null}
   * @return grid of raw cell values
   * @throws SourceUnavailableException if the source or the section cannot be located
   */
  CellGrid read(Path source, String section) throws SourceUnavailableException;

  /**
   * Reads every section of a source in stored order.
   *
   * @param source path of the report file; must not be {@code null}
   * @return one grid per section
   * @throws SourceUnavailableException if the source or one of its sections cannot be read
   */
  default List<CellGrid> readAll(Path source) throws SourceUnavailableException {
    List<String> names = sections(source);
    List<CellGrid> grids = new ArrayList<>(names.size());
    for (String name : names) {
      grids.add(read(source, name));
    }
    return grids;
  }
}
