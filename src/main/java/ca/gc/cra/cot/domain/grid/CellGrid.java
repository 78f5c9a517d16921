package ca.gc.cra.cot.domain.grid;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable, zero-based two-dimensional grid of raw spreadsheet cell values.
 * <p><strong>Why:</strong> Decouples layout decoding from any particular spreadsheet library.</p>
 * <p><strong>Role:</strong> Domain value returned by {@code CellGridReader} and consumed by {@code ReportDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; rows are copied on construction.</p>
 *
 * <p>Cells hold the value as found in the source with no coercion: {@link String}, {@link Double},
 * {@link Boolean}, {@link LocalDateTime}, or {@code null} for blank. The grid is rectangular: rows shorter than
 * {@link #columnCount()} read as blank past their end.</p>
 *
 * @since 0.1.0
 */
public final class CellGrid {
  private final String section;
  private final Object[][] cells;
  private final int columnCount;

  private CellGrid(String section, Object[][] cells, int columnCount) {
    this.section = section;
    this.cells = cells;
    this.columnCount = columnCount;
  }

  /**
   * Builds a grid from row lists.
   *
   * @param section name of the section the grid was read from; must not be {@code null}
   * @param rows row-major cell values; {@code null} rows are treated as empty
   * @return immutable grid
   * @throws IllegalArgumentException if a cell holds an unsupported type
   * @implNote Other {@link Number} types widen to {@link Double}; a {@link LocalDate} becomes midnight of that day.
   */
  public static CellGrid of(String section, List<? extends List<?>> rows) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(rows, "rows");
    Object[][] copy = new Object[rows.size()][];
    int width = 0;
    for (int r = 0; r < rows.size(); r++) {
      List<?> row = rows.get(r);
      if (row == null) {
        copy[r] = new Object[0];
        continue;
      }
      Object[] values = row.toArray();
      for (int c = 0; c < values.length; c++) {
        values[c] = normalize(values[c]);
      }
      copy[r] = values;
      width = Math.max(width, values.length);
    }
    return new CellGrid(section, copy, width);
  }

  /**
   * Returns the section (sheet) name this grid was read from.
   *
   * @return section name
   */
  public String section() {
    return section;
  }

  /**
   * Returns the number of rows.
   *
   * @return row count
   */
  public int rowCount() {
    return cells.length;
  }

  /**
   * Returns the width of the widest row.
   *
   * @return column count
   */
  public int columnCount() {
    return columnCount;
  }

  /**
   * Returns the raw value at a position.
   *
   * @param row zero-based row index
   * @param column zero-based column index
   * @return raw value or {@code null} when blank
   * @throws IndexOutOfBoundsException if the position lies outside {@link #rowCount()} x {@link #columnCount()}
   */
  public Object cell(int row, int column) {
    Objects.checkIndex(row, cells.length);
    Objects.checkIndex(column, columnCount);
    Object[] values = cells[row];
    return column < values.length ? values[column] : null;
  }

  /**
   * Returns a copy of one row padded to {@link #columnCount()}.
   *
   * @param row zero-based row index
   * @return mutable copy of the row
   */
  public List<Object> row(int row) {
    Objects.checkIndex(row, cells.length);
    return new ArrayList<>(Arrays.asList(Arrays.copyOf(cells[row], columnCount)));
  }

  @Override
  public String toString() {
    return "CellGrid{section='" + section + "', rows=" + cells.length + ", columns=" + columnCount + '}';
  }

  private static Object normalize(Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Double
        || value instanceof Boolean
        || value instanceof LocalDateTime) {
      return value;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof LocalDate date) {
      return date.atStartOfDay();
    }
    throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
  }
}
