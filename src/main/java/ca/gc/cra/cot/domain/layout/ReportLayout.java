package ca.gc.cra.cot.domain.layout;

import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.PositionType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Declarative cell coordinates of a fixed-layout weekly position report.
 * <p><strong>Why:</strong> Keeps every positional offset in one table so a new report variant is a new layout, not a
 * change to decode logic.</p>
 * <p><strong>Role:</strong> Immutable configuration passed into {@code ReportDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; maps are copied into unmodifiable views.</p>
 *
 * <p>A block spans one row per entry of {@code positionTypeOrder}, starting at its configured row. Every category
 * reads a (long, short) pair of adjacent columns in each block row.</p>
 *
 * @param headerColumn column holding header values
 * @param headerRows row of each header field
 * @param blockStartRows first row of each value block
 * @param positionTypeOrder position type of each row within a block, top to bottom
 * @param categoryColumns column pair of each category
 * @since 0.1.0
 */
public record ReportLayout(
    int headerColumn,
    Map<HeaderField, Integer> headerRows,
    Map<Block, Integer> blockStartRows,
    List<PositionType> positionTypeOrder,
    Map<Category, ColumnPair> categoryColumns) {

  /** Header fields in the order they appear on the report. */
  public enum HeaderField {
    TRADING_VENUE,
    VENUE_IDENTIFIER,
    REPORT_DATE,
    PUBLICATION_DATETIME,
    CONTRACT_NAME,
    CONTRACT_CODE,
    REPORT_STATUS,
    REPORT_TYPE
  }

  /** Value blocks of the report body. */
  public enum Block {
    /** Number of long/short positions. */
    POSITIONS,
    /** Changes since the previous report. */
    CHANGES,
    /** Percentage of total open interest. */
    PERCENTAGES
  }

  /**
   * Adjacent long/short columns of one category.
   *
   * @param longColumn column holding the long value
   * @param shortColumn column holding the short value
   */
  public record ColumnPair(int longColumn, int shortColumn) {
    /**
     * Rejects negative column indices.
     *
     * @throws IllegalArgumentException if a column is negative
     */
    public ColumnPair {
      if (longColumn < 0 || shortColumn < 0) {
        throw new IllegalArgumentException("columns must be >= 0");
      }
    }
  }

  /**
   * Validates completeness of the table.
   *
   * @throws IllegalArgumentException if a header field, block, position type, or category lacks a coordinate
   */
  public ReportLayout {
    if (headerColumn < 0) {
      throw new IllegalArgumentException("headerColumn must be >= 0");
    }
    headerRows = complete(HeaderField.class, headerRows, "headerRows");
    blockStartRows = complete(Block.class, blockStartRows, "blockStartRows");
    categoryColumns = complete(Category.class, categoryColumns, "categoryColumns");
    positionTypeOrder = List.copyOf(Objects.requireNonNull(positionTypeOrder, "positionTypeOrder"));
    if (positionTypeOrder.size() != PositionType.values().length
        || positionTypeOrder.stream().distinct().count() != positionTypeOrder.size()) {
      throw new IllegalArgumentException("positionTypeOrder must list every position type once");
    }
  }

  /**
   * Returns the layout of the RTS 21 weekly report: header in rows 0-7 of column 1, positions at rows 11-13,
   * changes at rows 14-16, percentages at rows 17-19, and categories in column pairs starting at column 3.
   *
   * @return standard layout
   */
  public static ReportLayout standard() {
    Map<HeaderField, Integer> header = new EnumMap<>(HeaderField.class);
    for (HeaderField field : HeaderField.values()) {
      header.put(field, field.ordinal());
    }
    Map<Block, Integer> blocks = new EnumMap<>(Block.class);
    blocks.put(Block.POSITIONS, 11);
    blocks.put(Block.CHANGES, 14);
    blocks.put(Block.PERCENTAGES, 17);
    Map<Category, ColumnPair> columns = new EnumMap<>(Category.class);
    int column = 3;
    for (Category category : Category.values()) {
      columns.put(category, new ColumnPair(column, column + 1));
      column += 2;
    }
    return new ReportLayout(
        1,
        header,
        blocks,
        List.of(PositionType.RISK_REDUCING, PositionType.OTHER, PositionType.TOTAL),
        columns);
  }

  /**
   * Returns the row of a header field.
   *
   * @param field header field
   * @return zero-based row index
   */
  public int headerRow(HeaderField field) {
    return headerRows.get(field);
  }

  /**
   * Returns the row holding a block's values for one position type.
   *
   * @param block value block
   * @param positionType position split
   * @return zero-based row index
   */
  public int row(Block block, PositionType positionType) {
    return blockStartRows.get(block) + positionTypeOrder.indexOf(positionType);
  }

  /**
   * Returns the column pair of a category.
   *
   * @param category participant category
   * @return long/short columns
   */
  public ColumnPair columns(Category category) {
    return categoryColumns.get(category);
  }

  /**
   * Returns the minimum number of rows a grid needs to be decodable with this layout.
   *
   * @return required row count
   */
  public int requiredRows() {
    int max = maxHeaderRow();
    for (int start : blockStartRows.values()) {
      max = Math.max(max, start + positionTypeOrder.size() - 1);
    }
    return max + 1;
  }

  /**
   * Returns the minimum number of columns a grid needs to be decodable with this layout.
   *
   * @return required column count
   */
  public int requiredColumns() {
    int max = headerColumn;
    for (ColumnPair pair : categoryColumns.values()) {
      max = Math.max(max, Math.max(pair.longColumn(), pair.shortColumn()));
    }
    return max + 1;
  }

  private int maxHeaderRow() {
    int max = 0;
    for (int row : headerRows.values()) {
      max = Math.max(max, row);
    }
    return max;
  }

  private static <K extends Enum<K>, V> Map<K, V> complete(Class<K> type, Map<K, V> source, String name) {
    Objects.requireNonNull(source, name);
    EnumMap<K, V> copy = new EnumMap<>(type);
    copy.putAll(source);
    for (K key : type.getEnumConstants()) {
      V value = copy.get(key);
      if (value == null) {
        throw new IllegalArgumentException(name + " is missing " + key);
      }
      if (value instanceof Integer index && index < 0) {
        throw new IllegalArgumentException(name + " has negative index for " + key);
      }
    }
    return Collections.unmodifiableMap(copy);
  }
}
