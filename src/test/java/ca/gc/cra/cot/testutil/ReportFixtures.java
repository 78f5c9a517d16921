package ca.gc.cra.cot.testutil;

import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/** Builders for weekly report grids, workbooks, and observations used across tests. */
public final class ReportFixtures {
  public static final int ROWS = 20;
  public static final int COLUMNS = 13;

  private ReportFixtures() {}

  /**
   * Creates a mutable 20x13 grid with the header block and row and column labels filled and every value cell
   * blank.
   *
   * @param contractCode value of the contract code header cell
   * @param reportDate value of the report date header cell (text, serial number, or date)
   * @return mutable rows
   */
  public static List<List<Object>> weeklyRows(String contractCode, Object reportDate) {
    List<List<Object>> rows = new ArrayList<>();
    for (int r = 0; r < ROWS; r++) {
      rows.add(new ArrayList<>(Arrays.asList(new Object[COLUMNS])));
    }
    put(rows, 0, 1, "European Energy Exchange AG");
    put(rows, 1, 1, "XEEE");
    put(rows, 2, 1, reportDate);
    put(rows, 3, 1, "2026-01-27 16:00:00");
    put(rows, 4, 1, "EEX German Power Base Month Future");
    put(rows, 5, 1, contractCode);
    put(rows, 6, 1, "Final");
    put(rows, 7, 1, "Weekly");
    int column = 3;
    for (Category category : Category.values()) {
      put(rows, 9, column, category.label());
      put(rows, 10, column, "Long");
      put(rows, 10, column + 1, "Short");
      column += 2;
    }
    String[] blocks = {"Positions", "Changes", "Percentages"};
    for (int block = 0; block < blocks.length; block++) {
      put(rows, 11 + block * 3, 0, blocks[block]);
      for (PositionType type : PositionType.values()) {
        put(rows, 11 + block * 3 + type.ordinal(), 2, type.code());
      }
    }
    return rows;
  }

  /**
   * Sets one cell.
   *
   * @param rows rows from {@link #weeklyRows}
   * @param row zero-based row
   * @param column zero-based column
   * @param value cell value
   */
  public static void put(List<List<Object>> rows, int row, int column, Object value) {
    rows.get(row).set(column, value);
  }

  /**
   * Writes an {@code .xlsx} workbook with one sheet per entry, in map iteration order.
   *
   * @param file target file
   * @param sheets sheet name to rows
   * @return {@code file}
   * @throws IOException if the workbook cannot be written
   */
  public static Path writeWorkbook(Path file, Map<String, ? extends List<? extends List<?>>> sheets)
      throws IOException {
    try (Workbook workbook = new XSSFWorkbook()) {
      CellStyle dateStyle = workbook.createCellStyle();
      dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
      for (Map.Entry<String, ? extends List<? extends List<?>>> entry : sheets.entrySet()) {
        Sheet sheet = workbook.createSheet(entry.getKey());
        List<? extends List<?>> rows = entry.getValue();
        for (int r = 0; r < rows.size(); r++) {
          Row row = sheet.createRow(r);
          List<?> values = rows.get(r);
          for (int c = 0; c < values.size(); c++) {
            Object value = values.get(c);
            if (value == null) {
              continue;
            }
            Cell cell = row.createCell(c);
            if (value instanceof Number number) {
              cell.setCellValue(number.doubleValue());
            } else if (value instanceof Boolean flag) {
              cell.setCellValue(flag);
            } else if (value instanceof LocalDate date) {
              cell.setCellValue(date);
              cell.setCellStyle(dateStyle);
            } else if (value instanceof LocalDateTime dateTime) {
              cell.setCellValue(dateTime);
              cell.setCellStyle(dateStyle);
            } else {
              cell.setCellValue(value.toString());
            }
          }
        }
      }
      try (OutputStream out = Files.newOutputStream(file)) {
        workbook.write(out);
      }
    }
    return file;
  }

  /**
   * Creates an observation with derived net values and zero changes.
   *
   * @param date report date
   * @param code contract code
   * @param category category
   * @param type position type
   * @param longPosition long positions
   * @param shortPosition short positions
   * @return observation
   */
  public static Observation observation(
      LocalDate date, String code, Category category, PositionType type, double longPosition, double shortPosition) {
    return Observation.of(date, code, category, type, longPosition, shortPosition, 0d, 0d, 0d, 0d);
  }

  /**
   * Creates the fifteen observations of one weekly report with distinct, date-dependent values.
   *
   * @param date report date
   * @param code contract code
   * @param base value added to every long position
   * @return observations in position type then category order
   */
  public static List<Observation> snapshot(LocalDate date, String code, double base) {
    List<Observation> observations = new ArrayList<>();
    for (PositionType type : PositionType.values()) {
      for (Category category : Category.values()) {
        double longPosition = base + category.ordinal() * 10 + type.ordinal();
        observations.add(Observation.of(date, code, category, type, longPosition, base / 2,
            1d, 2d, 10d + category.ordinal(), 5d));
      }
    }
    return observations;
  }
}
