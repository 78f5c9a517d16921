package ca.gc.cra.cot.infrastructure.spreadsheet;

import ca.gc.cra.cot.application.port.CellGridReader;
import ca.gc.cra.cot.application.port.SourceUnavailableException;
import ca.gc.cra.cot.domain.grid.CellGrid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CellGridReader} backed by Apache POI for {@code .xlsx} and {@code .xls} reports.
 * <p><strong>Why:</strong> Weekly position reports are published as workbooks with one sheet per report.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open workbooks read-only; the file format is detected from content, not extension.</li>
 *   <li>Return numeric cells as {@link Double}, date-formatted cells as {@link java.time.LocalDateTime}, text as
 *   {@link String}, and booleans as {@link Boolean}.</li>
 *   <li>Return the cached result of formula cells; blank and error cells read as {@code null}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; every call opens and closes its own workbook, so
 * {@link #readAll} parses a multi-sheet file once instead of once per sheet.</p>
 *
 * @since 0.1.0
 */
public final class PoiCellGridReader implements CellGridReader {
  private static final Logger log = LoggerFactory.getLogger(PoiCellGridReader.class);

  @Override
  public List<String> sections(Path source) throws SourceUnavailableException {
    try (Workbook workbook = open(source)) {
      List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
      for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
        names.add(workbook.getSheetName(i));
      }
      return Collections.unmodifiableList(names);
    } catch (SourceUnavailableException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new SourceUnavailableException("Failed to close workbook " + source, ex);
    }
  }

  @Override
  public CellGrid read(Path source, String section) throws SourceUnavailableException {
    Objects.requireNonNull(section, "section");
    try (Workbook workbook = open(source)) {
      Sheet sheet = workbook.getSheet(section);
      if (sheet == null) {
        throw new SourceUnavailableException("Section '" + section + "' not found in " + source);
      }
      CellGrid grid = CellGrid.of(section, rows(sheet));
      log.debug("Read section '{}' of {} as {}x{} grid", section, source, grid.rowCount(), grid.columnCount());
      return grid;
    } catch (SourceUnavailableException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new SourceUnavailableException("Failed to close workbook " + source, ex);
    }
  }

  @Override
  public List<CellGrid> readAll(Path source) throws SourceUnavailableException {
    try (Workbook workbook = open(source)) {
      List<CellGrid> grids = new ArrayList<>(workbook.getNumberOfSheets());
      for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
        Sheet sheet = workbook.getSheetAt(i);
        grids.add(CellGrid.of(sheet.getSheetName(), rows(sheet)));
      }
      log.debug("Read {} sections of {}", grids.size(), source);
      return Collections.unmodifiableList(grids);
    } catch (SourceUnavailableException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new SourceUnavailableException("Failed to close workbook " + source, ex);
    }
  }

  private static Workbook open(Path source) throws SourceUnavailableException {
    Objects.requireNonNull(source, "source");
    if (!Files.isRegularFile(source)) {
      throw new SourceUnavailableException("Report source not found: " + source);
    }
    try {
      return WorkbookFactory.create(source.toFile(), null, true);
    } catch (IOException ex) {
      throw new SourceUnavailableException("Failed to open workbook " + source + ": " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      // POI reports unsupported or corrupt containers with unchecked exceptions.
      throw new SourceUnavailableException("Unreadable workbook " + source + ": " + ex.getMessage(), ex);
    }
  }

  private static List<List<Object>> rows(Sheet sheet) {
    int lastRow = sheet.getLastRowNum();
    List<List<Object>> rows = new ArrayList<>(Math.max(lastRow + 1, 0));
    for (int r = 0; r <= lastRow; r++) {
      Row row = sheet.getRow(r);
      if (row == null || row.getLastCellNum() < 0) {
        rows.add(List.of());
        continue;
      }
      int width = row.getLastCellNum();
      List<Object> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(value(row.getCell(c)));
      }
      rows.add(values);
    }
    return rows;
  }

  static Object value(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    return switch (type) {
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? cell.getLocalDateTimeCellValue()
          : Double.valueOf(cell.getNumericCellValue());
      case STRING -> cell.getStringCellValue();
      case BOOLEAN -> Boolean.valueOf(cell.getBooleanCellValue());
      default -> null;
    };
  }
}
