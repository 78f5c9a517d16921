package ca.gc.cra.cot.infrastructure.spreadsheet;

import static ca.gc.cra.cot.testutil.ReportFixtures.put;
import static ca.gc.cra.cot.testutil.ReportFixtures.weeklyRows;
import static ca.gc.cra.cot.testutil.ReportFixtures.writeWorkbook;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cot.application.decode.ReportDecoder;
import ca.gc.cra.cot.application.port.SourceUnavailableException;
import ca.gc.cra.cot.domain.grid.CellGrid;
import ca.gc.cra.cot.domain.report.DecodedReport;
import ca.gc.cra.cot.domain.report.PositionType;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PoiCellGridReaderTest {
  @TempDir Path tempDir;

  private final PoiCellGridReader reader = new PoiCellGridReader();

  @Test
  void listsSectionsInWorkbookOrder() throws Exception {
    Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
    sheets.put("Weekly_Report", weeklyRows("DEBM", "2026-01-23"));
    sheets.put("Notes", List.of(List.of("n/a")));
    Path file = writeWorkbook(tempDir.resolve("cot.xlsx"), sheets);

    assertEquals(List.of("Weekly_Report", "Notes"), reader.sections(file));
  }

  @Test
  void readAllReturnsEverySectionInOrder() throws Exception {
    Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
    sheets.put("Weekly_Report", weeklyRows("DEBM", "2026-01-23"));
    sheets.put("Previous_Week", weeklyRows("DEBM", "2026-01-16"));
    sheets.put("Notes", List.of(List.of("n/a")));
    Path file = writeWorkbook(tempDir.resolve("history.xlsx"), sheets);

    List<CellGrid> grids = reader.readAll(file);

    assertEquals(List.of("Weekly_Report", "Previous_Week", "Notes"),
        grids.stream().map(CellGrid::section).toList());
    assertEquals("2026-01-16", grids.get(1).cell(2, 1));
    assertEquals(1, grids.get(2).rowCount());
  }

  @Test
  void readAllOfMissingFileIsUnavailable() {
    assertThrows(SourceUnavailableException.class, () -> reader.readAll(tempDir.resolve("absent.xlsx")));
  }

  @Test
  void readsTypedCellValues() throws Exception {
    List<List<Object>> rows = weeklyRows("DEBM", LocalDate.of(2026, 1, 23));
    put(rows, 13, 5, 1000);
    put(rows, 13, 7, true);
    Path file = writeWorkbook(tempDir.resolve("cot.xlsx"), Map.of("Weekly_Report", rows));

    CellGrid grid = reader.read(file, "Weekly_Report");

    assertEquals("Weekly_Report", grid.section());
    assertEquals(20, grid.rowCount());
    assertEquals(13, grid.columnCount());
    assertEquals(LocalDateTime.of(2026, 1, 23, 0, 0), grid.cell(2, 1));
    assertEquals("DEBM", grid.cell(5, 1));
    assertEquals(1000d, grid.cell(13, 5));
    assertEquals(Boolean.TRUE, grid.cell(13, 7));
    assertNull(grid.cell(13, 6));
  }

  @Test
  void formulaCellsUseCachedResults() throws Exception {
    Path file = tempDir.resolve("formula.xlsx");
    try (Workbook workbook = new XSSFWorkbook()) {
      Sheet sheet = workbook.createSheet("Weekly_Report");
      Row row = sheet.createRow(0);
      row.createCell(0).setCellValue(250d);
      row.createCell(1).setCellFormula("A1*2");
      row.createCell(2).setCellFormula("\"DE\"&\"BM\"");
      workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
      try (OutputStream out = Files.newOutputStream(file)) {
        workbook.write(out);
      }
    }

    CellGrid grid = reader.read(file, "Weekly_Report");

    assertEquals(500d, grid.cell(0, 1));
    assertEquals("DEBM", grid.cell(0, 2));
  }

  @Test
  void missingSectionIsUnavailable() throws Exception {
    Path file = writeWorkbook(tempDir.resolve("cot.xlsx"), Map.of("Weekly_Report", weeklyRows("DEBM", "2026-01-23")));

    SourceUnavailableException ex = assertThrows(SourceUnavailableException.class,
        () -> reader.read(file, "Previous_Week"));
    assertTrue(ex.getMessage().contains("Section 'Previous_Week' not found"));
  }

  @Test
  void missingFileIsUnavailable() {
    SourceUnavailableException ex = assertThrows(SourceUnavailableException.class,
        () -> reader.sections(tempDir.resolve("absent.xlsx")));
    assertTrue(ex.getMessage().startsWith("Report source not found"));
  }

  @Test
  void nonWorkbookFileIsUnavailable() throws IOException {
    Path text = Files.writeString(tempDir.resolve("notes.xlsx"), "this is not a workbook");
    Path empty = Files.createFile(tempDir.resolve("empty.xlsx"));

    assertThrows(SourceUnavailableException.class, () -> reader.sections(text));
    assertThrows(SourceUnavailableException.class, () -> reader.read(empty, "Weekly_Report"));
  }

  @Test
  void decodesWorkbookEndToEnd() throws Exception {
    List<List<Object>> rows = weeklyRows("DEBM", 46045d);
    put(rows, 13, 5, 1000d);
    put(rows, 13, 6, 400d);
    Path file = writeWorkbook(tempDir.resolve("cot.xlsx"), Map.of("Weekly_Report", rows));

    DecodedReport report = new ReportDecoder(reader).latestReport(file);

    assertEquals(LocalDate.of(2026, 1, 23), report.metadata().reportDate());
    assertEquals(600d, report.observations(PositionType.TOTAL).get(1).net());
  }
}
