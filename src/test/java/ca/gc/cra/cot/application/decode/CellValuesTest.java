package ca.gc.cra.cot.application.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CellValuesTest {

  @Test
  void unreadableNumbersBecomeZero() {
    assertEquals(0d, CellValues.number(null));
    assertEquals(0d, CellValues.number(""));
    assertEquals(0d, CellValues.number("n/a"));
    assertEquals(0d, CellValues.number(Double.NaN));
    assertEquals(0d, CellValues.number(Double.POSITIVE_INFINITY));
    assertEquals(0d, CellValues.number(LocalDateTime.of(2026, 1, 23, 0, 0)));
  }

  @Test
  void numericTextAndBooleansAreRead() {
    assertEquals(12.5d, CellValues.number(" 12.5 "));
    assertEquals(-300d, CellValues.number(-300d));
    assertEquals(1d, CellValues.number(Boolean.TRUE));
    assertEquals(0d, CellValues.number(Boolean.FALSE));
  }

  @Test
  void textRendering() {
    assertEquals("", CellValues.text(null));
    assertEquals("DEBM", CellValues.text("  DEBM "));
    assertEquals("46045", CellValues.text(46045d));
    assertEquals("12.5", CellValues.text(12.5d));
    assertEquals("2026-01-23", CellValues.text(LocalDateTime.of(2026, 1, 23, 0, 0)));
    assertEquals("2026-01-27T16:00", CellValues.text(LocalDateTime.of(2026, 1, 27, 16, 0)));
  }

  @Test
  void serialDayNumbersUseSpreadsheetEpoch() {
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 23, 0, 0)), CellValues.dateTime(46045d));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 23, 12, 0)), CellValues.dateTime(46045.5d));
    assertEquals(Optional.empty(), CellValues.dateTime(0d));
    assertEquals(Optional.empty(), CellValues.dateTime(3_000_000d));
  }

  @Test
  void dateTextNotations() {
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 23, 0, 0)), CellValues.dateTime("2026-01-23"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 23, 0, 0)), CellValues.dateTime("23.01.2026"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 27, 16, 0)), CellValues.dateTime("2026-01-27 16:00"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 27, 16, 0, 30)), CellValues.dateTime("27/01/2026 16:00:30"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 27, 16, 0)), CellValues.dateTime("2026-01-27T16:00"));
  }

  @Test
  void dateTimeTextMayCarryFractionalSeconds() {
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 23, 0, 0)), CellValues.dateTime("2026-01-23 00:00:00.000"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 27, 16, 0, 5, 250_000_000)),
        CellValues.dateTime("2026-01-27 16:00:05.25"));
    assertEquals(Optional.of(LocalDateTime.of(2026, 1, 27, 16, 0, 5, 123_456_000)),
        CellValues.dateTime("2026-01-27 16:00:05.123456"));
  }

  @Test
  void unrecognizedDatesAreEmpty() {
    assertEquals(Optional.empty(), CellValues.dateTime(null));
    assertEquals(Optional.empty(), CellValues.dateTime("  "));
    assertEquals(Optional.empty(), CellValues.dateTime("next Friday"));
    assertEquals(Optional.empty(), CellValues.dateTime(Boolean.TRUE));
  }
}
