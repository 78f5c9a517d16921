package ca.gc.cra.cot.application.decode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Interprets raw grid cells as numbers, text, and date-times.
 * <p><strong>Why:</strong> Report files mix native numbers, text-typed numbers, blanks, and several date notations;
 * the decoder needs one lenient reading of each.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
final class CellValues {
  private static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);
  private static final double MAX_SERIAL = 2_958_465d;
  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .toFormatter(),
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"),
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm"));
  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("dd.MM.yyyy"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy"));

  private CellValues() {
    // Utility
  }

  /**
   * Reads a cell as a number, treating anything unreadable as zero.
   *
   * @param cell raw cell value
   * @return numeric value; {@code 0.0} for blank, non-numeric, NaN, or infinite cells
   */
  static double number(Object cell) {
    double value;
    if (cell instanceof Double d) {
      value = d;
    } else if (cell instanceof Boolean b) {
      value = b ? 1d : 0d;
    } else if (cell instanceof String text) {
      value = parse(text);
    } else {
      value = 0d;
    }
    return Double.isFinite(value) ? value : 0d;
  }

  /**
   * Renders a cell as trimmed text.
   *
   * @param cell raw cell value
   * @return text form; integral numbers print without a fraction, blanks print as an empty string
   */
  static String text(Object cell) {
    if (cell == null) {
      return "";
    }
    if (cell instanceof Double d) {
      if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
        return Long.toString(d.longValue());
      }
      return d.toString();
    }
    if (cell instanceof LocalDateTime dateTime) {
      return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
          ? dateTime.toLocalDate().toString()
          : dateTime.toString();
    }
    return cell.toString().trim();
  }

  /**
   * Reads a cell as a date-time.
   *
   * @param cell raw cell value: a native date-time, a spreadsheet serial day number, or date text
   * @return parsed date-time, or empty when the cell holds no recognizable date
   */
  static Optional<LocalDateTime> dateTime(Object cell) {
    if (cell instanceof LocalDateTime dateTime) {
      return Optional.of(dateTime);
    }
    if (cell instanceof Double serial) {
      return fromSerial(serial);
    }
    if (cell instanceof String text) {
      return parseDateTime(text.trim());
    }
    return Optional.empty();
  }

  private static double parse(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return 0d;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      return 0d;
    }
  }

  private static Optional<LocalDateTime> fromSerial(double serial) {
    if (!Double.isFinite(serial) || serial < 1d || serial > MAX_SERIAL) {
      return Optional.empty();
    }
    long days = (long) Math.floor(serial);
    long nanos = Math.round((serial - days) * 86_400d) * 1_000_000_000L;
    return Optional.of(SPREADSHEET_EPOCH.plusDays(days).atStartOfDay().plusNanos(nanos));
  }

  private static Optional<LocalDateTime> parseDateTime(String text) {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      try {
        return Optional.of(LocalDateTime.parse(text, format));
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return Optional.of(LocalDate.parse(text, format).atStartOfDay());
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    return Optional.empty();
  }
}
