package ca.gc.cra.cot.domain.series;

import static ca.gc.cra.cot.testutil.ReportFixtures.observation;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class InstrumentSeriesTest {
  private static final LocalDate JAN_09 = LocalDate.of(2026, 1, 9);
  private static final LocalDate JAN_16 = LocalDate.of(2026, 1, 16);
  private static final LocalDate JAN_23 = LocalDate.of(2026, 1, 23);

  private final Observation old = observation(JAN_09, "DEBM", Category.COMMERCIAL, PositionType.TOTAL, 5, 1);
  private final Observation mid = observation(JAN_16, "DEBM", Category.COMMERCIAL, PositionType.OTHER, 6, 1);
  private final Observation recent = observation(JAN_23, "DEBM", Category.INVESTMENT_FIRMS, PositionType.TOTAL, 7, 1);
  private final InstrumentSeries series = new InstrumentSeries("DEBM", List.of(mid, recent, old));

  @Test
  void emptySeriesHasNoDates() {
    InstrumentSeries empty = InstrumentSeries.empty("F7BM");

    assertTrue(empty.isEmpty());
    assertEquals(Optional.empty(), empty.latestDate());
    assertEquals(List.of(), empty.reportDates());
  }

  @Test
  void datesAreDistinctAndAscending() {
    assertEquals(List.of(JAN_09, JAN_16, JAN_23), series.reportDates());
    assertEquals(Optional.of(JAN_23), series.latestDate());
    assertEquals(Optional.of(JAN_09), series.earliestDate());
  }

  @Test
  void orderingViews() {
    assertEquals(List.of(old, mid, recent), series.ascending().observations());
    assertEquals(List.of(recent, mid, old), series.descending().observations());
  }

  @Test
  void filterKeepsOnePositionType() {
    assertEquals(List.of(recent, old), series.filter(PositionType.TOTAL).descending().observations());
  }

  @Test
  void betweenIsInclusiveAndOpenEnded() {
    assertEquals(List.of(mid, recent), series.between(JAN_16, JAN_23).observations());
    assertEquals(List.of(mid, old), series.between(null, JAN_16).observations());
    assertEquals(List.of(recent), series.between(JAN_23, null).observations());
    assertEquals(3, series.between(null, null).size());
  }
}
