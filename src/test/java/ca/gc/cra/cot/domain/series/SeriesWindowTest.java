package ca.gc.cra.cot.domain.series;

import static ca.gc.cra.cot.testutil.ReportFixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cot.domain.report.Category;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.report.PositionType;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SeriesWindowTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(SeriesWindow.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
  }

  @Test
  void returnsMostRecentDatesInAscendingOrder() {
    InstrumentSeries series = weeks(5);

    List<Observation> window = SeriesWindow.recent(series, PositionType.TOTAL, 3);

    assertEquals(15, window.size());
    assertEquals(LocalDate.of(2026, 1, 16), window.get(0).reportDate());
    assertEquals(LocalDate.of(2026, 1, 30), window.get(14).reportDate());
    assertTrue(window.stream().allMatch(o -> o.positionType() == PositionType.TOTAL));
    List<Observation> sorted = new ArrayList<>(window);
    sorted.sort(InstrumentSeries.ASCENDING);
    assertEquals(sorted, window);
    assertTrue(appender.list.isEmpty());
  }

  @Test
  void shortSeriesReturnsEverythingAndLogs() {
    InstrumentSeries series = weeks(2);

    List<Observation> window = SeriesWindow.recent(series, PositionType.OTHER, 13);

    assertEquals(10, window.size());
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().equals("Series DEBM holds 2 other report dates; 13 requested"));
    assertTrue(logged);
  }

  @Test
  void emptySeriesYieldsEmptyWindow() {
    assertEquals(List.of(), SeriesWindow.recent(InstrumentSeries.empty("DEBM"), PositionType.TOTAL, 4));
    assertEquals(List.of(), SeriesWindow.latestSnapshot(InstrumentSeries.empty("DEBM"), PositionType.TOTAL));
  }

  @Test
  void nonPositiveWeekCountIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> SeriesWindow.recent(weeks(1), PositionType.TOTAL, 0));
  }

  @Test
  void windowCountsDatesNotRows() {
    InstrumentSeries series = SeriesMerger.merge(weeks(3), snapshot(LocalDate.of(2026, 1, 16), "DEBM", 999), false);

    List<Observation> window = SeriesWindow.recent(series, PositionType.TOTAL, 1);

    assertEquals(10, window.size());
    assertTrue(window.stream().allMatch(o -> o.reportDate().equals(LocalDate.of(2026, 1, 16))));
  }

  @Test
  void latestSnapshotIsOrderedByCategory() {
    List<Observation> latest = SeriesWindow.latestSnapshot(weeks(3), PositionType.TOTAL);

    assertEquals(5, latest.size());
    assertEquals(Category.INVESTMENT_FIRMS, latest.get(0).category());
    assertEquals(Category.COMPLIANCE_OPERATORS, latest.get(4).category());
    assertTrue(latest.stream().allMatch(o -> o.reportDate().equals(LocalDate.of(2026, 1, 16))));
  }

  private static InstrumentSeries weeks(int count) {
    InstrumentSeries series = InstrumentSeries.empty("DEBM");
    LocalDate date = LocalDate.of(2026, 1, 2);
    for (int i = 0; i < count; i++) {
      series = SeriesMerger.merge(series, snapshot(date.plusWeeks(i), "DEBM", 100 * (i + 1)), true);
    }
    return series;
  }
}
