package ca.gc.cra.cot.application.pipeline;

import static ca.gc.cra.cot.testutil.ReportFixtures.put;
import static ca.gc.cra.cot.testutil.ReportFixtures.weeklyRows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cot.application.decode.ReportDecoder;
import ca.gc.cra.cot.domain.layout.ReportLayout;
import ca.gc.cra.cot.domain.series.InstrumentSeries;
import ca.gc.cra.cot.testutil.InMemoryCellGridReader;
import ca.gc.cra.cot.testutil.InMemoryObservationStore;
import ca.gc.cra.cot.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class IngestUseCaseTest {
  private static final Path WEEK_3 = Path.of("cot-2026-01-23.xlsx");
  private static final Path WEEK_2 = Path.of("cot-2026-01-16.xlsx");
  private static final Path MISSING = Path.of("cot-missing.xlsx");

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;

  private InMemoryCellGridReader reader;
  private InMemoryObservationStore store;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestUseCase.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    List<List<Object>> debm = weeklyRows("DEBM", "2026-01-23");
    put(debm, 13, 5, 1000d);
    put(debm, 13, 6, 400d);
    reader = new InMemoryCellGridReader()
        .with(WEEK_3, "Weekly_Report", debm)
        .with(WEEK_3, "F7BM", weeklyRows("F7BM", "2026-01-23"))
        .with(WEEK_3, "Unlabelled", weeklyRows("  ", "2026-01-23"))
        .with(WEEK_3, "Notes", List.of(List.of("notes")))
        .with(WEEK_2, "Weekly_Report", weeklyRows("DEBM", "2026-01-16"));
    store = new InMemoryObservationStore();
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
  }

  @Test
  void groupsObservationsByContract() throws IOException {
    IngestReport report = useCase(Set.of()).ingest(List.of(WEEK_3, WEEK_2));

    assertTrue(report.succeeded());
    assertEquals(List.of(WEEK_3, WEEK_2), report.filesIngested());
    assertEquals(30, report.rowsAppended().get("DEBM"));
    assertEquals(15, report.rowsAppended().get("F7BM"));
    assertEquals(45, report.totalRows());
    assertEquals(LocalDate.of(2026, 1, 23), report.latestDates().get("DEBM"));
    assertEquals(List.of("DEBM", "F7BM"), store.contracts());

    InstrumentSeries debm = store.load("DEBM").orElseThrow();
    assertEquals(List.of(LocalDate.of(2026, 1, 16), LocalDate.of(2026, 1, 23)), debm.reportDates());
    assertEquals(2, metrics.count("ingest.files.ok"));
  }

  @Test
  void blankContractCodesAreSkippedWithWarning() {
    IngestReport report = useCase(Set.of()).ingest(List.of(WEEK_3));

    assertFalse(report.rowsAppended().containsKey(""));
    boolean warned = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().startsWith("Skipped 15 observations from " + WEEK_3));
    assertTrue(warned);
  }

  @Test
  void sectionFailuresAreCollectedPerSource() {
    IngestReport report = useCase(Set.of()).ingest(List.of(WEEK_3));

    assertEquals(1, report.sectionFailures().size());
    IngestReport.SourceSectionFailure failure = report.sectionFailures().get(0);
    assertEquals(WEEK_3, failure.source());
    assertEquals("Notes", failure.failure().section());
  }

  @Test
  void failingSourceDoesNotStopTheBatch() {
    IngestReport report = useCase(Set.of()).ingest(List.of(MISSING, WEEK_2));

    assertFalse(report.succeeded());
    assertEquals(1, report.fileFailures().size());
    assertEquals(MISSING, report.fileFailures().get(0).source());
    assertEquals(List.of(WEEK_2), report.filesIngested());
    assertEquals(15, report.totalRows());
    assertEquals(1, metrics.count("ingest.files.failed"));
    assertEquals(1, metrics.count("ingest.files.ok"));
    boolean warned = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().startsWith("Failed to ingest " + MISSING));
    assertTrue(warned);
  }

  @Test
  void storeFailureCountsAsFileFailure() {
    store.failOn("F7BM");

    IngestReport report = useCase(Set.of()).ingest(List.of(WEEK_3));

    assertEquals(1, report.fileFailures().size());
    assertTrue(report.fileFailures().get(0).reason().contains("disk full"));
  }

  @Test
  void contractFilterKeepsSelectedContracts() throws IOException {
    IngestReport report = useCase(Set.of("F7BM")).ingest(List.of(WEEK_3, WEEK_2));

    assertTrue(report.succeeded());
    assertEquals(List.of("F7BM"), store.contracts());
    assertTrue(store.load("DEBM").isEmpty());
    assertEquals(15, report.totalRows());
  }

  @Test
  void reingestingIsIdempotent() throws IOException {
    IngestUseCase useCase = useCase(Set.of());
    useCase.ingest(List.of(WEEK_3));
    InstrumentSeries first = store.load("DEBM").orElseThrow();

    useCase.ingest(List.of(WEEK_3));

    assertEquals(first, store.load("DEBM").orElseThrow());
  }

  private IngestUseCase useCase(Set<String> filter) {
    ReportDecoder decoder = new ReportDecoder(
        reader, ReportLayout.standard(), ReportDecoder.DEFAULT_PRIMARY_SECTION, metrics);
    return new IngestUseCase(decoder, store, metrics, true, filter);
  }
}
