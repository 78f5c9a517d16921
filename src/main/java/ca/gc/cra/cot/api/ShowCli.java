package ca.gc.cra.cot.api;

import ca.gc.cra.cot.config.ArchiveConfig;
import ca.gc.cra.cot.config.CompositionRoot;
import ca.gc.cra.cot.domain.report.Observation;
import ca.gc.cra.cot.domain.series.InstrumentSeries;
import ca.gc.cra.cot.domain.series.SeriesWindow;
import ca.gc.cra.cot.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the stored history summary of one contract.
 *
 * @since 0.1.0
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE =
      "usage: show contract=CODE [dataDir=DIR] [weeks=N] [positionType=risk_reducing|other|total] [config=YAML]";
  private static final String HELP_TEXT = """
      Show a contract's stored positions

      Usage:
        show contract=DEBM [options]

      Required:
        contract=CODE            Contract code of the archive

      Optional:
        dataDir=DIR              Archive directory (default ./data)
        weeks=N                  Distinct report dates in the recent window (default 13)
        positionType=TYPE        risk_reducing, other, or total (default total)
        config=YAML              YAML file with common/show sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ShowCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ArchiveCliSupport.Resolution resolution = ArchiveCliSupport.resolve("show", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.status();
    }
    ArchiveConfig config = resolution.config();
    String contract = config.contract().orElseThrow();

    try (CompositionRoot root = new CompositionRoot(config, resolution.metricsExporter())) {
      Optional<InstrumentSeries> stored = root.observationStore().load(contract);
      if (stored.isEmpty() || stored.get().isEmpty()) {
        CliPrinter.println("No data stored for " + contract + " in " + config.dataDir().toAbsolutePath());
        return ExitCode.SUCCESS;
      }
      print(stored.get(), config);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read archive of {}", contract, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure showing {}", contract, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void print(InstrumentSeries series, ArchiveConfig config) {
    List<Observation> snapshot = SeriesWindow.latestSnapshot(series, config.positionType());
    List<Observation> window = SeriesWindow.recent(series, config.positionType(), config.weeks());
    List<String> lines = new ArrayList<>();
    lines.add(" Contract       : " + series.contractCode());
    lines.add(" Records        : " + series.size());
    lines.add(" Date range     : " + series.earliestDate().map(LocalDate::toString).orElse("-")
        + " to " + series.latestDate().map(LocalDate::toString).orElse("-"));
    lines.add(" Position type  : " + config.positionType().code());
    if (!snapshot.isEmpty()) {
      lines.add(" Latest report  : " + snapshot.get(0).reportDate());
      for (Observation observation : snapshot) {
        lines.add(String.format(Locale.ROOT,
            "   %-22s long %12.2f  short %12.2f  net %12.2f  long chg %10.2f  short chg %10.2f",
            observation.category().code(), observation.longPosition(), observation.shortPosition(),
            observation.net(), observation.longChange(), observation.shortChange()));
      }
    }
    String dates = window.stream()
        .map(Observation::reportDate)
        .distinct()
        .map(LocalDate::toString)
        .collect(Collectors.joining(", "));
    lines.add(" Recent window  : " + (dates.isEmpty() ? "-" : dates));
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
