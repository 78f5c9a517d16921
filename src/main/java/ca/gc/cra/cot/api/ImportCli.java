package ca.gc.cra.cot.api;

import ca.gc.cra.cot.application.pipeline.IngestReport;
import ca.gc.cra.cot.config.ArchiveConfig;
import ca.gc.cra.cot.config.CompositionRoot;
import ca.gc.cra.cot.logging.LoggingConfigurator;
import ca.gc.cra.cot.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports weekly report workbooks into the per-contract archive.
 *
 * @since 0.1.0
 */
public final class ImportCli {
  private static final Logger log = LoggerFactory.getLogger(ImportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: import in=PATH[,PATH...] [contract=CODE] [dataDir=DIR] [primarySection=NAME] "
          + "[deduplicate=true|false] [config=YAML] [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Import weekly position reports

      Usage:
        import in=./reports [options]

      Required:
        in=PATH[,PATH...]        Report workbooks, or directories of .xlsx/.xls workbooks

      Optional:
        contract=CODE            Only store observations of this contract (e.g. DEBM)
        dataDir=DIR              Archive directory (default ./data)
        primarySection=NAME      Sheet holding the current week (default Weekly_Report)
        deduplicate=true|false   Collapse repeated (date, category, position type) keys (default true)
        config=YAML              YAML file with common/import sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --dry-run                List the workbooks that would be imported
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ImportCli() {}

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

    ArchiveCliSupport.Resolution resolution = ArchiveCliSupport.resolve("import", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.status();
    }
    ArchiveConfig config = resolution.config();

    boolean dryRun = input.hasFlag("--dry-run");
    List<Path> sources;
    Path dataDir;
    try {
      sources = expandInputs(resolution.effective().get("in"));
      dataDir = dryRun
          ? config.dataDir().toAbsolutePath()
          : Paths.validateWritableDir(config.dataDir(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid import paths: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to list report inputs", ex);
      return ExitCode.IO_ERROR;
    }
    if (sources.isEmpty()) {
      log.error("No report workbooks found in {}", resolution.effective().get("in"));
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      List<String> lines = new ArrayList<>();
      lines.add("Import dry-run: no archive will be written.");
      lines.add(" Archive directory : " + dataDir);
      lines.add(" Primary section   : " + config.primarySection());
      lines.add(" Deduplicate       : " + config.deduplicate());
      lines.add(" Contract filter   : " + config.contract().orElse("<all>"));
      sources.forEach(source -> lines.add(" Workbook          : " + source));
      CliPrinter.printLines(lines.toArray(String[]::new));
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config, resolution.metricsExporter())) {
      log.info("Importing {} workbooks into {}", sources.size(), dataDir);
      IngestReport report = root.ingestUseCase().ingest(sources);
      printReport(report);
      return report.succeeded() ? ExitCode.SUCCESS : ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during import", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<Path> expandInputs(String raw) throws IOException {
    List<Path> sources = new ArrayList<>();
    if (raw == null) {
      return sources;
    }
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      Path path = Paths.requireReadable(Path.of(token.trim()));
      if (Files.isDirectory(path)) {
        try (Stream<Path> entries = Files.list(path)) {
          entries.filter(Files::isRegularFile)
              .filter(ImportCli::isWorkbook)
              .sorted()
              .forEach(sources::add);
        }
      } else {
        sources.add(path);
      }
    }
    return sources;
  }

  private static boolean isWorkbook(Path path) {
    String name = path.getFileName().toString();
    String lower = name.toLowerCase(Locale.ROOT);
    // ~$ prefixed files are office lock files
    return !name.startsWith("~$") && (lower.endsWith(".xlsx") || lower.endsWith(".xls"));
  }

  private static void printReport(IngestReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("Imported " + report.filesIngested().size() + " workbook(s), "
        + report.fileFailures().size() + " failed, " + report.totalRows() + " observation(s) stored.");
    report.rowsAppended().keySet().stream().sorted().forEach(code -> lines.add(String.format(Locale.ROOT,
        " %-10s %6d rows, latest %s", code, report.rowsAppended().get(code),
        report.latestDates().containsKey(code) ? report.latestDates().get(code) : "-")));
    report.sectionFailures().forEach(failure -> lines.add(" Skipped section '" + failure.failure().section()
        + "' of " + failure.source().getFileName() + ": " + failure.failure().reason()));
    report.fileFailures().forEach(failure ->
        lines.add(" Failed " + failure.source() + ": " + failure.reason()));
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
