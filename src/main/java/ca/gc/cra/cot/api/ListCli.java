package ca.gc.cra.cot.api;

import ca.gc.cra.cot.config.ArchiveConfig;
import ca.gc.cra.cot.config.CompositionRoot;
import ca.gc.cra.cot.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the contracts that have an archive.
 *
 * @since 0.1.0
 */
public final class ListCli {
  private static final Logger log = LoggerFactory.getLogger(ListCli.class);
  private static final String SUMMARY_USAGE = "usage: list [dataDir=DIR] [config=YAML]";

  private ListCli() {}

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
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ArchiveCliSupport.Resolution resolution = ArchiveCliSupport.resolve("list", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.status();
    }
    ArchiveConfig config = resolution.config();
    try (CompositionRoot root = new CompositionRoot(config, resolution.metricsExporter())) {
      List<String> contracts = root.observationStore().contracts();
      if (contracts.isEmpty()) {
        CliPrinter.println("No contracts stored in " + config.dataDir().toAbsolutePath());
      } else {
        CliPrinter.printLines(contracts.toArray(String[]::new));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to list archives in {}", config.dataDir(), ex);
      return ExitCode.IO_ERROR;
    }
  }
}
