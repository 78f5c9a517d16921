package ca.gc.cra.cot.api;

import ca.gc.cra.cot.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Archive CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: cot <import|show|list> [options]";
  private static final String HELP_TEXT = """
      Commitment of Traders archive

      Usage:
        cot <command> [options]

      Commands:
        import      Decode report workbooks and append them to the archive
        show        Print a contract's latest positions and recent report dates
        list        List contracts with an archive

      Global flags:
        --help      Show this message (or a command's help after the command name)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "import" -> ImportCli.run(delegateArgs);
      case "show" -> ShowCli.run(delegateArgs);
      case "list" -> ListCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] delegateArgs(String[] args, String command) {
    // Flags may sit on either side of the command; everything except the command token is passed on.
    List<String> delegate = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < delegate.size(); i++) {
      if (delegate.get(i) != null && delegate.get(i).trim().equals(command)) {
        delegate.remove(i);
        break;
      }
    }
    return delegate.toArray(String[]::new);
  }
}
