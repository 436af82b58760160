package br.com.maike.ledger.api;

import br.com.maike.ledger.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: ledger [--verbose] <ingest|backfill|gapfill|reconcile> [options]";
  private static final String HELP_TEXT = """
      Customs document ledger

      Usage:
        ledger [--verbose] <command> [options]

      Commands:
        ingest      Reconcile one JSON payload file against the ledger
        backfill    Migrate historical declarations into the ledger
        gapfill     Fill missing fields of existing snapshot rows
        reconcile   Reconcile documents and financials of active processes

      Run 'ledger <command> --help' for the options of a command.

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   * Flags placed before the command apply to the dispatcher; everything after it goes to the subcommand.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < raw.length && isFlag(raw[commandIndex])) {
      commandIndex++;
    }
    CliInput leading = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (leading.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (leading.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (commandIndex >= raw.length) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);

    return switch (command) {
      case "ingest" -> IngestCli.run(delegateArgs);
      case "backfill" -> BackfillCli.run(delegateArgs);
      case "gapfill", "gap-fill" -> GapFillCli.run(delegateArgs);
      case "reconcile" -> ReconcileCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static boolean isFlag(String arg) {
    if (arg == null || arg.isBlank()) {
      return true;
    }
    String trimmed = arg.trim();
    return trimmed.startsWith("-") || trimmed.equalsIgnoreCase("help");
  }
}
