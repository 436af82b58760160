package br.com.maike.ledger.api;

import br.com.maike.ledger.application.pipeline.BackfillReport;
import br.com.maike.ledger.config.BackfillConfig;
import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.logging.LoggingConfigurator;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the historical backfill of declarations into the ledger.
 *
 * @since 0.1.0
 */
public final class BackfillCli {
  private static final Logger log = LoggerFactory.getLogger(BackfillCli.class);
  private static final String SUMMARY_USAGE =
      "usage: backfill ledgerJdbcUrl=URL [year=YYYY | from=YYYY-MM-DD to=YYYY-MM-DD] [kind=DI|DUIMP|ALL] "
          + "[limit=N] [unknownPolicy=SKIP|INGEST] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      Ledger historical backfill

      Usage:
        backfill ledgerJdbcUrl=jdbc:sqlserver://host;databaseName=ledger [options]

      Window (one of):
        year=YYYY                  Calendar year of registration (default 2025)
        from=YYYY-MM-DD to=YYYY-MM-DD  Explicit half-open date window

      Optional:
        kind=DI|DUIMP|ALL          Declaration kinds to migrate (default ALL)
        limit=N                    Rows enumerated per kind, 0 for no limit (default 0)
        batchSize=N                Numbers per existence check (default 500)
        existenceAttempts=N        Attempts per existence batch on timeout (default 3)
        writeAttempts=N            Attempts per write on timeout (default 2)
        backoffMillis=N            Initial retry backoff, doubled per attempt (default 1000)
        throttleMillis=N           Pause between writes (default 100)
        unknownPolicy=SKIP|INGEST  Handling of documents whose existence is unknown (default SKIP)
        ledgerUser=USER ledgerPassword=SECRET ledgerSchema=dbo
        serproSchema=Serpro.dbo duimpSchema=Duimp.dbo
        config=PATH                YAML file with common/backfill sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        --dry-run                  Report what would be migrated without writing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private BackfillCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<StorageConfig, CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for backfill CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("backfill", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.config();

    BackfillConfig config;
    StorageConfig storage;
    try {
      config = BackfillConfig.fromMap(effective);
      storage = StorageConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid backfill arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info("Starting backfill: window={}, kinds={}, limit={}, dryRun={}, storage={}",
        config.window(), config.kinds(), config.limit(), config.dryRun(), storage);
    try (CompositionRoot root = roots.apply(storage)) {
      BackfillReport report = root.backfillUseCase().run(config);
      CliPrinter.printLines(report.summaryLines());
      return report.success() ? ExitCode.SUCCESS : ExitCode.ITEM_FAILURES;
    } catch (IllegalArgumentException ex) {
      log.error("Backfill configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Backfill interrupted; stopping", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in backfill", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
