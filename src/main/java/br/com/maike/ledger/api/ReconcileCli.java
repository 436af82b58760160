package br.com.maike.ledger.api;

import br.com.maike.ledger.application.pipeline.ReconciliationReport;
import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.ReconcileConfig;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.logging.LoggingConfigurator;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reconciling active processes: documents, declaration values and duty payments.
 *
 * @since 0.1.0
 */
public final class ReconcileCli {
  private static final Logger log = LoggerFactory.getLogger(ReconcileCli.class);
  private static final String SUMMARY_USAGE =
      "usage: reconcile ledgerJdbcUrl=URL [cacheJdbcUrl=URL] [limit=N] [process=REF] "
          + "[documents=true|false] [financials=true|false] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      Ledger process reconciliation

      Usage:
        reconcile ledgerJdbcUrl=jdbc:sqlserver://host;databaseName=ledger [options]

      Optional:
        cacheJdbcUrl=URL           Local process cache (default jdbc:sqlite:chat_ia.db)
        limit=N                    Most recent processes to reconcile (default 50)
        process=REF                Reconcile a single process reference
        documents=true|false       Reconcile document snapshots (default true)
        financials=true|false      Write declaration values and duty payments (default true)
        lookupAttempts=N           Attempts per discovery lookup on timeout (default 3)
        backoffMillis=N            Initial retry backoff (default 1000)
        schemaSelfHeal=true|false  Widen undersized status code columns once (default true)
        ledgerUser=USER ledgerPassword=SECRET ledgerSchema=dbo
        serproSchema=Serpro.dbo duimpSchema=Duimp.dbo
        config=PATH                YAML file with common/reconcile sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        --dry-run                  Discover document numbers without writing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ReconcileCli() {}

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
      log.debug("Verbose logging enabled for reconcile CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("reconcile", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.config();

    ReconcileConfig config;
    StorageConfig storage;
    try {
      config = ReconcileConfig.fromMap(effective);
      storage = StorageConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid reconcile arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info("Starting reconciliation: process={}, limit={}, documents={}, financials={}, dryRun={}",
        config.process().orElse("<recent>"), config.limit(), config.documents(), config.financials(),
        config.dryRun());
    try (CompositionRoot root = roots.apply(storage)) {
      ReconciliationReport report = root.processReconciliationUseCase().run(config);
      CliPrinter.printLines(report.summaryLines());
      return report.success() ? ExitCode.SUCCESS : ExitCode.ITEM_FAILURES;
    } catch (IllegalArgumentException ex) {
      log.error("Reconciliation configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Reconciliation interrupted; stopping", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in reconciliation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
