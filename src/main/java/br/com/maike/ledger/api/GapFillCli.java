package br.com.maike.ledger.api;

import br.com.maike.ledger.application.pipeline.GapFillReport;
import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.GapFillConfig;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.logging.LoggingConfigurator;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for filling missing fields of existing snapshot rows.
 *
 * @since 0.1.0
 */
public final class GapFillCli {
  private static final Logger log = LoggerFactory.getLogger(GapFillCli.class);
  private static final String SUMMARY_USAGE =
      "usage: gapfill ledgerJdbcUrl=URL [cacheJdbcUrl=URL] [limit=N] [minPayloadLength=N] "
          + "[config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      Ledger gap-fill

      Usage:
        gapfill ledgerJdbcUrl=jdbc:sqlserver://host;databaseName=ledger [options]

      Optional:
        cacheJdbcUrl=URL           Local payload cache (default jdbc:sqlite:chat_ia.db)
        limit=N                    Incomplete rows examined, newest first (default 500)
        minPayloadLength=N         Below this length an authoritative payload is fetched (default 400)
        ledgerUser=USER ledgerPassword=SECRET ledgerSchema=dbo
        config=PATH                YAML file with common/gapfill sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        --dry-run                  Log the planned fills without writing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private GapFillCli() {}

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
      log.debug("Verbose logging enabled for gap-fill CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("gapfill", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.config();

    GapFillConfig config;
    StorageConfig storage;
    try {
      config = GapFillConfig.fromMap(effective);
      storage = StorageConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid gapfill arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info("Starting gap-fill: limit={}, dryRun={}", config.limit(), config.dryRun());
    try (CompositionRoot root = roots.apply(storage)) {
      GapFillReport report = root.gapFillUseCase().run(config);
      CliPrinter.printLines(report.summaryLines());
      return report.success() ? ExitCode.SUCCESS : ExitCode.ITEM_FAILURES;
    } catch (IllegalArgumentException ex) {
      log.error("Gap-fill configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in gap-fill", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
