package br.com.maike.ledger.api;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.reconcile.ReconcileOutcome;
import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.IngestConfig;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that reconciles one JSON payload file against the ledger.
 *
 * <p>Used for manual replays and for feeding payloads captured elsewhere. The payload goes through the
 * same extraction, change detection and history path as every other observation.</p>
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: ingest ledgerJdbcUrl=URL kind=CE|DI|DUIMP|CCT payload=FILE [number=N] [process=REF] "
          + "[source=TAG] [endpoint=TEXT] [config=PATH]";
  private static final String HELP_TEXT = """
      Ledger payload ingestion

      Usage:
        ingest ledgerJdbcUrl=jdbc:sqlserver://host;databaseName=ledger kind=CE payload=ce.json [options]

      Required:
        kind=CE|DI|DUIMP|CCT       Document kind of the payload
        payload=FILE               JSON object (or a list holding one object)

      Optional:
        number=N                   Document number, read from the payload when omitted
        process=REF                Shipment reference recorded with the snapshot
        source=TAG                 Source tag recorded with history rows (default MANUAL_INGEST)
        endpoint=TEXT              Endpoint recorded with history rows
        ledgerUser=USER ledgerPassword=SECRET ledgerSchema=dbo
        config=PATH                YAML file with common/ingest sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private IngestCli() {}

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
      log.debug("Verbose logging enabled for ingest CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("ingest", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.config();

    IngestConfig config;
    StorageConfig storage;
    try {
      config = IngestConfig.fromMap(effective);
      storage = StorageConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, Object> payload;
    try {
      String text = Files.readString(config.payloadFile(), StandardCharsets.UTF_8);
      payload = new PayloadJson().parseObject(text).orElse(null);
    } catch (IOException ex) {
      log.error("Unable to read payload file {}", config.payloadFile(), ex);
      return ExitCode.IO_ERROR;
    }
    if (payload == null) {
      log.error("Payload file {} does not hold a JSON object", config.payloadFile());
      return ExitCode.INVALID_ARGS;
    }

    log.info("Ingesting {} payload from {} (number={}, process={}, source={})",
        config.kind().code(), config.payloadFile(), config.number().orElse("<payload>"),
        config.processReference().orElse("<none>"), config.source().tag());
    try (CompositionRoot root = roots.apply(storage)) {
      ReconcileOutcome outcome = root.documentReconciler().observeRaw(
          config.kind(),
          config.number().orElse(null),
          payload,
          config.source(),
          config.processReference().orElse(null));
      CliPrinter.printLines(summaryLines(outcome));
      return outcome.isFailure() ? ExitCode.ITEM_FAILURES : ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Ingest configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in ingest", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> summaryLines(ReconcileOutcome outcome) {
    List<String> lines = new ArrayList<>();
    String document = outcome.identity() == null ? "<no number>" : outcome.identity().toString();
    lines.add("Ingest " + outcome.status() + ": " + document);
    for (Change change : outcome.changes()) {
      lines.add("  " + change.description());
    }
    lines.add("  history rows: " + outcome.historyAppended());
    if (outcome.isFailure()) {
      lines.add("  failure: " + (outcome.failureKind() == null ? "" : outcome.failureKind() + " ")
          + outcome.failureMessage());
    }
    return lines;
  }
}
