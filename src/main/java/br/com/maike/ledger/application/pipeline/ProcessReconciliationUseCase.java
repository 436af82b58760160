package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource.SourcedPayload;
import br.com.maike.ledger.application.port.DocumentNumberLocator;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.ProcessCatalog;
import br.com.maike.ledger.application.port.Sleeper;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.application.reconcile.DocumentReconciler;
import br.com.maike.ledger.application.reconcile.ReconcileOutcome;
import br.com.maike.ledger.config.ReconcileConfig;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Observation;
import br.com.maike.ledger.domain.process.ProcessRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reconciles the documents and declaration financials of each shipment.
 * <p><strong>Discovery:</strong> for every kind, locators are asked in order and the first non-empty answer
 * wins; answers are never cross-checked.</p>
 * <p><strong>Writes:</strong> the minimal payload of each discovered document comes from the first authoritative
 * source supporting its kind and goes through {@link DocumentReconciler}; import declarations additionally get
 * their values and duties written by {@link FinancialAggregateWriter}.</p>
 * <p><strong>Failure policy:</strong> a failing locator falls through to the next one; a failing document counts
 * as an error and the run continues; an unavailable store stops the run and flags the report.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; runs are sequential.</p>
 * <p><strong>Observability:</strong> Sets the {@code process} MDC key and emits {@code reconcile.*} counters.</p>
 *
 * @since 0.1.0
 */
public final class ProcessReconciliationUseCase {
  private static final Logger log = LoggerFactory.getLogger(ProcessReconciliationUseCase.class);

  private final ProcessCatalog catalog;
  private final List<DocumentNumberLocator> locators;
  private final List<AuthoritativeDocumentSource> sources;
  private final DocumentReconciler reconciler;
  private final FinancialAggregateWriter financials;
  private final SchemaSelfHeal selfHeal;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param catalog process catalog
   * @param locators discovery chain in priority order
   * @param sources authoritative payload sources
   * @param reconciler observation pipeline
   * @param financials financial writer
   * @param selfHeal schema self-heal step
   * @param sleeper pause used for retry backoff
   * @param metrics metrics sink
   */
  public ProcessReconciliationUseCase(
      ProcessCatalog catalog,
      List<DocumentNumberLocator> locators,
      List<AuthoritativeDocumentSource> sources,
      DocumentReconciler reconciler,
      FinancialAggregateWriter financials,
      SchemaSelfHeal selfHeal,
      Sleeper sleeper,
      MetricsPort metrics) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.locators = List.copyOf(Objects.requireNonNull(locators, "locators"));
    this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.financials = Objects.requireNonNull(financials, "financials");
    this.selfHeal = Objects.requireNonNull(selfHeal, "selfHeal");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the reconciliation.
   *
   * @param config run settings
   * @return totals; never throws for store failures
   * @throws InterruptedException when interrupted during backoff
   */
  public ReconciliationReport run(ReconcileConfig config) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    RetryPolicy retry = new RetryPolicy(config.lookupAttempts(), config.backoffMillis(), sleeper, metrics);
    Tally tally = new Tally();

    List<ProcessRecord> processes;
    try {
      processes = loadProcesses(config, retry);
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        metrics.increment("reconcile.unavailable");
        log.error("Process catalog unavailable: {}", ex.getMessage());
        return ReconciliationReport.unavailable(config.dryRun());
      }
      log.error("Could not read processes: {}", ex.getMessage());
      tally.errors++;
      return tally.toReport(config.dryRun());
    }

    if (config.schemaSelfHeal() && !config.dryRun()) {
      selfHeal.ensure();
    }

    for (ProcessRecord process : processes) {
      String previous = MDC.get("process");
      MDC.put("process", process.reference());
      try {
        reconcileProcess(process, config, retry, tally);
      } catch (StoreException ex) {
        metrics.increment("reconcile.unavailable");
        log.error("Store unavailable while reconciling {}; stopping: {}", process.reference(), ex.getMessage());
        tally.unavailable = true;
        break;
      } finally {
        if (previous == null) {
          MDC.remove("process");
        } else {
          MDC.put("process", previous);
        }
      }
    }
    ReconciliationReport report = tally.toReport(config.dryRun());
    report.summaryLines().forEach(log::info);
    return report;
  }

  private List<ProcessRecord> loadProcesses(ReconcileConfig config, RetryPolicy retry)
      throws StoreException, InterruptedException {
    if (config.process().isPresent()) {
      String reference = config.process().get();
      Optional<ProcessRecord> found = retry.execute("process lookup", () -> catalog.find(reference));
      return List.of(found.orElseGet(() -> ProcessRecord.of(reference)));
    }
    return retry.execute("process listing", () -> catalog.recent(config.limit()));
  }

  /** Throws only {@code UNAVAILABLE} store failures. */
  private void reconcileProcess(ProcessRecord process, ReconcileConfig config, RetryPolicy retry, Tally tally)
      throws StoreException, InterruptedException {
    tally.processes++;
    String declarationNumber = null;
    for (DocumentKind kind : DocumentKind.values()) {
      Optional<String> number = discover(process, kind, retry);
      if (number.isEmpty()) {
        continue;
      }
      tally.discovered++;
      if (kind == DocumentKind.IMPORT_DECLARATION) {
        declarationNumber = number.get();
      }
      if (config.dryRun()) {
        log.info("[DRY-RUN] {}: {} {}", process.reference(), kind.code(), number.get());
        continue;
      }
      if (config.documents()) {
        reconcileDocument(process, kind, number.get(), retry, tally);
      }
    }
    if (declarationNumber != null && config.financials() && !config.dryRun()) {
      FinancialAggregateWriter.Result result = financials.write(process.reference(), declarationNumber, retry);
      tally.valuesWritten += result.valuesWritten();
      tally.taxesWritten += result.taxesWritten();
      tally.errors += result.errors();
    }
  }

  private Optional<String> discover(ProcessRecord process, DocumentKind kind, RetryPolicy retry)
      throws StoreException, InterruptedException {
    for (DocumentNumberLocator locator : locators) {
      if (!locator.supports(kind)) {
        continue;
      }
      try {
        Optional<String> found =
            retry.execute(locator.name() + " " + kind.code(), () -> locator.locate(process, kind));
        if (found.isPresent()) {
          log.debug("{} {} found by {}", kind.code(), found.get(), locator.name());
          metrics.increment("reconcile.discovered." + locator.name());
          return found;
        }
      } catch (StoreException ex) {
        if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
          throw ex;
        }
        log.debug("Locator {} failed for {} {}: {}", locator.name(), process.reference(), kind.code(),
            ex.getMessage());
      }
    }
    return Optional.empty();
  }

  private void reconcileDocument(
      ProcessRecord process, DocumentKind kind, String number, RetryPolicy retry, Tally tally)
      throws StoreException, InterruptedException {
    Optional<AuthoritativeDocumentSource> source =
        sources.stream().filter(candidate -> candidate.supports(kind)).findFirst();
    if (source.isEmpty()) {
      tally.skipped++;
      return;
    }
    Optional<SourcedPayload> fetched;
    try {
      fetched = retry.execute(kind.code() + " fetch",
          () -> source.get().fetch(kind, number, process.reference()));
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        throw ex;
      }
      tally.errors++;
      metrics.increment("reconcile.errors");
      log.warn("Could not read {} {}: {}", kind.code(), number, ex.getMessage());
      return;
    }
    if (fetched.isEmpty()) {
      tally.skipped++;
      metrics.increment("reconcile.skipped");
      log.debug("{} {} has no authoritative data", kind.code(), number);
      return;
    }
    SourcedPayload payload = fetched.get();
    ReconcileOutcome outcome = reconciler.observe(
        new Observation(number, payload.payload(), payload.rawPayload(), payload.source(), process.reference()));
    if (outcome.isFailure()) {
      if (outcome.failure().orElse(null) == StoreException.Kind.UNAVAILABLE) {
        throw new StoreException(StoreException.Kind.UNAVAILABLE, outcome.failureMessage());
      }
      tally.errors++;
      metrics.increment("reconcile.errors");
      return;
    }
    if (outcome.wroteSnapshot()) {
      tally.documentsWritten++;
    } else {
      tally.unchanged++;
    }
  }

  private static final class Tally {
    int processes;
    int discovered;
    int documentsWritten;
    int unchanged;
    int valuesWritten;
    int taxesWritten;
    int skipped;
    int errors;
    boolean unavailable;

    ReconciliationReport toReport(boolean dryRun) {
      return new ReconciliationReport(processes, discovered, documentsWritten, unchanged, valuesWritten,
          taxesWritten, skipped, errors, dryRun, unavailable);
    }
  }
}
