package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.port.BulkDocumentSource;
import br.com.maike.ledger.application.port.BulkDocumentSource.Row;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.Sleeper;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.application.reconcile.DocumentReconciler;
import br.com.maike.ledger.application.reconcile.ReconcileOutcome;
import br.com.maike.ledger.config.BackfillConfig;
import br.com.maike.ledger.config.BackfillConfig.UnknownPolicy;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.ExistenceStatus;
import br.com.maike.ledger.domain.document.Observation;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Populates the ledger from bulk authoritative sources for a historical window.
 * <p><strong>Why:</strong> Documents registered before live tracking started have no snapshot; the backfill
 * converges them through the same pipeline as live observations.</p>
 * <p><strong>Role:</strong> Application-layer orchestrator driving {@link DocumentReconciler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate each configured kind with timeout retries.</li>
 *   <li>Keep only the most recently dated row per document number.</li>
 *   <li>Resolve existence in batches into {@code PRESENT}, {@code ABSENT} or {@code UNKNOWN}.</li>
 *   <li>Write absent documents one at a time with a fixed throttle, re-verifying existence after a failed write.</li>
 * </ul>
 * <p><strong>Dry run:</strong> enumeration, deduplication, existence checks and payload construction run exactly
 * as in a real run; only the final write is suppressed.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; runs are sequential.</p>
 * <p><strong>Observability:</strong> Sets the {@code kind} MDC key and emits {@code backfill.*} counters.</p>
 *
 * @since 0.1.0
 */
public final class BackfillUseCase {
  private static final Logger log = LoggerFactory.getLogger(BackfillUseCase.class);

  /** Endpoint descriptor recorded with migrated documents. */
  public static final String ENDPOINT = "historical_migration";
  /** Raw payload key carrying the bulk origin marker. */
  public static final String ORIGIN_KEY = "_source";

  private final List<BulkDocumentSource> sources;
  private final SnapshotStore snapshots;
  private final DocumentReconciler reconciler;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param sources bulk sources, at most one per kind
   * @param snapshots snapshot store used for existence checks
   * @param reconciler observation pipeline
   * @param sleeper pause used for backoff and throttling
   * @param metrics metrics sink
   */
  public BackfillUseCase(
      List<BulkDocumentSource> sources,
      SnapshotStore snapshots,
      DocumentReconciler reconciler,
      Sleeper sleeper,
      MetricsPort metrics) {
    this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the backfill.
   *
   * @param config run settings
   * @return totals; never throws for store failures
   * @throws InterruptedException when interrupted during backoff or throttling
   */
  public BackfillReport run(BackfillConfig config) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    Tally tally = new Tally();
    log.info("{}Backfill of {} for window {}", config.dryRun() ? "[DRY-RUN] " : "", config.kinds(),
        config.window());
    for (BulkDocumentSource source : sources) {
      if (!config.kinds().contains(source.kind())) {
        continue;
      }
      String previousKind = MDC.get("kind");
      MDC.put("kind", source.kind().code());
      try {
        runKind(source, config, tally);
      } catch (StoreException ex) {
        if (ex.kind() != StoreException.Kind.UNAVAILABLE) {
          throw new IllegalStateException("unexpected store failure", ex);
        }
        metrics.increment("backfill.unavailable");
        log.error("Store unavailable; stopping backfill: {}", ex.getMessage());
        tally.unavailable = true;
        break;
      } finally {
        if (previousKind == null) {
          MDC.remove("kind");
        } else {
          MDC.put("kind", previousKind);
        }
      }
    }
    BackfillReport report = tally.toReport(config.dryRun());
    report.summaryLines().forEach(log::info);
    return report;
  }

  private void runKind(BulkDocumentSource source, BackfillConfig config, Tally tally)
      throws StoreException, InterruptedException {
    DocumentKind kind = source.kind();
    RetryPolicy retry =
        new RetryPolicy(config.existenceAttempts(), config.backoffMillis(), sleeper, metrics);

    List<Row> rows;
    try {
      rows = retry.execute(kind.code() + " enumeration", () -> source.enumerate(config.window(), config.limit()));
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        throw ex;
      }
      metrics.increment("backfill.enumeration.failed");
      log.error("Could not enumerate {} documents: {}", kind.code(), ex.getMessage());
      tally.errors++;
      return;
    }
    tally.enumerated += rows.size();

    List<Row> unique = deduplicate(rows);
    tally.unique += unique.size();
    log.info("{}: {} row(s), {} unique document(s)", kind.code(), rows.size(), unique.size());

    ExistenceCache existence = new ExistenceCache(kind, snapshots, retry, config.existenceBatchSize());
    List<String> numbers = new ArrayList<>(unique.size());
    for (Row row : unique) {
      numbers.add(row.number());
    }
    int unknownBatches = existence.preload(numbers);
    if (unknownBatches > 0) {
      log.warn("{}: {} existence batch(es) unresolved", kind.code(), unknownBatches);
    }

    SourceDescriptor descriptor = new SourceDescriptor(config.sourceTag(), ENDPOINT);
    RetryPolicy writeRetry = new RetryPolicy(config.writeAttempts(), config.backoffMillis(), sleeper, metrics);
    for (Row row : unique) {
      ExistenceStatus status = existence.status(row.number());
      if (status == ExistenceStatus.PRESENT) {
        tally.skipped++;
        metrics.increment("backfill.skipped");
        continue;
      }
      if (status == ExistenceStatus.UNKNOWN && config.unknownPolicy() == UnknownPolicy.SKIP) {
        tally.unknown++;
        metrics.increment("backfill.unknown");
        log.debug("{} {} left for a later run: existence unknown", kind.code(), row.number());
        continue;
      }
      Observation observation = toObservation(row, source.originMarker(), descriptor);
      if (config.dryRun()) {
        tally.migrated++;
        log.info("[DRY-RUN] would migrate {} {} ({})", kind.code(), row.number(), row.payload().canonical().status());
        continue;
      }
      write(observation, row, existence, writeRetry, tally);
      if (tally.unavailable) {
        throw new StoreException(StoreException.Kind.UNAVAILABLE, "store unavailable during writes");
      }
      sleeper.sleep(config.throttleMillis());
    }
  }

  private void write(
      Observation observation, Row row, ExistenceCache existence, RetryPolicy retry, Tally tally)
      throws InterruptedException {
    ReconcileOutcome outcome = null;
    for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
      if (attempt > 1) {
        sleeper.sleep(retry.backoffBefore(attempt));
      }
      outcome = reconciler.observe(observation);
      if (!outcome.isFailure() || outcome.failure().orElse(null) != StoreException.Kind.TIMEOUT) {
        break;
      }
      metrics.increment("backfill.write.timeout");
    }
    if (!outcome.isFailure()) {
      tally.migrated++;
      existence.markPresent(row.number());
      metrics.increment("backfill.migrated");
      return;
    }
    if (outcome.failure().orElse(null) == StoreException.Kind.UNAVAILABLE) {
      tally.errors++;
      tally.unavailable = true;
      return;
    }
    if (existence.verify(row.number()) == ExistenceStatus.PRESENT) {
      tally.skipped++;
      metrics.increment("backfill.skipped");
      log.info("{} {} already present after failed write", row.payload().kind().code(), row.number());
      return;
    }
    tally.errors++;
    metrics.increment("backfill.errors");
    log.warn("Failed to migrate {} {}: {}", row.payload().kind().code(), row.number(), outcome.failureMessage());
  }

  static List<Row> deduplicate(List<Row> rows) {
    Map<String, Row> newest = new LinkedHashMap<>();
    for (Row row : rows) {
      String number = row.number().trim();
      if (number.isEmpty()) {
        continue;
      }
      Row current = newest.get(number);
      if (current == null || isNewer(row.orderingTime(), current.orderingTime())) {
        newest.put(number, row);
      }
    }
    return new ArrayList<>(newest.values());
  }

  private static boolean isNewer(LocalDateTime candidate, LocalDateTime current) {
    if (candidate == null) {
      return false;
    }
    return current == null || candidate.isAfter(current);
  }

  private static Observation toObservation(Row row, String originMarker, SourceDescriptor descriptor) {
    Map<String, Object> raw = new LinkedHashMap<>(row.rawPayload());
    raw.put(ORIGIN_KEY, originMarker);
    return new Observation(row.number().trim(), row.payload(), raw, descriptor, row.processReference());
  }

  private static final class Tally {
    int enumerated;
    int unique;
    int migrated;
    int skipped;
    int unknown;
    int errors;
    boolean unavailable;

    BackfillReport toReport(boolean dryRun) {
      return new BackfillReport(enumerated, unique, migrated, skipped, unknown, errors, dryRun, unavailable);
    }
  }
}
