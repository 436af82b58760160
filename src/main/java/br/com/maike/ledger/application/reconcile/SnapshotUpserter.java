package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.SnapshotStore.SnapshotUpdate;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.Snapshot;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Creates or updates the single current-state row of a document identity.
 * <p><strong>Write gate:</strong> storage is touched only when no snapshot exists yet, when at least one change
 * was detected, when a process reference is supplied and the stored row has none, or when the stored row has no
 * raw payload and one is now available.</p>
 * <p><strong>Matching:</strong> rows are matched by number, kind and version; an absent version only matches a
 * stored {@code null} version. Matched rows are updated in place with coalescing semantics: an absent value
 * never clears a stored one, the process reference changes only to a different non-blank value and the version
 * is written only when none was stored.</p>
 * <p><strong>Races:</strong> an insert rejected by the unique index re-reads the winning row and updates it.</p>
 * <p><strong>Observability:</strong> Increments {@code ledger.snapshot.inserted}, {@code ledger.snapshot.updated},
 * {@code ledger.snapshot.unchanged} and {@code ledger.snapshot.conflict}.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotUpserter {
  private static final Logger log = LoggerFactory.getLogger(SnapshotUpserter.class);

  private final SnapshotStore snapshots;
  private final MetricsPort metrics;

  /**
   * Creates an upserter.
   *
   * @param snapshots snapshot store; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public SnapshotUpserter(SnapshotStore snapshots, MetricsPort metrics) {
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Outcome of an upsert. */
  public enum Action {
    /** A new row was inserted. */
    INSERTED,
    /** An existing row was updated. */
    UPDATED,
    /** The write gate stayed closed. */
    UNCHANGED
  }

  /**
   * Applies an observation to the snapshot table.
   *
   * @param context observation context; must not be {@code null}
   * @param previous snapshot read before change detection, empty for a new identity
   * @param changeCount number of detected changes
   * @return action taken
   * @throws StoreException when the write fails
   */
  public Action upsert(ObservationContext context, Optional<Snapshot> previous, int changeCount)
      throws StoreException {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(previous, "previous");
    if (previous.isEmpty()) {
      return insertOrMerge(context);
    }
    Snapshot stored = previous.get();
    if (!gateOpen(context, stored, changeCount)) {
      metrics.increment("ledger.snapshot.unchanged");
      log.debug("Snapshot {} unchanged; skipping write", context.identity());
      return Action.UNCHANGED;
    }
    update(stored, context);
    return Action.UPDATED;
  }

  static boolean gateOpen(ObservationContext context, Snapshot stored, int changeCount) {
    if (changeCount > 0) {
      return true;
    }
    if (context.processReference() != null && !stored.hasProcessReference()) {
      return true;
    }
    return context.rawPayload() != null && !stored.hasRawPayload();
  }

  private Action insertOrMerge(ObservationContext context) throws StoreException {
    Snapshot row = new Snapshot(
        null,
        context.identity(),
        context.fields(),
        context.processReference(),
        context.rawPayload(),
        context.source().tag(),
        context.observedAt(),
        context.observedAt(),
        context.observedAt());
    try {
      snapshots.insert(row);
      metrics.increment("ledger.snapshot.inserted");
      log.debug("Snapshot {} inserted", context.identity());
      return Action.INSERTED;
    } catch (StoreException ex) {
      if (ex.kind() != StoreException.Kind.CONFLICT) {
        throw ex;
      }
      metrics.increment("ledger.snapshot.conflict");
      Snapshot winner = snapshots.find(context.identity()).orElseThrow(() -> ex);
      log.info("Snapshot {} was inserted concurrently; merging into row {}", context.identity(), winner.id());
      update(winner, context);
      return Action.UPDATED;
    }
  }

  private void update(Snapshot stored, ObservationContext context) throws StoreException {
    if (stored.id() == null) {
      throw new StoreException(StoreException.Kind.FAILURE, "stored snapshot " + context.identity() + " has no id");
    }
    String process = context.processReference();
    if (process != null && process.equals(stored.processReference())) {
      process = null;
    }
    String version = stored.identity().version() == null ? context.identity().version() : null;
    snapshots.update(stored.id(), new SnapshotUpdate(
        context.fields(),
        process,
        version,
        context.rawPayload(),
        context.source().tag(),
        context.observedAt()));
    metrics.increment("ledger.snapshot.updated");
    log.debug("Snapshot {} updated (row {})", context.identity(), stored.id());
  }
}
