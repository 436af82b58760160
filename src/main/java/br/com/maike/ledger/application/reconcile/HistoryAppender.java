package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.port.HistoryStore;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.HistoryRecord;
import br.com.maike.ledger.domain.document.Snapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persists one immutable history row per detected change.
 * <p><strong>Role:</strong> Write side of the reconciliation pipeline, invoked before the snapshot upsert.</p>
 * <p><strong>Failure policy:</strong> Rows are written one at a time without a surrounding transaction. A failed
 * row is logged and skipped; an unavailable store stops the loop. The returned list only holds rows that were
 * written, so callers must not infer durability from a non-empty change list.</p>
 * <p><strong>Observability:</strong> Increments {@code ledger.history.appended} and {@code ledger.history.failed}.</p>
 *
 * @since 0.1.0
 */
public final class HistoryAppender {
  private static final Logger log = LoggerFactory.getLogger(HistoryAppender.class);

  private final SnapshotStore snapshots;
  private final HistoryStore history;
  private final MetricsPort metrics;

  /**
   * Creates an appender.
   *
   * @param snapshots snapshot store used to resolve the owning row id; must not be {@code null}
   * @param history history store; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public HistoryAppender(SnapshotStore snapshots, HistoryStore history, MetricsPort metrics) {
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.history = Objects.requireNonNull(history, "history");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Appends the changes of one observation.
   *
   * @param context observation context; must not be {@code null}
   * @param changes ordered changes; must not be {@code null}
   * @return rows actually written, in order
   */
  public List<HistoryRecord> append(ObservationContext context, List<Change> changes) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(changes, "changes");
    if (changes.isEmpty()) {
      return List.of();
    }
    Long snapshotId = resolveSnapshotId(context);
    List<HistoryRecord> written = new ArrayList<>(changes.size());
    for (Change change : changes) {
      HistoryRecord record = new HistoryRecord(
          snapshotId,
          context.identity(),
          context.processReference(),
          context.observedAt(),
          change,
          context.fields(),
          context.rawPayload(),
          context.source(),
          HistoryRecord.SYSTEM_ACTOR);
      try {
        history.append(record);
        written.add(record);
        metrics.increment("ledger.history.appended");
        log.debug("History appended for {}: {}", context.identity(), change.description());
      } catch (StoreException ex) {
        metrics.increment("ledger.history.failed");
        if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
          log.warn("History store unavailable; {} of {} change(s) for {} written",
              written.size(), changes.size(), context.identity(), ex);
          break;
        }
        log.warn("Failed to append {} history for {}", change.field().fieldName(), context.identity(), ex);
      }
    }
    return List.copyOf(written);
  }

  private Long resolveSnapshotId(ObservationContext context) {
    try {
      return snapshots.find(context.identity()).map(Snapshot::id).orElse(null);
    } catch (StoreException ex) {
      log.debug("Could not resolve snapshot id for {}; history rows keep a null reference",
          context.identity(), ex);
      return null;
    }
  }
}
