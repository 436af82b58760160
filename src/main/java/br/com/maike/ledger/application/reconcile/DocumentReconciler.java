package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.ClockPort;
import br.com.maike.ledger.application.port.HistoryStore;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.DocumentPayload;
import br.com.maike.ledger.domain.document.HistoryRecord;
import br.com.maike.ledger.domain.document.Observation;
import br.com.maike.ledger.domain.document.Snapshot;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one document observation through change detection, history append and snapshot
 * upsert.
 * <p><strong>Why:</strong> Gives ingestion, backfill and process reconciliation a single entry point with the same
 * idempotence guarantees.</p>
 * <p><strong>Role:</strong> Application-layer facade over {@link FieldExtractor}, {@link ChangeDetector},
 * {@link HistoryAppender} and {@link SnapshotUpserter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the stored snapshot by identity and version.</li>
 *   <li>Append history rows in comparison order, then upsert the snapshot.</li>
 *   <li>Convert store failures into a {@link ReconcileOutcome} instead of throwing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; thread-safe when the injected ports are.</p>
 * <p><strong>Observability:</strong> Sets the {@code document} MDC key and emits {@code ledger.observe.*}
 * metrics.</p>
 *
 * @since 0.1.0
 */
public final class DocumentReconciler {
  private static final Logger log = LoggerFactory.getLogger(DocumentReconciler.class);

  private final FieldExtractor extractor;
  private final ChangeDetector detector;
  private final HistoryAppender appender;
  private final SnapshotUpserter upserter;
  private final SnapshotStore snapshots;
  private final PayloadJson json;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a reconciler with explicit collaborators.
   *
   * @param extractor key/value payload mapper; must not be {@code null}
   * @param detector change detector; must not be {@code null}
   * @param appender history appender; must not be {@code null}
   * @param upserter snapshot upserter; must not be {@code null}
   * @param snapshots snapshot store used for the initial lookup; must not be {@code null}
   * @param json payload serializer; must not be {@code null}
   * @param clock clock supplying observation timestamps; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public DocumentReconciler(
      FieldExtractor extractor,
      ChangeDetector detector,
      HistoryAppender appender,
      SnapshotUpserter upserter,
      SnapshotStore snapshots,
      PayloadJson json,
      ClockPort clock,
      MetricsPort metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.appender = Objects.requireNonNull(appender, "appender");
    this.upserter = Objects.requireNonNull(upserter, "upserter");
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Wires the default pipeline over the given stores.
   *
   * @param snapshots snapshot store
   * @param history history store
   * @param clock clock
   * @param metrics metrics sink
   * @return reconciler
   */
  public static DocumentReconciler create(
      SnapshotStore snapshots,
      HistoryStore history,
      ClockPort clock,
      MetricsPort metrics) {
    return new DocumentReconciler(
        new FieldExtractor(new VersionResolver(metrics), metrics),
        new ChangeDetector(),
        new HistoryAppender(snapshots, history, metrics),
        new SnapshotUpserter(snapshots, metrics),
        snapshots,
        new PayloadJson(),
        clock,
        metrics);
  }

  /**
   * Maps a live or cached key/value payload and reconciles it.
   *
   * @param kind document kind; must not be {@code null}
   * @param number document number, or {@code null} to read it from the payload
   * @param payload raw payload; may be empty
   * @param source provenance; must not be {@code null}
   * @param processReference shipment reference, may be {@code null}
   * @return outcome; never throws for store failures
   */
  public ReconcileOutcome observeRaw(
      DocumentKind kind,
      String number,
      Map<String, Object> payload,
      SourceDescriptor source,
      String processReference) {
    DocumentPayload typed = extractor.extract(kind, number, payload);
    return observe(new Observation(number, typed, payload, source, processReference));
  }

  /**
   * Reconciles one typed observation.
   *
   * @param observation observation; must not be {@code null}
   * @return outcome; never throws for store failures
   */
  public ReconcileOutcome observe(Observation observation) {
    Objects.requireNonNull(observation, "observation");
    if (observation.number() == null) {
      metrics.increment("ledger.observe.rejected");
      log.warn("Rejected {} observation without a document number", observation.payload().kind().code());
      return ReconcileOutcome.failed(null, null, "observation carries no document number");
    }
    DocumentIdentity identity = observation.identity();
    String previousDocument = MDC.get("document");
    MDC.put("document", identity.toString());
    try {
      return reconcile(identity, observation);
    } finally {
      if (previousDocument == null) {
        MDC.remove("document");
      } else {
        MDC.put("document", previousDocument);
      }
    }
  }

  private ReconcileOutcome reconcile(DocumentIdentity identity, Observation observation) {
    LocalDateTime now = clock.now();
    CanonicalFields fields = observation.payload().canonical();
    ObservationContext context = new ObservationContext(
        identity,
        fields,
        observation.processReference(),
        json.write(observation.rawPayload()),
        observation.source(),
        now);

    Optional<Snapshot> previous;
    try {
      previous = snapshots.find(identity);
    } catch (StoreException ex) {
      metrics.increment("ledger.observe.failed");
      log.warn("Snapshot lookup failed for {} ({})", identity, ex.kind(), ex);
      return ReconcileOutcome.failed(identity, ex.kind(), ex.getMessage());
    }

    List<Change> changes = detector.detect(previous, fields, now);
    List<HistoryRecord> appended = appender.append(context, changes);
    if (appended.size() < changes.size()) {
      log.warn("{} of {} history row(s) for {} were not written", changes.size() - appended.size(),
          changes.size(), identity);
    }

    SnapshotUpserter.Action action;
    try {
      action = upserter.upsert(context, previous, changes.size());
    } catch (StoreException ex) {
      metrics.increment("ledger.observe.failed");
      log.warn("Snapshot write failed for {} ({})", identity, ex.kind(), ex);
      return new ReconcileOutcome(identity, ReconcileOutcome.Status.FAILED, changes, appended.size(),
          ex.kind(), ex.getMessage());
    }

    ReconcileOutcome.Status status = switch (action) {
      case INSERTED -> ReconcileOutcome.Status.CREATED;
      case UPDATED -> ReconcileOutcome.Status.UPDATED;
      case UNCHANGED -> ReconcileOutcome.Status.UNCHANGED;
    };
    metrics.increment("ledger.observe." + status.name().toLowerCase(Locale.ROOT));
    if (!changes.isEmpty()) {
      log.info("{} from {}: {} change(s)", identity, observation.source().tag(), changes.size());
    }
    return new ReconcileOutcome(identity, status, changes, appended.size(), null, null);
  }
}
