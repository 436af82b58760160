package br.com.maike.ledger.domain.document;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable audit row of {@code HISTORICO_DOCUMENTO_ADUANEIRO}.
 *
 * @param snapshotId owning snapshot id, {@code null} when it could not be resolved
 * @param identity document identity
 * @param processReference shipment reference, may be {@code null}
 * @param eventAt event time
 * @param change detected change
 * @param current canonical fields observed with the change
 * @param rawPayload triggering raw payload as JSON, may be {@code null}
 * @param source provenance of the observation
 * @param actor user or system tag
 * @since 0.1.0
 */
public record HistoryRecord(
    Long snapshotId,
    DocumentIdentity identity,
    String processReference,
    LocalDateTime eventAt,
    Change change,
    CanonicalFields current,
    String rawPayload,
    SourceDescriptor source,
    String actor) {

  /** Actor tag used for every engine-written row. */
  public static final String SYSTEM_ACTOR = "SYSTEM";

  public HistoryRecord {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(eventAt, "eventAt");
    Objects.requireNonNull(change, "change");
    Objects.requireNonNull(source, "source");
    current = current == null ? CanonicalFields.EMPTY : current;
    actor = actor == null ? SYSTEM_ACTOR : actor;
  }
}
