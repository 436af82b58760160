package br.com.maike.ledger.domain.document;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Current believed state of one document identity, as stored in {@code DOCUMENTO_ADUANEIRO}.
 *
 * @param id storage id, {@code null} for rows not yet persisted
 * @param identity document identity
 * @param fields canonical fields; absent values are {@code null}
 * @param processReference shipment reference or {@code null}
 * @param rawPayload last raw payload as JSON or {@code null}
 * @param sourceTag data-source tag of the last write
 * @param syncedAt last synchronization time
 * @param createdAt creation time
 * @param updatedAt last update time
 * @since 0.1.0
 */
public record Snapshot(
    Long id,
    DocumentIdentity identity,
    CanonicalFields fields,
    String processReference,
    String rawPayload,
    String sourceTag,
    LocalDateTime syncedAt,
    LocalDateTime createdAt,
    LocalDateTime updatedAt) {

  public Snapshot {
    identity = Objects.requireNonNull(identity, "identity");
    fields = fields == null ? CanonicalFields.EMPTY : fields;
  }

  /**
   * Indicates whether the row is linked to a shipment.
   *
   * @return {@code true} when a non-blank process reference is stored
   */
  public boolean hasProcessReference() {
    return processReference != null && !processReference.isBlank();
  }

  /**
   * Indicates whether a raw payload is stored.
   *
   * @return {@code true} when a non-blank payload is stored
   */
  public boolean hasRawPayload() {
    return rawPayload != null && !rawPayload.isBlank();
  }
}
