package br.com.maike.ledger.domain.document;

import java.util.Map;
import java.util.Objects;

/**
 * One freshly observed payload for a document, the unit of work of the reconciliation engine.
 *
 * @param number document number; falls back to the payload number when {@code null}
 * @param payload typed payload
 * @param rawPayload original key/value payload kept for audit and replay; may be empty
 * @param source provenance
 * @param processReference optional shipment reference supplied by the caller
 * @since 0.1.0
 */
public record Observation(
    String number,
    DocumentPayload payload,
    Map<String, Object> rawPayload,
    SourceDescriptor source,
    String processReference) {

  public Observation {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(source, "source");
    rawPayload = rawPayload == null ? Map.of() : rawPayload;
    if (number == null || number.isBlank()) {
      number = payload.number();
    }
  }

  /**
   * Builds the identity from the number, the payload kind and the payload version.
   *
   * @return document identity
   * @throws IllegalArgumentException when neither the observation nor the payload carries a number
   */
  public DocumentIdentity identity() {
    if (number == null) {
      throw new IllegalArgumentException("observation for " + payload.kind() + " carries no document number");
    }
    return new DocumentIdentity(number, payload.kind(), payload.version().orElse(null));
  }
}
