package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.DocumentPayload;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds minimal typed payloads directly from known authoritative columns.
 *
 * @since 0.1.0
 */
public interface AuthoritativeDocumentSource {

  /**
   * Indicates whether this source can build payloads for a kind.
   *
   * @param kind document kind
   * @return {@code true} when supported
   */
  boolean supports(DocumentKind kind);

  /**
   * Reads the latest authoritative state of a document.
   *
   * @param kind document kind
   * @param number document number
   * @param processReference shipment reference, used by sources keyed by process; may be {@code null}
   * @return payload with provenance, empty when the source has no row
   * @throws StoreException when the lookup fails
   */
  Optional<SourcedPayload> fetch(DocumentKind kind, String number, String processReference)
      throws StoreException;

  /**
   * Payload plus the provenance to record with it.
   *
   * @param payload typed payload
   * @param rawPayload key/value payload persisted for audit
   * @param source provenance
   */
  record SourcedPayload(DocumentPayload payload, Map<String, Object> rawPayload, SourceDescriptor source) {
    public SourcedPayload {
      Objects.requireNonNull(payload, "payload");
      Objects.requireNonNull(source, "source");
      rawPayload = rawPayload == null ? Map.of() : rawPayload;
    }
  }
}
