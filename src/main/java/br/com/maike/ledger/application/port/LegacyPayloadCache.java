package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.validation.Strings;
import java.util.Optional;

/**
 * Read-only access to raw payloads kept by the local embedded cache.
 *
 * @since 0.1.0
 */
public interface LegacyPayloadCache {

  /**
   * Returns the most recently cached payload of a document.
   *
   * @param kind document kind
   * @param number document number
   * @return cached payload, empty when the cache holds none
   * @throws StoreException when the cache cannot be read
   */
  Optional<CachedPayload> latest(DocumentKind kind, String number) throws StoreException;

  /**
   * One cached payload.
   *
   * @param json raw payload text; may use single quotes
   * @param processReference shipment reference stored next to the payload, or {@code null}
   */
  record CachedPayload(String json, String processReference) {
    public CachedPayload {
      json = Strings.trimToNull(json);
      processReference = Strings.trimToNull(processReference);
    }
  }
}
