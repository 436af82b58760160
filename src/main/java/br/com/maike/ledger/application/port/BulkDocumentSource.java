package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.DateWindow;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.DocumentPayload;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authoritative bulk source enumerating historical documents of one kind.
 *
 * @since 0.1.0
 */
public interface BulkDocumentSource {

  /**
   * Returns the kind this source enumerates.
   *
   * @return document kind
   */
  DocumentKind kind();

  /**
   * Returns the source tag recorded in the raw payload of migrated documents.
   *
   * @return origin marker such as {@code SERPRO_MIGRATION}
   */
  String originMarker();

  /**
   * Enumerates candidate rows in a window, newest first. Rows may repeat a document number.
   *
   * @param window historical window
   * @param limit maximum number of rows, {@code 0} for no limit
   * @return raw candidate rows
   * @throws StoreException when the enumeration fails
   */
  List<Row> enumerate(DateWindow window, int limit) throws StoreException;

  /**
   * One enumerated row.
   *
   * @param number document number
   * @param processReference shipment reference derived by the source, may be {@code null}
   * @param orderingTime time used to keep the most recent row per number, may be {@code null}
   * @param payload typed payload built from the source columns
   * @param rawPayload key/value payload persisted for audit
   */
  record Row(
      String number,
      String processReference,
      LocalDateTime orderingTime,
      DocumentPayload payload,
      Map<String, Object> rawPayload) {

    public Row {
      Objects.requireNonNull(number, "number");
      Objects.requireNonNull(payload, "payload");
      rawPayload = rawPayload == null ? Map.of() : rawPayload;
    }
  }
}
