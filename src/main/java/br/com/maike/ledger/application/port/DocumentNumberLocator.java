package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.process.ProcessRecord;
import java.util.Optional;

/**
 * One link of the document discovery chain for a shipment.
 *
 * @since 0.1.0
 */
public interface DocumentNumberLocator {

  /**
   * Returns a short name used in logs.
   *
   * @return locator name
   */
  String name();

  /**
   * Indicates whether this locator can discover documents of a kind.
   *
   * @param kind document kind
   * @return {@code true} when {@link #locate(ProcessRecord, DocumentKind)} may return a number
   */
  boolean supports(DocumentKind kind);

  /**
   * Looks up the number of the document of {@code kind} belonging to {@code process}.
   *
   * @param process shipment
   * @param kind document kind
   * @return number, empty when this locator knows none
   * @throws StoreException when the lookup fails
   */
  Optional<String> locate(ProcessRecord process, DocumentKind kind) throws StoreException;
}
