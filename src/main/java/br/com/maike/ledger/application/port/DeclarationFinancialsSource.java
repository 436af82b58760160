package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.process.DeclarationFinancials;

/**
 * Reads merchandise values and duty payments of an import declaration.
 *
 * @since 0.1.0
 */
public interface DeclarationFinancialsSource {

  /**
   * Reads the financial aggregates of a declaration.
   *
   * @param processReference shipment reference stamped on every aggregate
   * @param declarationNumber import declaration number
   * @return aggregates; empty when the declaration is unknown
   * @throws StoreException when the lookup fails
   */
  DeclarationFinancials fetch(String processReference, String declarationNumber) throws StoreException;
}
