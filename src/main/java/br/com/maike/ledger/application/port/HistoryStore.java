package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.HistoryRecord;

/**
 * Append-only port over {@code HISTORICO_DOCUMENTO_ADUANEIRO}.
 *
 * @since 0.1.0
 */
public interface HistoryStore {
  /**
   * Appends one history row.
   *
   * @param record row to append
   * @throws StoreException when the insert fails
   */
  void append(HistoryRecord record) throws StoreException;
}
