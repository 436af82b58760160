package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.TaxPayment;

/**
 * Keyed writes into {@code VALOR_MERCADORIA} and {@code IMPOSTO_IMPORTACAO}.
 *
 * <p>Inserts raise {@link StoreException.Kind#CONFLICT} when the natural key already exists; callers decide
 * whether that is benign.</p>
 *
 * @since 0.1.0
 */
public interface FinancialStore {

  /**
   * Inserts a value row.
   *
   * @param value value to insert
   * @param sourceTag data-source tag
   * @throws StoreException on failure, kind {@code CONFLICT} when the key exists
   */
  void insertValue(MerchandiseValue value, String sourceTag) throws StoreException;

  /**
   * Refreshes the amount of an existing value row.
   *
   * @param value value to write
   * @param sourceTag data-source tag
   * @throws StoreException on failure
   */
  void refreshValue(MerchandiseValue value, String sourceTag) throws StoreException;

  /**
   * Inserts a duty payment row.
   *
   * @param payment payment to insert
   * @param sourceTag data-source tag
   * @param rawPayload payment as JSON, may be {@code null}
   * @throws StoreException on failure, kind {@code CONFLICT} when the key exists
   */
  void insertTax(TaxPayment payment, String sourceTag, String rawPayload) throws StoreException;

  /**
   * Refreshes an existing duty payment row.
   *
   * @param payment payment to write
   * @param sourceTag data-source tag
   * @param rawPayload payment as JSON, may be {@code null}
   * @throws StoreException on failure
   */
  void refreshTax(TaxPayment payment, String sourceTag, String rawPayload) throws StoreException;
}
