package br.com.maike.ledger.domain.process;

import java.util.List;

/**
 * Financial aggregates of one import declaration.
 *
 * @param values merchandise, freight and insurance values with positive amounts
 * @param payments duty payments
 * @since 0.1.0
 */
public record DeclarationFinancials(List<MerchandiseValue> values, List<TaxPayment> payments) {

  public DeclarationFinancials {
    values = values == null ? List.of() : List.copyOf(values);
    payments = payments == null ? List.of() : List.copyOf(payments);
  }

  /**
   * Indicates whether there is anything to write.
   *
   * @return {@code true} when both lists are empty
   */
  public boolean isEmpty() {
    return values.isEmpty() && payments.isEmpty();
  }
}
