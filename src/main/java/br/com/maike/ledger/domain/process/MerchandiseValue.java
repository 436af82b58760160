package br.com.maike.ledger.domain.process;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One declaration value in one currency; natural key (process, number, DI, type, currency).
 *
 * @param processReference shipment reference
 * @param declarationNumber import declaration number
 * @param type value category
 * @param currency currency
 * @param amount positive amount
 * @since 0.1.0
 */
public record MerchandiseValue(
    String processReference,
    String declarationNumber,
    ValueType type,
    Currency currency,
    BigDecimal amount) {

  public MerchandiseValue {
    Objects.requireNonNull(processReference, "processReference");
    Objects.requireNonNull(declarationNumber, "declarationNumber");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(currency, "currency");
    Objects.requireNonNull(amount, "amount");
    if (amount.signum() <= 0) {
      throw new IllegalArgumentException("amount must be positive (was " + amount + ")");
    }
  }
}
