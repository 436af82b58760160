package br.com.maike.ledger.domain.process;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Duty paid for an import declaration; natural key (process, number, DI, tax type, retification).
 *
 * @param processReference shipment reference
 * @param declarationNumber import declaration number
 * @param taxType duty category
 * @param receiptCode federal receipt code, may be {@code null}
 * @param description receipt description, may be {@code null}
 * @param amountBrl amount paid in BRL
 * @param paidAt payment time, may be {@code null}
 * @param retification declaration retification the payment belongs to, may be {@code null}
 * @since 0.1.0
 */
public record TaxPayment(
    String processReference,
    String declarationNumber,
    TaxType taxType,
    String receiptCode,
    String description,
    BigDecimal amountBrl,
    LocalDateTime paidAt,
    Integer retification) {

  public TaxPayment {
    Objects.requireNonNull(processReference, "processReference");
    Objects.requireNonNull(declarationNumber, "declarationNumber");
    Objects.requireNonNull(taxType, "taxType");
    amountBrl = amountBrl == null ? BigDecimal.ZERO : amountBrl;
  }
}
