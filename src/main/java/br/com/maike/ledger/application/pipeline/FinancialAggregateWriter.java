package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.DeclarationFinancialsSource;
import br.com.maike.ledger.application.port.FinancialStore;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.process.DeclarationFinancials;
import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.TaxPayment;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes merchandise values and duty payments of an import declaration.
 * <p><strong>Idempotence:</strong> every row is keyed by its natural key; an insert rejected as a conflict
 * refreshes the stored amount and still counts as written.</p>
 * <p><strong>Thread-safety:</strong> Stateless; thread-safe when the ports are.</p>
 *
 * @since 0.1.0
 */
public final class FinancialAggregateWriter {
  private static final Logger log = LoggerFactory.getLogger(FinancialAggregateWriter.class);

  /** Data-source tag of financial rows. */
  public static final String SOURCE_TAG = "SERPRO_DB";

  private final DeclarationFinancialsSource source;
  private final FinancialStore store;
  private final PayloadJson json;
  private final MetricsPort metrics;

  /**
   * Creates the writer.
   *
   * @param source authoritative financial source
   * @param store financial tables
   * @param json serializer for the tax audit payload
   * @param metrics metrics sink
   */
  public FinancialAggregateWriter(
      DeclarationFinancialsSource source, FinancialStore store, PayloadJson json, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.store = Objects.requireNonNull(store, "store");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Counts of one declaration's financial write. */
  public record Result(int valuesWritten, int taxesWritten, int errors) {
    static final Result NONE = new Result(0, 0, 0);
  }

  /**
   * Reads and writes the financials of one declaration.
   *
   * @param processReference shipment reference
   * @param declarationNumber import declaration number
   * @param retry timeout retry applied to the source read
   * @return counts
   * @throws StoreException only when the store is unavailable
   * @throws InterruptedException when interrupted during backoff
   */
  public Result write(String processReference, String declarationNumber, RetryPolicy retry)
      throws StoreException, InterruptedException {
    Objects.requireNonNull(retry, "retry");
    DeclarationFinancials financials;
    try {
      financials = retry.execute("DI financials fetch", () -> source.fetch(processReference, declarationNumber));
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        throw ex;
      }
      log.warn("Financials of DI {} unavailable: {}", declarationNumber, ex.getMessage());
      return new Result(0, 0, 1);
    }
    if (financials.isEmpty()) {
      return Result.NONE;
    }
    int values = 0;
    int taxes = 0;
    int errors = 0;
    for (MerchandiseValue value : financials.values()) {
      if (writeValue(value)) {
        values++;
      } else {
        errors++;
      }
    }
    for (TaxPayment payment : financials.payments()) {
      if (writeTax(payment)) {
        taxes++;
      } else {
        errors++;
      }
    }
    log.debug("DI {}: {} value(s), {} tax(es), {} error(s)", declarationNumber, values, taxes, errors);
    return new Result(values, taxes, errors);
  }

  private boolean writeValue(MerchandiseValue value) throws StoreException {
    try {
      try {
        store.insertValue(value, SOURCE_TAG);
      } catch (StoreException ex) {
        if (ex.kind() != StoreException.Kind.CONFLICT) {
          throw ex;
        }
        store.refreshValue(value, SOURCE_TAG);
        metrics.increment("financial.value.refreshed");
      }
      metrics.increment("financial.value.written");
      return true;
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        throw ex;
      }
      metrics.increment("financial.value.failed");
      log.warn("Could not write {} {} of DI {}: {}", value.type(), value.currency(), value.declarationNumber(),
          ex.getMessage());
      return false;
    }
  }

  private boolean writeTax(TaxPayment payment) throws StoreException {
    String raw = json.write(auditPayload(payment));
    try {
      try {
        store.insertTax(payment, SOURCE_TAG, raw);
      } catch (StoreException ex) {
        if (ex.kind() != StoreException.Kind.CONFLICT) {
          throw ex;
        }
        store.refreshTax(payment, SOURCE_TAG, raw);
        metrics.increment("financial.tax.refreshed");
      }
      metrics.increment("financial.tax.written");
      return true;
    } catch (StoreException ex) {
      if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
        throw ex;
      }
      metrics.increment("financial.tax.failed");
      log.warn("Could not write {} of DI {}: {}", payment.taxType(), payment.declarationNumber(), ex.getMessage());
      return false;
    }
  }

  private static Map<String, Object> auditPayload(TaxPayment payment) {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("codigoReceita", payment.receiptCode());
    raw.put("descricao", payment.description());
    raw.put("valor", payment.amountBrl());
    raw.put("dataPagamento", payment.paidAt());
    raw.put("numeroRetificacao", payment.retification());
    return raw;
  }
}
