package br.com.maike.ledger.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.process.Currency;
import br.com.maike.ledger.domain.process.DeclarationFinancials;
import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.TaxPayment;
import br.com.maike.ledger.domain.process.TaxType;
import br.com.maike.ledger.domain.process.ValueType;
import br.com.maike.ledger.testutil.InMemoryFinancialStore;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import br.com.maike.ledger.testutil.RecordingSleeper;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FinancialAggregateWriterTest {
  private static final String PROCESS = "ALH.0001/25";
  private static final String DI = "2512345678";

  private InMemoryFinancialStore store;
  private RecordingMetricsPort metrics;
  private DeclarationFinancials financials;
  private StoreException sourceFailure;
  private int failuresLeft;
  private int fetches;
  private RecordingSleeper sleeper;
  private RetryPolicy retry;
  private FinancialAggregateWriter writer;

  @BeforeEach
  void setUp() {
    store = new InMemoryFinancialStore();
    metrics = new RecordingMetricsPort();
    financials = new DeclarationFinancials(
        List.of(
            new MerchandiseValue(PROCESS, DI, ValueType.VMLE, Currency.USD, new BigDecimal("1500.00")),
            new MerchandiseValue(PROCESS, DI, ValueType.VMLE, Currency.BRL, new BigDecimal("8010.50"))),
        List.of(new TaxPayment(PROCESS, DI, TaxType.II, "0086", "IMPOSTO DE IMPORTACAO",
            new BigDecimal("961.26"), LocalDateTime.of(2025, 6, 2, 10, 0), 0)));
    sleeper = new RecordingSleeper();
    retry = new RetryPolicy(3, 1_000L, sleeper, metrics);
    failuresLeft = Integer.MAX_VALUE;
    writer = new FinancialAggregateWriter((process, number) -> {
      fetches++;
      if (sourceFailure != null && failuresLeft > 0) {
        failuresLeft--;
        throw sourceFailure;
      }
      return financials;
    }, store, new PayloadJson(), metrics);
  }

  @Test
  void writesValuesAndTaxesWithAuditPayload() throws Exception {
    FinancialAggregateWriter.Result result = writer.write(PROCESS, DI, retry);

    assertEquals(new FinancialAggregateWriter.Result(2, 1, 0), result);
    assertEquals(2, store.values().size());
    assertEquals(1, store.taxes().size());
    String audit = store.taxPayloads().get(0);
    assertTrue(audit.contains("\"codigoReceita\":\"0086\""));
    assertTrue(audit.contains("\"valor\":961.26"));
    assertTrue(audit.contains("\"dataPagamento\":\"2025-06-02T10:00\""));
  }

  @Test
  void existingRowsAreRefreshed() throws Exception {
    writer.write(PROCESS, DI, retry);

    FinancialAggregateWriter.Result again = writer.write(PROCESS, DI, retry);

    assertEquals(new FinancialAggregateWriter.Result(2, 1, 0), again);
    assertEquals(2, store.values().size());
    assertEquals(2, metrics.count("financial.value.refreshed"));
    assertEquals(1, metrics.count("financial.tax.refreshed"));
  }

  @Test
  void failedRowIsCountedAndOthersContinue() throws Exception {
    store.failNext(StoreException.Kind.FAILURE);

    FinancialAggregateWriter.Result result = writer.write(PROCESS, DI, retry);

    assertEquals(new FinancialAggregateWriter.Result(1, 1, 1), result);
    assertEquals(1, metrics.count("financial.value.failed"));
  }

  @Test
  void emptyFinancialsWriteNothing() throws Exception {
    financials = new DeclarationFinancials(List.of(), List.of());

    assertEquals(new FinancialAggregateWriter.Result(0, 0, 0), writer.write(PROCESS, DI, retry));
    assertTrue(store.calls().isEmpty());
  }

  @Test
  void sourceTimeoutIsRetriedBeforeWriting() throws Exception {
    sourceFailure = new StoreException(StoreException.Kind.TIMEOUT, "slow");
    failuresLeft = 1;

    FinancialAggregateWriter.Result result = writer.write(PROCESS, DI, retry);

    assertEquals(new FinancialAggregateWriter.Result(2, 1, 0), result);
    assertEquals(2, fetches);
    assertEquals(List.of(1_000L), sleeper.pauses());
  }

  @Test
  void exhaustedSourceTimeoutsAreOneError() throws Exception {
    sourceFailure = new StoreException(StoreException.Kind.TIMEOUT, "slow");

    assertEquals(new FinancialAggregateWriter.Result(0, 0, 1), writer.write(PROCESS, DI, retry));
    assertEquals(3, fetches);
    assertEquals(List.of(1_000L, 2_000L), sleeper.pauses());
    assertEquals(1, metrics.count("retry.exhausted"));
  }

  @Test
  void sourceFailureIsNotRetried() throws Exception {
    sourceFailure = new StoreException(StoreException.Kind.FAILURE, "bad column");

    assertEquals(new FinancialAggregateWriter.Result(0, 0, 1), writer.write(PROCESS, DI, retry));
    assertEquals(1, fetches);
    assertTrue(sleeper.pauses().isEmpty());
  }

  @Test
  void unavailableStorePropagates() {
    store.failNext(StoreException.Kind.UNAVAILABLE);

    StoreException ex = assertThrows(StoreException.class, () -> writer.write(PROCESS, DI, retry));

    assertEquals(StoreException.Kind.UNAVAILABLE, ex.kind());
  }
}
