package br.com.maike.ledger.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.DocumentNumberLocator;
import br.com.maike.ledger.application.port.ProcessCatalog;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.application.reconcile.DocumentReconciler;
import br.com.maike.ledger.application.reconcile.FieldExtractor;
import br.com.maike.ledger.config.ReconcileConfig;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import br.com.maike.ledger.domain.process.Currency;
import br.com.maike.ledger.domain.process.DeclarationFinancials;
import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.ProcessRecord;
import br.com.maike.ledger.domain.process.ValueType;
import br.com.maike.ledger.testutil.FakeSchemaMaintenance;
import br.com.maike.ledger.testutil.FixedClock;
import br.com.maike.ledger.testutil.InMemoryFinancialStore;
import br.com.maike.ledger.testutil.InMemoryHistoryStore;
import br.com.maike.ledger.testutil.InMemorySnapshotStore;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import br.com.maike.ledger.testutil.RecordingSleeper;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProcessReconciliationUseCaseTest {
  private static final String PROCESS = "ALH.0007/25";
  private static final String DI = "2587654321";
  private static final String CE = "172505417636125";

  private InMemorySnapshotStore snapshots;
  private InMemoryFinancialStore financialStore;
  private FakeSchemaMaintenance schema;
  private RecordingMetricsPort metrics;
  private FakeCatalog catalog;
  private FakeLocator kanban;
  private FakeLocator serpro;
  private FakeSource source;
  private ProcessReconciliationUseCase useCase;

  @BeforeEach
  void setUp() {
    snapshots = new InMemorySnapshotStore();
    financialStore = new InMemoryFinancialStore();
    schema = new FakeSchemaMaintenance().length("DOCUMENTO_ADUANEIRO", "status_documento_codigo", 20);
    metrics = new RecordingMetricsPort();
    catalog = new FakeCatalog();
    kanban = new FakeLocator("kanban");
    serpro = new FakeLocator("serpro");
    source = new FakeSource();

    DocumentReconciler reconciler = DocumentReconciler.create(snapshots, new InMemoryHistoryStore(),
        new FixedClock(LocalDateTime.of(2025, 8, 1, 7, 0)), metrics);
    FinancialAggregateWriter financials = new FinancialAggregateWriter(
        (process, number) -> new DeclarationFinancials(
            List.of(new MerchandiseValue(process, number, ValueType.VMLE, Currency.USD, new BigDecimal("1200"))),
            List.of()),
        financialStore, new PayloadJson(), metrics);
    useCase = new ProcessReconciliationUseCase(catalog, List.of(kanban, serpro), List.of(source), reconciler,
        financials, new SchemaSelfHeal(schema, metrics), new RecordingSleeper(), metrics);

    catalog.processes.add(new ProcessRecord(PROCESS, 7L, null, null, null));
    source.payloads.put(DocumentKind.IMPORT_DECLARATION, Map.of("situacaoDi", "DESEMBARACADA"));
    source.payloads.put(DocumentKind.CARGO_MANIFEST, Map.of("situacaoCarga", "ENTREGUE"));
  }

  @Test
  void discoversDocumentsAndWritesSnapshotsAndFinancials() throws Exception {
    kanban.numbers.put(DocumentKind.CARGO_MANIFEST, CE);
    serpro.numbers.put(DocumentKind.IMPORT_DECLARATION, DI);

    ReconciliationReport report = useCase.run(config(false, Optional.empty()));

    assertEquals(1, report.processes());
    assertEquals(2, report.discovered());
    assertEquals(2, report.documentsWritten());
    assertEquals(1, report.valuesWritten());
    assertTrue(report.success());
    for (Snapshot row : snapshots.rows()) {
      assertEquals(PROCESS, row.processReference());
    }
    assertEquals(DI, financialStore.values().get(0).declarationNumber());
    assertEquals(1, metrics.count("reconcile.discovered.serpro"));
  }

  @Test
  void firstLocatorAnswerWinsAndFailuresFallThrough() throws Exception {
    kanban.numbers.put(DocumentKind.IMPORT_DECLARATION, DI);
    serpro.numbers.put(DocumentKind.IMPORT_DECLARATION, "2599999999");
    kanban.failures.put(DocumentKind.CARGO_MANIFEST, StoreException.Kind.FAILURE);
    serpro.numbers.put(DocumentKind.CARGO_MANIFEST, CE);

    useCase.run(config(false, Optional.empty()));

    List<String> numbers = new ArrayList<>();
    for (Snapshot row : snapshots.rows()) {
      numbers.add(row.identity().number());
    }
    assertEquals(List.of(CE, DI), numbers);
    assertTrue(serpro.asked.contains(DocumentKind.CARGO_MANIFEST));
    assertTrue(!serpro.asked.contains(DocumentKind.IMPORT_DECLARATION));
  }

  @Test
  void secondRunFindsNothingToWrite() throws Exception {
    serpro.numbers.put(DocumentKind.IMPORT_DECLARATION, DI);
    useCase.run(config(false, Optional.empty()));

    ReconciliationReport report = useCase.run(config(false, Optional.empty()));

    assertEquals(0, report.documentsWritten());
    assertEquals(1, report.unchanged());
    assertEquals(1, snapshots.rows().size());
  }

  @Test
  void dryRunDiscoversButNeverWrites() throws Exception {
    serpro.numbers.put(DocumentKind.IMPORT_DECLARATION, DI);

    ReconciliationReport report = useCase.run(config(true, Optional.empty()));

    assertTrue(report.dryRun());
    assertEquals(1, report.discovered());
    assertTrue(snapshots.rows().isEmpty());
    assertTrue(financialStore.calls().isEmpty());
    assertTrue(schema.widened().isEmpty());
  }

  @Test
  void selfHealRunsBeforeRealRuns() throws Exception {
    useCase.run(config(false, Optional.empty()));

    assertEquals(List.of("DOCUMENTO_ADUANEIRO.status_documento_codigo"), schema.widened());
  }

  @Test
  void unknownSingleProcessIsStillReconciled() throws Exception {
    serpro.numbers.put(DocumentKind.IMPORT_DECLARATION, DI);

    ReconciliationReport report = useCase.run(config(false, Optional.of("alh.0099/25")));

    assertEquals(1, report.processes());
    assertEquals("ALH.0099/25", snapshots.rows().get(0).processReference());
  }

  @Test
  void documentWithoutAuthoritativeDataIsSkipped() throws Exception {
    serpro.numbers.put(DocumentKind.TERMINAL_CONTROL, "CCT123");

    ReconciliationReport report = useCase.run(config(false, Optional.empty()));

    assertEquals(1, report.skipped());
    assertTrue(snapshots.rows().isEmpty());
  }

  @Test
  void unavailableCatalogFlagsReport() throws Exception {
    catalog.failure = new StoreException(StoreException.Kind.UNAVAILABLE, "no route to host");

    ReconciliationReport report = useCase.run(config(false, Optional.empty()));

    assertTrue(report.unavailable());
    assertEquals(0, report.processes());
  }

  private static ReconcileConfig config(boolean dryRun, Optional<String> process) {
    return new ReconcileConfig(10, process, true, true, dryRun, 2, 0L, true);
  }

  private static final class FakeCatalog implements ProcessCatalog {
    final List<ProcessRecord> processes = new ArrayList<>();
    StoreException failure;

    @Override
    public List<ProcessRecord> recent(int limit) throws StoreException {
      if (failure != null) {
        throw failure;
      }
      return List.copyOf(processes);
    }

    @Override
    public Optional<ProcessRecord> find(String reference) throws StoreException {
      if (failure != null) {
        throw failure;
      }
      return processes.stream().filter(process -> process.reference().equals(reference)).findFirst();
    }
  }

  private static final class FakeLocator implements DocumentNumberLocator {
    final String name;
    final Map<DocumentKind, String> numbers = new EnumMap<>(DocumentKind.class);
    final Map<DocumentKind, StoreException.Kind> failures = new EnumMap<>(DocumentKind.class);
    final List<DocumentKind> asked = new ArrayList<>();

    FakeLocator(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean supports(DocumentKind kind) {
      return true;
    }

    @Override
    public Optional<String> locate(ProcessRecord process, DocumentKind kind) throws StoreException {
      asked.add(kind);
      StoreException.Kind failure = failures.get(kind);
      if (failure != null) {
        throw new StoreException(failure, name + " failed");
      }
      return Optional.ofNullable(numbers.get(kind));
    }
  }

  private static final class FakeSource implements AuthoritativeDocumentSource {
    final Map<DocumentKind, Map<String, Object>> payloads = new HashMap<>();
    private final FieldExtractor extractor = new FieldExtractor();

    @Override
    public boolean supports(DocumentKind kind) {
      return true;
    }

    @Override
    public Optional<SourcedPayload> fetch(DocumentKind kind, String number, String processReference) {
      Map<String, Object> raw = payloads.get(kind);
      if (raw == null) {
        return Optional.empty();
      }
      return Optional.of(new SourcedPayload(extractor.extract(kind, number, raw), raw,
          new SourceDescriptor("SERPRO_DB", "fake")));
    }
  }
}
