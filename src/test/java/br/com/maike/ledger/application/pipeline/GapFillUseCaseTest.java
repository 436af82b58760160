package br.com.maike.ledger.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.LegacyPayloadCache;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.application.reconcile.FieldExtractor;
import br.com.maike.ledger.config.GapFillConfig;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import br.com.maike.ledger.testutil.FixedClock;
import br.com.maike.ledger.testutil.InMemorySnapshotStore;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GapFillUseCaseTest {
  private static final LocalDateTime CREATED = LocalDateTime.of(2025, 4, 1, 0, 0);
  private static final LocalDateTime NOW = LocalDateTime.of(2025, 9, 15, 3, 0);
  private static final String DI = "2512345678";

  private InMemorySnapshotStore snapshots;
  private Map<String, LegacyPayloadCache.CachedPayload> cache;
  private Map<String, Map<String, Object>> authoritative;
  private RecordingMetricsPort metrics;
  private GapFillUseCase useCase;

  @BeforeEach
  void setUp() {
    snapshots = new InMemorySnapshotStore();
    cache = new HashMap<>();
    authoritative = new HashMap<>();
    metrics = new RecordingMetricsPort();
    LegacyPayloadCache legacy = (kind, number) -> Optional.ofNullable(cache.get(number));
    AuthoritativeDocumentSource source = new AuthoritativeDocumentSource() {
      @Override
      public boolean supports(DocumentKind kind) {
        return kind == DocumentKind.IMPORT_DECLARATION;
      }

      @Override
      public Optional<SourcedPayload> fetch(DocumentKind kind, String number, String processReference) {
        Map<String, Object> raw = authoritative.get(number);
        if (raw == null) {
          return Optional.empty();
        }
        return Optional.of(new SourcedPayload(new FieldExtractor().extract(kind, number, raw), raw,
            new SourceDescriptor("SERPRO_DB", "fake")));
      }
    };
    useCase = new GapFillUseCase(snapshots, legacy, List.of(source), new FieldExtractor(), new PayloadJson(),
        new FixedClock(NOW), metrics);
  }

  @Test
  void fillsOnlyMissingFieldsFromCachedPayload() {
    Snapshot row = seed(DI, new CanonicalFields("EM ANALISE", null, null, null, null, null, null), null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload(
        "{'situacaoDi': 'DESEMBARACADA', 'canalSelecaoParametrizada': 'VERDE', 'numeroRetificacao': 1}",
        "ALH.0001/25"));

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertEquals(1, report.updated());
    Snapshot filled = snapshots.rows().get(0);
    assertEquals(row.id(), filled.id());
    assertEquals("EM ANALISE", filled.fields().status());
    assertEquals("VERDE", filled.fields().channel());
    assertEquals("1", filled.identity().version());
    assertEquals("ALH.0001/25", filled.processReference());
    assertTrue(filled.rawPayload().contains("DESEMBARACADA"));
    assertEquals(NOW, filled.updatedAt());
    assertEquals(1, metrics.count("gapfill.updated"));
  }

  @Test
  void versionAlreadyUsedByAnotherRowIsNotAssigned() {
    snapshots.seed(new Snapshot(null, new DocumentIdentity(DI, DocumentKind.IMPORT_DECLARATION, "1"),
        CanonicalFields.EMPTY, "ALH.0001/25", "{}", "SERPRO_DB", CREATED, CREATED, CREATED));
    seed(DI, CanonicalFields.EMPTY, null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload("{\"situacaoDi\":\"X\",\"numeroRetificacao\":1}", null));

    useCase.run(new GapFillConfig(100, false, 0));

    Snapshot second = snapshots.rows().get(1);
    assertNull(second.identity().version());
    assertEquals("X", second.fields().status());
  }

  @Test
  void placeholderNumberIsSkipped() {
    snapshots.seed(new Snapshot(null, DocumentIdentity.of("api", DocumentKind.UNIFIED_IMPORT_DECLARATION),
        CanonicalFields.EMPTY, null, "{\"situacao\":\"X\"}", "API_LIVE", CREATED, CREATED, CREATED));

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertEquals(1, report.skipped());
    assertEquals(0, snapshots.calls(InMemorySnapshotStore.Op.UPDATE));
  }

  @Test
  void unparseablePayloadIsCountedMalformed() {
    seed(DI, CanonicalFields.EMPTY, null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload("situacao=DESEMBARACADA", null));

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertEquals(1, report.malformed());
    assertEquals(0, snapshots.calls(InMemorySnapshotStore.Op.UPDATE));
  }

  @Test
  void shortPayloadIsReplacedByLongerAuthoritativeOne() {
    seed(DI, CanonicalFields.EMPTY, null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload("{\"a\":1}", null));
    authoritative.put(DI, Map.of("situacaoDi", "DESEMBARACADA", "canalSelecaoParametrizada", "VERMELHO"));

    useCase.run(new GapFillConfig(100, false, 400));

    Snapshot filled = snapshots.rows().get(0);
    assertEquals("DESEMBARACADA", filled.fields().status());
    assertEquals("VERMELHO", filled.fields().channel());
  }

  @Test
  void dryRunReportsWithoutWriting() {
    seed(DI, CanonicalFields.EMPTY, null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload("{\"situacaoDi\":\"X\"}", null));

    GapFillReport report = useCase.run(new GapFillConfig(100, true, 0));

    assertTrue(report.dryRun());
    assertEquals(1, report.updated());
    assertEquals(0, snapshots.calls(InMemorySnapshotStore.Op.UPDATE));
  }

  @Test
  void rowWithNothingDerivableIsSkipped() {
    seed(DI, new CanonicalFields("X", "X", "VERDE", "X", CREATED, CREATED, null), "ALH.0001/25",
        "{\"situacaoDi\":\"X\"}");

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertEquals(1, report.examined());
    assertEquals(1, report.skipped());
  }

  @Test
  void updateFailureIsCountedAndRunContinues() {
    seed(DI, CanonicalFields.EMPTY, null, null);
    seed("2599999999", CanonicalFields.EMPTY, null, null);
    cache.put(DI, new LegacyPayloadCache.CachedPayload("{\"situacaoDi\":\"X\"}", null));
    cache.put("2599999999", new LegacyPayloadCache.CachedPayload("{\"situacaoDi\":\"Y\"}", null));
    snapshots.failNext(InMemorySnapshotStore.Op.UPDATE, StoreException.Kind.FAILURE);

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertEquals(1, report.errors());
    assertEquals(1, report.updated());
  }

  @Test
  void unavailableListingIsReported() {
    snapshots.failNext(InMemorySnapshotStore.Op.INCOMPLETE, StoreException.Kind.UNAVAILABLE);

    GapFillReport report = useCase.run(new GapFillConfig(100, false, 0));

    assertTrue(report.unavailable());
    assertEquals(0, report.examined());
  }

  private Snapshot seed(String number, CanonicalFields fields, String process, String raw) {
    return snapshots.seed(new Snapshot(null, DocumentIdentity.of(number, DocumentKind.IMPORT_DECLARATION),
        fields, process, raw, "SERPRO_DB", CREATED, CREATED, CREATED));
  }
}
