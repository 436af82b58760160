package br.com.maike.ledger.application.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class VersionResolverTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final VersionResolver resolver = new VersionResolver(metrics);

  @Test
  void declarationReadsRetificationFromAnySpelling() {
    assertEquals(Optional.of("1"),
        resolver.resolve(DocumentKind.IMPORT_DECLARATION, Map.of("sequencialRetificacao", 1.0)));
    assertEquals(Optional.of("2"),
        resolver.resolve(DocumentKind.IMPORT_DECLARATION, Map.of("numero_retificacao", " 2 ")));
    assertEquals(Optional.of("3"),
        resolver.resolve(DocumentKind.IMPORT_DECLARATION, Map.of("retificacao", new BigDecimal("3.00"))));
  }

  @Test
  void blankVersionFallsThroughToNextKeyOrAbsent() {
    assertEquals(Optional.of("4"), resolver.resolve(DocumentKind.IMPORT_DECLARATION,
        Map.of("numeroRetificacao", "  ", "versaoDocumento", "4")));
    assertTrue(resolver.resolve(DocumentKind.IMPORT_DECLARATION, Map.of("numeroRetificacao", "")).isEmpty());
  }

  @Test
  void otherKindsOnlyHonorExplicitVersion() {
    assertTrue(resolver.resolve(DocumentKind.CARGO_MANIFEST, Map.of("numeroRetificacao", "2")).isEmpty());
    assertEquals(Optional.of("7"),
        resolver.resolve(DocumentKind.UNIFIED_IMPORT_DECLARATION, Map.of("versaoDocumento", "7")));
  }

  @Test
  void nonScalarVersionIsAbsentAndCounted() {
    Optional<String> version = resolver.resolve(
        DocumentKind.IMPORT_DECLARATION, Map.of("numeroRetificacao", List.of(1, 2)));

    assertTrue(version.isEmpty());
    assertEquals(1, metrics.count("extract.version.unparseable"));
  }

  @Test
  void nullPayloadHasNoVersion() {
    assertTrue(resolver.resolve(DocumentKind.IMPORT_DECLARATION, null).isEmpty());
  }
}
