package br.com.maike.ledger.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.maike.ledger.domain.document.DocumentKind;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IngestConfigTest {

  @Test
  void parsesRequiredAndOptionalValues() {
    IngestConfig config = IngestConfig.fromMap(Map.of(
        "kind", "cct",
        "payload", "cct.json",
        "number", " 25BR0001 ",
        "process", "",
        "endpoint", "/cct/consulta"));

    assertEquals(DocumentKind.TERMINAL_CONTROL, config.kind());
    assertEquals(Path.of("cct.json"), config.payloadFile());
    assertEquals(Optional.of("25BR0001"), config.number());
    assertEquals(Optional.empty(), config.processReference());
    assertEquals(IngestConfig.DEFAULT_SOURCE_TAG, config.source().tag());
    assertEquals("/cct/consulta", config.source().endpoint());
  }

  @Test
  void endpointIsOptional() {
    IngestConfig config = IngestConfig.fromMap(Map.of("kind", "DI", "payload", "di.json", "source", "REPLAY"));

    assertEquals("REPLAY", config.source().tag());
    assertNull(config.source().endpoint());
  }

  @Test
  void missingValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> IngestConfig.fromMap(Map.of("payload", "x.json")));
    assertThrows(IllegalArgumentException.class, () -> IngestConfig.fromMap(Map.of("kind", "CE")));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("kind", "CE", "payload", "x.json", "source", "FONTE_Ç")));
  }
}
