package br.com.maike.ledger.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PayloadJsonTest {
  private final PayloadJson json = new PayloadJson();

  @Test
  void readsSingleQuotedLegacyPayloads() {
    Map<String, Object> payload = json.parseObject("{'situacao': 'DESEMBARACADA', 'itens': [1, 2]}").orElseThrow();

    assertEquals("DESEMBARACADA", payload.get("situacao"));
    assertEquals(List.of(1, 2), payload.get("itens"));
  }

  @Test
  void unwrapsSingleElementList() {
    assertEquals(Optional.of(Map.of("numero", "1")), json.parseObject("[{\"numero\":\"1\"}]"));
  }

  @Test
  void objectKeepsKeyOrderAndNestedValues() {
    Map<String, Object> payload = json.parseObject(
        "{\"numero\":\"1\",\"canal\":\"VERDE\",\"identificacao\":{\"dataRegistro\":\"2025-06-30\"}}")
        .orElseThrow();

    assertEquals(List.of("numero", "canal", "identificacao"), List.copyOf(payload.keySet()));
    assertEquals(Map.of("dataRegistro", "2025-06-30"), payload.get("identificacao"));
    payload.put("_source", "TEST");
    assertEquals("TEST", payload.get("_source"));
  }

  @Test
  void nonObjectsAndGarbageAreEmpty() {
    assertEquals(Optional.empty(), json.parseObject("[1,2]"));
    assertEquals(Optional.empty(), json.parseObject("not json"));
    assertEquals(Optional.empty(), json.parseObject("  "));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":1} {\"b\":2}"));
  }

  @Test
  void writesTemporalAndDecimalValues() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("valor", new BigDecimal("10.50"));
    payload.put("data", LocalDateTime.of(2025, 1, 2, 3, 4, 5));
    payload.put("vazio", null);

    assertEquals("{\"valor\":10.50,\"data\":\"2025-01-02T03:04:05\",\"vazio\":null}", json.write(payload));
    assertNull(json.write(Map.of()));
  }

  @Test
  void writtenPayloadParsesBack() {
    String text = json.write(Map.of("numero", "172505417636125"));

    assertTrue(json.parseObject(text).isPresent());
  }
}
