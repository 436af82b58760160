package br.com.maike.ledger.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "ledgerJdbcUrl=jdbc:sqlserver://db01;databaseName=ledger", "limit=5"});

    assertEquals("jdbc:sqlserver://db01;databaseName=ledger", map.get("ledgerJdbcUrl"));
    assertEquals("5", map.get("limit"));
  }

  @Test
  void keepsExplicitEmptyValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"ledgerSchema=", " ", null});

    assertEquals(1, map.size());
    assertEquals("", map.get("ledgerSchema"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsArgumentsWithoutKey() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"process"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsInvalidNamesAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"pro cess=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"process=a\u0007b"}));
  }
}
