package br.com.maike.ledger.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void backfillDefaultsMatchConfigDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Backfill");

    assertEquals("2025", defaults.get("year"));
    assertEquals("ALL", defaults.get("kind"));
    assertEquals("500", defaults.get("batchSize"));
    assertEquals("SKIP", defaults.get("unknownPolicy"));
    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("Serpro.dbo", defaults.get("serproSchema"));
  }

  @Test
  void defaultsParseBackIntoConfigs() {
    assertEquals(BackfillConfig.defaults(), BackfillConfig.fromMap(DefaultsForMode.asFlatMap("backfill")));
    assertEquals(GapFillConfig.defaults(), GapFillConfig.fromMap(DefaultsForMode.asFlatMap("gapfill")));
    assertEquals(ReconcileConfig.defaults(), ReconcileConfig.fromMap(DefaultsForMode.asFlatMap("reconcile")));
  }

  @Test
  void modesDoNotLeakIntoEachOther() {
    Map<String, String> ingest = DefaultsForMode.asFlatMap("ingest");

    assertEquals(IngestConfig.DEFAULT_SOURCE_TAG, ingest.get("source"));
    assertFalse(ingest.containsKey("unknownPolicy"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
