package br.com.maike.ledger.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.application.port.LegacyPayloadCache.CachedPayload;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.testutil.SqliteDatabase;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteLegacyPayloadCacheTest {

  @TempDir
  Path dir;

  private SqliteLegacyPayloadCache cache;

  @BeforeEach
  void setUp() {
    SqliteDatabase db = SqliteDatabase.create(dir.resolve("cache.db"), "db/cache-sqlite.sql");
    db.execute("INSERT INTO dis_cache VALUES ('2512345678', '{\"old\":1}', 'ALH.0001/25', '2025-05-01 00:00:00')");
    db.execute("INSERT INTO dis_cache VALUES ('2512345678', '{\"new\":2}', 'ALH.0001/25', '2025-06-01 00:00:00')");
    db.execute("INSERT INTO duimps VALUES ('25BR0000012345', '{\"identificacao\":{}}', NULL, '2025-06-01')");
    db.execute("INSERT INTO ces_cache VALUES ('172505417636125', '  ', NULL, '2025-06-01')");
    cache = new SqliteLegacyPayloadCache(new JdbcRunner(db.dataSource(), 0));
  }

  @Test
  void returnsNewestPayloadOfKind() throws Exception {
    CachedPayload cached = cache.latest(DocumentKind.IMPORT_DECLARATION, " 2512345678 ").orElseThrow();

    assertEquals("{\"new\":2}", cached.json());
    assertEquals("ALH.0001/25", cached.processReference());
  }

  @Test
  void unifiedDeclarationsUseTheirOwnTable() throws Exception {
    assertEquals("{\"identificacao\":{}}",
        cache.latest(DocumentKind.UNIFIED_IMPORT_DECLARATION, "25BR0000012345").orElseThrow().json());
  }

  @Test
  void blankRowsAndUnknownNumbersAreEmpty() throws Exception {
    assertTrue(cache.latest(DocumentKind.CARGO_MANIFEST, "172505417636125").isEmpty());
    assertTrue(cache.latest(DocumentKind.TERMINAL_CONTROL, "CCT1").isEmpty());
    assertTrue(cache.latest(DocumentKind.IMPORT_DECLARATION, null).isEmpty());
  }
}
