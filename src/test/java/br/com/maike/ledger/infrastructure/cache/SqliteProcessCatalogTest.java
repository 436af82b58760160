package br.com.maike.ledger.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.process.ProcessRecord;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.testutil.SqliteDatabase;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteProcessCatalogTest {

  @TempDir
  Path dir;

  private SqliteProcessCatalog catalog;

  @BeforeEach
  void setUp() {
    SqliteDatabase db = SqliteDatabase.create(dir.resolve("cache.db"), "db/cache-sqlite.sql");
    db.execute("INSERT INTO processos_kanban VALUES ('ALH.0001/25', '101', '172505417636125', NULL, NULL,"
        + " '2025-07-01 10:00:00')");
    db.execute("INSERT INTO processos_kanban VALUES ('alh.0002/25', 'n/a', NULL, '2512345678', NULL,"
        + " '2025-07-03 10:00:00')");
    db.execute("INSERT INTO processos_kanban VALUES ('  ', NULL, NULL, NULL, NULL, '2025-07-04 10:00:00')");
    catalog = new SqliteProcessCatalog(new JdbcRunner(db.dataSource(), 0));
  }

  @Test
  void recentListsNewestFirstAndSkipsBlankReferences() throws Exception {
    List<ProcessRecord> recent = catalog.recent(10);

    assertEquals(2, recent.size());
    assertEquals("ALH.0002/25", recent.get(0).reference());
    assertNull(recent.get(0).importId());
    assertEquals(Long.valueOf(101), recent.get(1).importId());
  }

  @Test
  void limitIsHonored() throws Exception {
    assertEquals(1, catalog.recent(2).size());
    assertTrue(catalog.recent(0).isEmpty());
  }

  @Test
  void findIsCaseInsensitive() throws Exception {
    ProcessRecord found = catalog.find("Alh.0002/25").orElseThrow();

    assertEquals(Optional.of("2512345678"), found.cachedNumber(DocumentKind.IMPORT_DECLARATION));
    assertEquals(Optional.empty(), catalog.find("ALH.9999/25"));
    assertEquals(Optional.empty(), catalog.find(" "));
  }

  @Test
  void cachedLocatorAnswersFromProcessRow() throws Exception {
    CachedNumberLocator locator = new CachedNumberLocator();
    ProcessRecord process = catalog.find("ALH.0001/25").orElseThrow();

    assertEquals(Optional.of("172505417636125"), locator.locate(process, DocumentKind.CARGO_MANIFEST));
    assertEquals(Optional.empty(), locator.locate(process, DocumentKind.IMPORT_DECLARATION));
    assertTrue(!locator.supports(DocumentKind.TERMINAL_CONTROL));
  }
}
