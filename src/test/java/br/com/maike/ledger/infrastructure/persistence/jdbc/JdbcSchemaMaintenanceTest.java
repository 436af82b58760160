package br.com.maike.ledger.infrastructure.persistence.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.testutil.SqliteDatabase;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcSchemaMaintenanceTest {
  @TempDir
  Path dir;

  private JdbcSchemaMaintenance maintenance;

  @BeforeEach
  void setUp() {
    SqliteDatabase db = SqliteDatabase.create(dir.resolve("ledger.db"), "db/ledger-sqlite.sql");
    maintenance = new JdbcSchemaMaintenance(new JdbcRunner(db.dataSource(), 0), "");
  }

  @Test
  void rejectsTablesOutsideTheLedger() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> maintenance.columnLength("VALOR_MERCADORIA", "moeda"));
    assertEquals("table is not maintained: VALOR_MERCADORIA", ex.getMessage());
  }

  @Test
  void rejectsColumnThatIsNotAnIdentifier() {
    assertThrows(IllegalArgumentException.class,
        () -> maintenance.widenColumn(JdbcSnapshotStore.TABLE, "status; DROP TABLE x", 100));
  }

  @Test
  void rejectsWidthOutsideVarcharRange() {
    assertThrows(IllegalArgumentException.class,
        () -> maintenance.widenColumn(JdbcHistoryStore.TABLE, "valor_novo", 9_000));
  }

  @Test
  void catalogQueryFailureIsClassified() {
    StoreException ex = assertThrows(StoreException.class,
        () -> maintenance.columnLength(JdbcSnapshotStore.TABLE, "status_documento"));
    assertEquals(StoreException.Kind.FAILURE, ex.kind());
  }
}
