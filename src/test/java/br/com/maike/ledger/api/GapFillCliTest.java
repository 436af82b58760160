package br.com.maike.ledger.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.testutil.FixedClock;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import br.com.maike.ledger.testutil.RecordingSleeper;
import br.com.maike.ledger.testutil.SqliteDatabase;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GapFillCliTest {
  private static final String MANIFEST = "172505417636125";
  private static final String CACHED = "{\"situacaoCarga\":\"UNLOADED\",\"numero\":\"" + MANIFEST + "\"}";

  @TempDir Path tempDir;

  private String previousExporter;
  private StringWriter buffer;
  private SqliteDatabase ledger;
  private SqliteDatabase cache;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    ledger = SqliteDatabase.create(tempDir.resolve("ledger.db"), "db/ledger-sqlite.sql");
    cache = SqliteDatabase.create(tempDir.resolve("cache.db"), "db/cache-sqlite.sql");
    metrics = new RecordingMetricsPort();
    ledger.execute("INSERT INTO DOCUMENTO_ADUANEIRO (numero_documento, tipo_documento, fonte_dados)"
        + " VALUES ('" + MANIFEST + "', 'CE', 'PORTAL')");
    cache.execute("INSERT INTO ces_cache (numero_ce, json_completo, processo_referencia, atualizado_em)"
        + " VALUES ('" + MANIFEST + "', '" + CACHED + "', 'ALH.0001/25', '2025-06-30 10:00:00')");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void fillsBlankFieldsFromCachedPayload() throws SQLException {
    assertEquals(ExitCode.SUCCESS, run());

    assertTrue(buffer.toString().contains("updated: 1"));
    assertEquals("UNLOADED", text("status_documento"));
    assertEquals("ALH.0001/25", text("processo_referencia"));
    assertEquals(CACHED, text("json_dados_originais"));
    assertEquals("PORTAL", text("fonte_dados"));
    assertEquals(1, metrics.count("gapfill.updated"));
  }

  @Test
  void dryRunLeavesRowUntouched() throws SQLException {
    assertEquals(ExitCode.SUCCESS, run("--dry-run"));

    assertTrue(buffer.toString().contains("[DRY-RUN] Gap-fill summary"));
    assertTrue(buffer.toString().contains("would update: 1"));
    assertNull(text("status_documento"));
    assertNull(text("processo_referencia"));
  }

  @Test
  void helpListsOptions() {
    assertEquals(ExitCode.SUCCESS, GapFillCli.run(new String[] {"--help"}, this::root));
    assertTrue(buffer.toString().contains("Ledger gap-fill"));
  }

  @Test
  void missingLedgerUrlIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS,
        GapFillCli.run(new String[] {"limit=5", "metricsExporter=none"}, this::root));
    assertTrue(buffer.toString().contains("usage: gapfill"));
  }

  private ExitCode run(String... extra) {
    String[] base = {
        "ledgerJdbcUrl=" + ledger.url(),
        "ledgerSchema=",
        "cacheJdbcUrl=" + cache.url(),
        "minPayloadLength=0",
        "metricsExporter=none"};
    String[] args = new String[base.length + extra.length];
    System.arraycopy(base, 0, args, 0, base.length);
    System.arraycopy(extra, 0, args, base.length, extra.length);
    return GapFillCli.run(args, this::root);
  }

  private CompositionRoot root(StorageConfig storage) {
    return new CompositionRoot(
        storage, metrics, new FixedClock(LocalDateTime.of(2025, 7, 1, 9, 0)), new RecordingSleeper());
  }

  private String text(String column) throws SQLException {
    try (Connection connection = ledger.dataSource().getConnection();
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT " + column + " FROM DOCUMENTO_ADUANEIRO")) {
      rs.next();
      return rs.getString(1);
    }
  }
}
