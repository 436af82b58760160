package br.com.maike.ledger.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.config.CompositionRoot;
import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.testutil.FixedClock;
import br.com.maike.ledger.testutil.RecordingMetricsPort;
import br.com.maike.ledger.testutil.RecordingSleeper;
import br.com.maike.ledger.testutil.SqliteDatabase;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IngestCliTest {
  private static final String MANIFEST = "172505417636125";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private String previousExporter;
  private StringWriter buffer;
  private SqliteDatabase db;
  private FixedClock clock;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    previousExporter = System.getProperty("otel.metrics.exporter");
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    db = SqliteDatabase.create(tempDir.resolve("ledger.db"), "db/ledger-sqlite.sql");
    clock = new FixedClock(LocalDateTime.of(2025, 7, 1, 8, 0));
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void ingestCreatesThenRecordsStatusChange() throws IOException, SQLException {
    Path first = payload("first.json", "{\"situacaoCarga\":\"UNLOADED\"}");
    Path second = payload("second.json", "[{\"situacaoCarga\":\"LINKED_TO_CLEARANCE_DOCUMENT\"}]");

    assertEquals(ExitCode.SUCCESS, run(first));
    assertTrue(buffer.toString().contains("Ingest CREATED"));
    clock.advance(Duration.ofMinutes(30));
    assertEquals(ExitCode.SUCCESS, run(second));

    String output = buffer.toString();
    assertTrue(output.contains("Ingest UPDATED"));
    assertTrue(output.contains("history rows: 1"));
    assertEquals(1, count("SELECT COUNT(*) FROM DOCUMENTO_ADUANEIRO"));
    assertEquals(1, count("SELECT COUNT(*) FROM HISTORICO_DOCUMENTO_ADUANEIRO"
        + " WHERE tipo_evento = 'MUDANCA_STATUS' AND fonte_dados = 'REPLAY'"));
    assertEquals(1, metrics.count("ledger.observe.created"));
  }

  @Test
  void missingPayloadArgumentReturnsUsage() {
    ExitCode code = IngestCli.run(new String[] {
        "ledgerJdbcUrl=" + db.url(), "kind=CE", "metricsExporter=none"}, this::root);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: ingest"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("payload is required"));
    assertTrue(logged);
  }

  @Test
  void nonObjectPayloadIsRejected() throws IOException {
    Path file = payload("garbage.json", "not json at all");

    assertEquals(ExitCode.INVALID_ARGS, run(file));
    assertEquals(0, metrics.count("ledger.observe.created"));
  }

  @Test
  void unreadablePayloadIsIoError() {
    assertEquals(ExitCode.IO_ERROR, run(tempDir.resolve("absent.json")));
  }

  private ExitCode run(Path payloadFile) {
    return IngestCli.run(new String[] {
        "ledgerJdbcUrl=" + db.url(),
        "ledgerSchema=",
        "kind=CE",
        "number=" + MANIFEST,
        "payload=" + payloadFile,
        "source=REPLAY",
        "metricsExporter=none"}, this::root);
  }

  private CompositionRoot root(StorageConfig storage) {
    return new CompositionRoot(storage, metrics, clock, new RecordingSleeper());
  }

  private Path payload(String name, String json) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, json);
    return file;
  }

  private int count(String sql) throws SQLException {
    try (Connection connection = db.dataSource().getConnection();
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
