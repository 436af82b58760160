package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.BulkDocumentSource;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DateWindow;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.UnifiedDeclarationPayload;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enumerates unified import declarations registered inside a window, with the consolidated risk channel.
 *
 * @since 0.1.0
 */
public final class DuimpBulkSource implements BulkDocumentSource {
  /** Origin marker embedded in raw payloads of migrated unified declarations. */
  public static final String ORIGIN = "DUIMP_DB_MIGRATION";

  private final JdbcRunner jdbc;
  private final String sql;

  /**
   * Creates the source.
   *
   * @param jdbc connection runner reaching the unified declaration database
   * @param duimpSchema qualifier of the unified declaration tables
   */
  public DuimpBulkSource(JdbcRunner jdbc, String duimpSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.sql = "SELECT d.numero_processo, d.id_processo_importacao, d.numero, d.ultima_situacao,"
        + " d.data_ultimo_evento, drar.canal_consolidado, d.data_registro, d.versao"
        + " FROM " + JdbcRunner.qualify(duimpSchema, "duimp") + " d"
        + " LEFT JOIN " + JdbcRunner.qualify(duimpSchema, "duimp_resultado_analise_risco") + " drar"
        + " ON d.duimp_id = drar.duimp_id"
        + " WHERE d.numero IS NOT NULL AND d.data_registro >= ? AND d.data_registro < ?"
        + " ORDER BY d.data_registro DESC";
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.UNIFIED_IMPORT_DECLARATION;
  }

  @Override
  public String originMarker() {
    return ORIGIN;
  }

  @Override
  public List<Row> enumerate(DateWindow window, int limit) throws StoreException {
    Objects.requireNonNull(window, "window");
    return jdbc.run("duimp.enumerate", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        if (limit > 0) {
          statement.setMaxRows(limit);
        }
        statement.setTimestamp(1, Timestamp.valueOf(window.startInclusive()));
        statement.setTimestamp(2, Timestamp.valueOf(window.endExclusive()));
        List<Row> rows = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
          while (rs.next()) {
            Row row = map(rs);
            if (row != null) {
              rows.add(row);
            }
          }
        }
        return rows;
      }
    });
  }

  private static Row map(ResultSet rs) throws SQLException {
    String number = SourceRows.text(rs, "numero");
    if (number == null) {
      return null;
    }
    String status = SourceRows.text(rs, "ultima_situacao");
    LocalDateTime situationDate = SourceRows.time(rs, "data_ultimo_evento");
    String channel = SourceRows.text(rs, "canal_consolidado");
    LocalDateTime registrationDate = SourceRows.time(rs, "data_registro");
    String version = SourceRows.version(rs, "versao");
    String processNumber = SourceRows.text(rs, "numero_processo");
    String processReference = SourceRows.processReference(
        processNumber, SourceRows.longValue(rs, "id_processo_importacao"));

    UnifiedDeclarationPayload payload = new UnifiedDeclarationPayload(
        number, version, status, status, channel, registrationDate, situationDate);

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("numero", number);
    SourceRows.put(raw, "situacao", status);
    SourceRows.put(raw, "ultimaSituacao", status);
    SourceRows.put(raw, "ultimaSituacaoData", situationDate);
    SourceRows.put(raw, "canalConsolidado", channel);
    SourceRows.put(raw, "dataRegistro", registrationDate);
    SourceRows.put(raw, "versaoDocumento", version);
    SourceRows.put(raw, "numeroProcesso", processNumber);

    return new Row(number, processReference, registrationDate, payload, raw);
  }
}
