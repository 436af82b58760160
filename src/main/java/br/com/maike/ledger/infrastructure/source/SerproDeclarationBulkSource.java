package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.BulkDocumentSource;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DateWindow;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.ImportDeclarationPayload;
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
 * <strong>What:</strong> Enumerates import declarations registered inside a window from the replicated declaration
 * history tables.
 * <p><strong>Contract:</strong> the window applies to the registration time, or to the situation time when the
 * declaration was never registered. Rows come newest first; duplicates across rectifications are left to the
 * caller.</p>
 *
 * @since 0.1.0
 */
public final class SerproDeclarationBulkSource implements BulkDocumentSource {
  /** Origin marker embedded in raw payloads of migrated declarations. */
  public static final String ORIGIN = "SERPRO_MIGRATION";

  private final JdbcRunner jdbc;
  private final String sql;

  /**
   * Creates the source.
   *
   * @param jdbc connection runner reaching the replicated tables
   * @param serproSchema qualifier of the replicated declaration tables
   * @param ledgerSchema qualifier of the ledger tables holding {@code PROCESSO_IMPORTACAO}
   */
  public SerproDeclarationBulkSource(JdbcRunner jdbc, String serproSchema, String ledgerSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.sql = "SELECT p.numero_processo, diH.idImportacao, ddg.numeroDi, ddg.situacaoDi, ddg.dataHoraSituacaoDi,"
        + " ddg.sequencialRetificacao, diDesp.canalSelecaoParametrizada, diDesp.dataHoraRegistro,"
        + " diDesp.dataHoraDesembaraco, diDesp.dataHoraAutorizacaoEntrega"
        + " FROM " + JdbcRunner.qualify(serproSchema, "Hi_Historico_Di") + " diH"
        + " JOIN " + JdbcRunner.qualify(serproSchema, "Di_Root_Declaracao_Importacao") + " diRoot"
        + " ON diH.diId = diRoot.dadosDiId"
        + " JOIN " + JdbcRunner.qualify(serproSchema, "Di_Dados_Gerais") + " ddg"
        + " ON diRoot.dadosGeraisId = ddg.dadosGeraisId"
        + " LEFT JOIN " + JdbcRunner.qualify(serproSchema, "Di_Dados_Despacho") + " diDesp"
        + " ON diRoot.dadosDespachoId = diDesp.dadosDespachoId"
        + " LEFT JOIN " + JdbcRunner.qualify(ledgerSchema, "PROCESSO_IMPORTACAO") + " p"
        + " ON p.id_importacao = diH.idImportacao"
        + " WHERE ddg.numeroDi IS NOT NULL AND ("
        + "(diDesp.dataHoraRegistro >= ? AND diDesp.dataHoraRegistro < ?)"
        + " OR (diDesp.dataHoraRegistro IS NULL AND ddg.dataHoraSituacaoDi >= ? AND ddg.dataHoraSituacaoDi < ?))"
        + " ORDER BY COALESCE(diDesp.dataHoraRegistro, ddg.dataHoraSituacaoDi) DESC";
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.IMPORT_DECLARATION;
  }

  @Override
  public String originMarker() {
    return ORIGIN;
  }

  @Override
  public List<Row> enumerate(DateWindow window, int limit) throws StoreException {
    Objects.requireNonNull(window, "window");
    return jdbc.run("serpro.declaration.enumerate", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        if (limit > 0) {
          statement.setMaxRows(limit);
        }
        Timestamp from = Timestamp.valueOf(window.startInclusive());
        Timestamp to = Timestamp.valueOf(window.endExclusive());
        statement.setTimestamp(1, from);
        statement.setTimestamp(2, to);
        statement.setTimestamp(3, from);
        statement.setTimestamp(4, to);
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
    String number = SourceRows.text(rs, "numeroDi");
    if (number == null) {
      return null;
    }
    String status = SourceRows.text(rs, "situacaoDi");
    LocalDateTime situationDate = SourceRows.time(rs, "dataHoraSituacaoDi");
    String retification = SourceRows.version(rs, "sequencialRetificacao");
    String channel = SourceRows.text(rs, "canalSelecaoParametrizada");
    LocalDateTime registrationDate = SourceRows.time(rs, "dataHoraRegistro");
    LocalDateTime clearanceDate = SourceRows.time(rs, "dataHoraDesembaraco");
    LocalDateTime deliveryDate = SourceRows.time(rs, "dataHoraAutorizacaoEntrega");
    String processReference = SourceRows.processReference(
        rs.getString("numero_processo"), SourceRows.longValue(rs, "idImportacao"));

    ImportDeclarationPayload payload = new ImportDeclarationPayload(
        number, retification, status, null, channel, registrationDate, situationDate, clearanceDate);

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("numero", number);
    raw.put("numeroDi", number);
    SourceRows.put(raw, "situacaoDi", status);
    SourceRows.put(raw, "dataHoraSituacaoDi", situationDate);
    SourceRows.put(raw, "canalSelecaoParametrizada", channel);
    SourceRows.put(raw, "dataHoraRegistro", registrationDate);
    SourceRows.put(raw, "dataHoraDesembaraco", clearanceDate);
    SourceRows.put(raw, "dataHoraAutorizacaoEntrega", deliveryDate);
    SourceRows.put(raw, "sequencialRetificacao", retification);

    LocalDateTime ordering = registrationDate != null ? registrationDate : situationDate;
    return new Row(number, processReference, ordering, payload, raw);
  }
}
