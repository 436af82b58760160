package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.HistoryStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.HistoryRecord;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.Objects;

/**
 * {@link HistoryStore} appending rows to {@code HISTORICO_DOCUMENTO_ADUANEIRO}. Rows are never updated.
 *
 * @since 0.1.0
 */
public final class JdbcHistoryStore implements HistoryStore {
  static final String TABLE = "HISTORICO_DOCUMENTO_ADUANEIRO";

  private final JdbcRunner jdbc;
  private final String sql;

  /**
   * Creates the store.
   *
   * @param jdbc connection runner of the ledger database
   * @param schema validated schema qualifier, blank for none
   */
  public JdbcHistoryStore(JdbcRunner jdbc, String schema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.sql = "INSERT INTO " + JdbcRunner.qualify(schema, TABLE) + " (id_documento, numero_documento,"
        + " tipo_documento, processo_referencia, data_evento, tipo_evento, tipo_evento_descricao, campo_alterado,"
        + " valor_anterior, valor_novo, status_documento, status_documento_codigo, canal_documento,"
        + " situacao_documento, data_registro, data_situacao, data_desembaraco, fonte_dados, api_endpoint,"
        + " json_dados_originais, usuario_ou_sistema, criado_em)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  }

  @Override
  public void append(HistoryRecord record) throws StoreException {
    Objects.requireNonNull(record, "record");
    jdbc.run("history.append", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        Change change = record.change();
        CanonicalFields current = record.current();
        if (record.snapshotId() == null) {
          statement.setNull(1, Types.BIGINT);
        } else {
          statement.setLong(1, record.snapshotId());
        }
        statement.setString(2, record.identity().number());
        statement.setString(3, record.identity().kind().code());
        JdbcRunner.setString(statement, 4, record.processReference());
        JdbcRunner.setTimestamp(statement, 5, record.eventAt());
        statement.setString(6, change.eventKind().storageCode());
        statement.setString(7, change.description());
        statement.setString(8, change.field().column());
        JdbcRunner.setString(statement, 9, change.previousValue());
        statement.setString(10, change.newValue());
        JdbcRunner.setString(statement, 11, current.status());
        JdbcRunner.setString(statement, 12, current.statusCode());
        JdbcRunner.setString(statement, 13, current.channel());
        JdbcRunner.setString(statement, 14, current.situation());
        JdbcRunner.setTimestamp(statement, 15, current.registrationDate());
        JdbcRunner.setTimestamp(statement, 16, current.situationDate());
        JdbcRunner.setTimestamp(statement, 17, current.clearanceDate());
        statement.setString(18, record.source().tag());
        JdbcRunner.setString(statement, 19, record.source().endpoint());
        JdbcRunner.setString(statement, 20, record.rawPayload());
        statement.setString(21, record.actor());
        JdbcRunner.setTimestamp(statement, 22, record.eventAt());
        return statement.executeUpdate();
      }
    });
  }
}
