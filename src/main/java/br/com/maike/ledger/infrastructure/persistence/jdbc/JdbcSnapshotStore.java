package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SnapshotStore} over the {@code DOCUMENTO_ADUANEIRO} table.
 * <p><strong>Contract:</strong> the table carries a unique index over
 * {@code (tipo_documento, numero_documento, version-or-empty)}; a colliding insert surfaces as
 * {@link StoreException.Kind#CONFLICT}. Updates coalesce so a {@code null} argument keeps the stored value, and
 * a stored version is never replaced.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; state lives in the database.</p>
 *
 * @since 0.1.0
 */
public final class JdbcSnapshotStore implements SnapshotStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);
  static final String TABLE = "DOCUMENTO_ADUANEIRO";

  private static final String COLUMNS = "id_documento, numero_documento, tipo_documento, versao_documento,"
      + " processo_referencia, status_documento, status_documento_codigo, canal_documento, situacao_documento,"
      + " data_registro, data_situacao, data_desembaraco, fonte_dados, json_dados_originais,"
      + " ultima_sincronizacao, criado_em, atualizado_em";

  private final JdbcRunner jdbc;
  private final String table;

  /**
   * Creates the store.
   *
   * @param jdbc connection runner of the ledger database
   * @param schema validated schema qualifier, blank for none
   */
  public JdbcSnapshotStore(JdbcRunner jdbc, String schema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.table = JdbcRunner.qualify(schema, TABLE);
  }

  @Override
  public Optional<Snapshot> find(DocumentIdentity identity) throws StoreException {
    Objects.requireNonNull(identity, "identity");
    String versionClause = identity.version() == null ? "versao_documento IS NULL" : "versao_documento = ?";
    String sql = "SELECT " + COLUMNS + " FROM " + table
        + " WHERE tipo_documento = ? AND numero_documento = ? AND " + versionClause
        + " ORDER BY atualizado_em DESC, id_documento DESC";
    return jdbc.run("snapshot.find", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(1);
        statement.setString(1, identity.kind().code());
        statement.setString(2, identity.number());
        if (identity.version() != null) {
          statement.setString(3, identity.version());
        }
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.of(map(rs)) : Optional.<Snapshot>empty();
        }
      }
    });
  }

  @Override
  public void insert(Snapshot snapshot) throws StoreException {
    Objects.requireNonNull(snapshot, "snapshot");
    String sql = "INSERT INTO " + table + " (numero_documento, tipo_documento, versao_documento,"
        + " processo_referencia, status_documento, status_documento_codigo, canal_documento, situacao_documento,"
        + " data_registro, data_situacao, data_desembaraco, fonte_dados, json_dados_originais,"
        + " ultima_sincronizacao, criado_em, atualizado_em)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    jdbc.run("snapshot.insert", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        DocumentIdentity identity = snapshot.identity();
        CanonicalFields fields = snapshot.fields();
        statement.setString(1, identity.number());
        statement.setString(2, identity.kind().code());
        JdbcRunner.setString(statement, 3, identity.version());
        JdbcRunner.setString(statement, 4, snapshot.processReference());
        JdbcRunner.setString(statement, 5, fields.status());
        JdbcRunner.setString(statement, 6, fields.statusCode());
        JdbcRunner.setString(statement, 7, fields.channel());
        JdbcRunner.setString(statement, 8, fields.situation());
        JdbcRunner.setTimestamp(statement, 9, fields.registrationDate());
        JdbcRunner.setTimestamp(statement, 10, fields.situationDate());
        JdbcRunner.setTimestamp(statement, 11, fields.clearanceDate());
        JdbcRunner.setString(statement, 12, snapshot.sourceTag());
        JdbcRunner.setString(statement, 13, snapshot.rawPayload());
        JdbcRunner.setTimestamp(statement, 14, snapshot.syncedAt());
        JdbcRunner.setTimestamp(statement, 15, snapshot.createdAt());
        JdbcRunner.setTimestamp(statement, 16, snapshot.updatedAt());
        return statement.executeUpdate();
      }
    });
  }

  @Override
  public void update(long id, SnapshotUpdate update) throws StoreException {
    Objects.requireNonNull(update, "update");
    Objects.requireNonNull(update.at(), "update.at");
    String sql = "UPDATE " + table + " SET"
        + " status_documento = COALESCE(?, status_documento),"
        + " status_documento_codigo = COALESCE(?, status_documento_codigo),"
        + " canal_documento = COALESCE(?, canal_documento),"
        + " situacao_documento = COALESCE(?, situacao_documento),"
        + " data_registro = COALESCE(?, data_registro),"
        + " data_situacao = COALESCE(?, data_situacao),"
        + " data_desembaraco = COALESCE(?, data_desembaraco),"
        + " processo_referencia = COALESCE(?, processo_referencia),"
        + " versao_documento = COALESCE(versao_documento, ?),"
        + " json_dados_originais = COALESCE(?, json_dados_originais),"
        + " fonte_dados = COALESCE(?, fonte_dados),"
        + " ultima_sincronizacao = ?,"
        + " atualizado_em = ?"
        + " WHERE id_documento = ?";
    int rows = jdbc.run("snapshot.update", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        CanonicalFields fields = update.fields() == null ? CanonicalFields.EMPTY : update.fields();
        JdbcRunner.setString(statement, 1, fields.status());
        JdbcRunner.setString(statement, 2, fields.statusCode());
        JdbcRunner.setString(statement, 3, fields.channel());
        JdbcRunner.setString(statement, 4, fields.situation());
        JdbcRunner.setTimestamp(statement, 5, fields.registrationDate());
        JdbcRunner.setTimestamp(statement, 6, fields.situationDate());
        JdbcRunner.setTimestamp(statement, 7, fields.clearanceDate());
        JdbcRunner.setString(statement, 8, update.processReference());
        JdbcRunner.setString(statement, 9, update.version());
        JdbcRunner.setString(statement, 10, update.rawPayload());
        JdbcRunner.setString(statement, 11, update.sourceTag());
        JdbcRunner.setTimestamp(statement, 12, update.at());
        JdbcRunner.setTimestamp(statement, 13, update.at());
        statement.setLong(14, id);
        return statement.executeUpdate();
      }
    });
    if (rows == 0) {
      throw new StoreException(StoreException.Kind.FAILURE, "snapshot row " + id + " no longer exists");
    }
  }

  @Override
  public Set<String> existingNumbers(DocumentKind kind, Collection<String> numbers) throws StoreException {
    Objects.requireNonNull(kind, "kind");
    if (numbers == null || numbers.isEmpty()) {
      return Collections.emptySet();
    }
    List<String> batch = new ArrayList<>(new LinkedHashSet<>(numbers));
    String sql = "SELECT DISTINCT numero_documento FROM " + table
        + " WHERE tipo_documento = ? AND numero_documento IN (" + placeholders(batch.size()) + ")";
    return jdbc.run("snapshot.existingNumbers", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, kind.code());
        for (int i = 0; i < batch.size(); i++) {
          statement.setString(i + 2, batch.get(i));
        }
        Set<String> present = new LinkedHashSet<>();
        try (ResultSet rs = statement.executeQuery()) {
          while (rs.next()) {
            present.add(rs.getString(1));
          }
        }
        return present;
      }
    });
  }

  @Override
  public List<Snapshot> findIncomplete(int limit) throws StoreException {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE"
        + " processo_referencia IS NULL OR LTRIM(RTRIM(processo_referencia)) = ''"
        + " OR status_documento IS NULL OR LTRIM(RTRIM(status_documento)) = ''"
        + " OR status_documento_codigo IS NULL OR LTRIM(RTRIM(status_documento_codigo)) = ''"
        + " OR canal_documento IS NULL OR LTRIM(RTRIM(canal_documento)) = ''"
        + " OR situacao_documento IS NULL OR LTRIM(RTRIM(situacao_documento)) = ''"
        + " OR data_registro IS NULL OR data_situacao IS NULL OR data_desembaraco IS NULL"
        + " OR json_dados_originais IS NULL"
        + " OR (versao_documento IS NULL AND tipo_documento IN (?, ?))"
        + " ORDER BY atualizado_em DESC, id_documento DESC";
    return jdbc.run("snapshot.findIncomplete", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(limit);
        statement.setString(1, DocumentKind.IMPORT_DECLARATION.code());
        statement.setString(2, DocumentKind.UNIFIED_IMPORT_DECLARATION.code());
        List<Snapshot> rows = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
          while (rs.next() && rows.size() < limit) {
            Snapshot snapshot = mapOrNull(rs);
            if (snapshot != null) {
              rows.add(snapshot);
            }
          }
        }
        return rows;
      }
    });
  }

  @Override
  public boolean versionTaken(DocumentKind kind, String number, String version, long excludingId)
      throws StoreException {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(number, "number");
    Objects.requireNonNull(version, "version");
    String sql = "SELECT id_documento FROM " + table
        + " WHERE tipo_documento = ? AND numero_documento = ? AND versao_documento = ? AND id_documento <> ?";
    return jdbc.run("snapshot.versionTaken", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(1);
        statement.setString(1, kind.code());
        statement.setString(2, number);
        statement.setString(3, version);
        statement.setLong(4, excludingId);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next();
        }
      }
    });
  }

  static String placeholders(int count) {
    StringBuilder builder = new StringBuilder(count * 3);
    for (int i = 0; i < count; i++) {
      builder.append(i == 0 ? "?" : ", ?");
    }
    return builder.toString();
  }

  // Rows written by older tools may carry an unknown kind or a blank number; those cannot be gap-filled.
  private static Snapshot mapOrNull(ResultSet rs) throws SQLException {
    String number = rs.getString("numero_documento");
    String code = rs.getString("tipo_documento");
    if (number == null || number.isBlank() || kindOrNull(code) == null) {
      log.debug("Skipping snapshot row {} with kind '{}'", rs.getLong("id_documento"), code);
      return null;
    }
    return map(rs);
  }

  private static DocumentKind kindOrNull(String code) {
    if (code == null || code.isBlank()) {
      return null;
    }
    try {
      return DocumentKind.fromCode(code);
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  private static Snapshot map(ResultSet rs) throws SQLException {
    long id = rs.getLong("id_documento");
    DocumentKind kind = kindOrNull(rs.getString("tipo_documento"));
    if (kind == null) {
      throw new SQLException("unknown tipo_documento in row " + id);
    }
    DocumentIdentity identity = new DocumentIdentity(
        rs.getString("numero_documento"), kind, rs.getString("versao_documento"));
    CanonicalFields fields = new CanonicalFields(
        rs.getString("status_documento"),
        rs.getString("status_documento_codigo"),
        rs.getString("canal_documento"),
        rs.getString("situacao_documento"),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("data_registro")),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("data_situacao")),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("data_desembaraco")));
    return new Snapshot(
        id,
        identity,
        fields,
        rs.getString("processo_referencia"),
        rs.getString("json_dados_originais"),
        rs.getString("fonte_dados"),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("ultima_sincronizacao")),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("criado_em")),
        JdbcRunner.toLocalDateTime(rs.getTimestamp("atualizado_em")));
  }
}
