package br.com.maike.ledger.infrastructure.cache;

import br.com.maike.ledger.application.port.ProcessCatalog;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.process.ProcessRecord;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.validation.Strings;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProcessCatalog} over the {@code processos_kanban} table of the local SQLite cache.
 * <p><strong>Contract:</strong> processes come newest first by {@code atualizado_em}. Cached document numbers are
 * carried on each record and serve as the first discovery step. Rows without a reference are skipped.</p>
 *
 * @since 0.1.0
 */
public final class SqliteProcessCatalog implements ProcessCatalog {
  private static final Logger log = LoggerFactory.getLogger(SqliteProcessCatalog.class);
  private static final String COLUMNS = "processo_referencia, id_importacao, numero_ce, numero_di, numero_duimp";

  private final JdbcRunner jdbc;

  /**
   * Creates the catalog.
   *
   * @param jdbc connection runner of the local cache
   */
  public SqliteProcessCatalog(JdbcRunner jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public List<ProcessRecord> recent(int limit) throws StoreException {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM processos_kanban ORDER BY atualizado_em DESC LIMIT ?";
    return jdbc.run("cache.processes.recent", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setInt(1, limit);
        List<ProcessRecord> processes = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
          while (rs.next()) {
            ProcessRecord record = map(rs);
            if (record != null) {
              processes.add(record);
            }
          }
        }
        log.debug("Loaded {} processes from cache", processes.size());
        return processes;
      }
    });
  }

  @Override
  public Optional<ProcessRecord> find(String reference) throws StoreException {
    String normalized = Strings.trimToNull(reference);
    if (normalized == null) {
      return Optional.empty();
    }
    String sql = "SELECT " + COLUMNS + " FROM processos_kanban WHERE UPPER(processo_referencia) = ?"
        + " ORDER BY atualizado_em DESC LIMIT 1";
    return jdbc.run("cache.processes.find", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, normalized.toUpperCase(Locale.ROOT));
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.ofNullable(map(rs)) : Optional.<ProcessRecord>empty();
        }
      }
    });
  }

  private static ProcessRecord map(ResultSet rs) throws SQLException {
    String reference = Strings.trimToNull(rs.getString("processo_referencia"));
    if (reference == null) {
      return null;
    }
    return new ProcessRecord(
        reference,
        importId(rs.getString("id_importacao")),
        rs.getString("numero_ce"),
        rs.getString("numero_di"),
        rs.getString("numero_duimp"));
  }

  // The kanban sync stores ids as text; anything non-numeric is treated as absent.
  private static Long importId(String raw) {
    String value = Strings.trimToNull(raw);
    if (value == null) {
      return null;
    }
    try {
      return Long.valueOf(value);
    } catch (NumberFormatException ex) {
      log.debug("Ignoring non-numeric import id '{}'", value);
      return null;
    }
  }
}
