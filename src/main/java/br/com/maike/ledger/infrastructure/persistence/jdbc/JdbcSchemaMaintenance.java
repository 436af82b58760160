package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.SchemaMaintenance;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.validation.Numbers;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link SchemaMaintenance} for SQL Server using {@code INFORMATION_SCHEMA} and {@code ALTER TABLE}.
 *
 * <p>DDL cannot be parameterized, so table and column names must be plain identifiers from the allowed set.</p>
 *
 * @since 0.1.0
 */
public final class JdbcSchemaMaintenance implements SchemaMaintenance {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");
  private static final Set<String> MAINTAINED_TABLES = Set.of(JdbcSnapshotStore.TABLE, JdbcHistoryStore.TABLE);

  private final JdbcRunner jdbc;
  private final String schema;

  /**
   * Creates the adapter.
   *
   * @param jdbc connection runner of the ledger database
   * @param schema validated schema qualifier, blank for none
   */
  public JdbcSchemaMaintenance(JdbcRunner jdbc, String schema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.schema = schema == null ? "" : schema;
  }

  @Override
  public OptionalInt columnLength(String table, String column) throws StoreException {
    requireMaintained(table, column);
    String sql = "SELECT CHARACTER_MAXIMUM_LENGTH FROM INFORMATION_SCHEMA.COLUMNS"
        + " WHERE TABLE_NAME = ? AND COLUMN_NAME = ?";
    return jdbc.run("schema.columnLength", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, table);
        statement.setString(2, column);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            return OptionalInt.empty();
          }
          int length = rs.getInt(1);
          return rs.wasNull() ? OptionalInt.empty() : OptionalInt.of(length);
        }
      }
    });
  }

  @Override
  public void widenColumn(String table, String column, int length) throws StoreException {
    requireMaintained(table, column);
    int size = (int) Numbers.requireRange("length", length, 1, 8_000);
    String sql = "ALTER TABLE " + JdbcRunner.qualify(schema, table)
        + " ALTER COLUMN " + column + " VARCHAR(" + size + ") NULL";
    jdbc.run("schema.widenColumn", connection -> {
      try (Statement statement = connection.createStatement()) {
        return statement.executeUpdate(sql);
      }
    });
  }

  private static void requireMaintained(String table, String column) {
    if (table == null || !MAINTAINED_TABLES.contains(table)) {
      throw new IllegalArgumentException("table is not maintained: " + table);
    }
    if (column == null || !IDENTIFIER.matcher(column).matches()) {
      throw new IllegalArgumentException("column is not a plain identifier: " + column);
    }
  }
}
