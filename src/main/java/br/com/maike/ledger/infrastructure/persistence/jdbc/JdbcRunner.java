package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.validation.Numbers;
import br.com.maike.ledger.validation.Strings;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * <strong>What:</strong> Borrows pooled connections and turns driver failures into {@link StoreException}s.
 * <p><strong>Contract:</strong> a failure to obtain a connection is {@code UNAVAILABLE}; a failure while the
 * work runs is classified by {@link SqlErrors}. Statements prepared through {@link #prepare} carry the
 * configured query timeout.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; every call borrows its own connection.</p>
 *
 * @since 0.1.0
 */
public final class JdbcRunner {
  private final DataSource dataSource;
  private final int queryTimeoutSeconds;

  /**
   * Creates a runner.
   *
   * @param dataSource pooled data source
   * @param queryTimeoutSeconds per-statement timeout, {@code 0} for the driver default
   */
  public JdbcRunner(DataSource dataSource, int queryTimeoutSeconds) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.queryTimeoutSeconds = (int) Numbers.requireRange("queryTimeoutSeconds", queryTimeoutSeconds, 0, 3_600);
  }

  /** Unit of JDBC work run on a borrowed connection. */
  @FunctionalInterface
  public interface Work<T> {
    T run(Connection connection) throws SQLException;
  }

  /**
   * Runs work on a borrowed connection.
   *
   * @param operation label used in failure messages
   * @param work JDBC work
   * @param <T> result type
   * @return work result
   * @throws StoreException classified failure
   */
  public <T> T run(String operation, Work<T> work) throws StoreException {
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException ex) {
      throw SqlErrors.unavailable(operation, ex);
    }
    try (connection) {
      return work.run(connection);
    } catch (SQLException ex) {
      throw SqlErrors.classify(operation, ex);
    }
  }

  /**
   * Prepares a statement with the configured timeout.
   *
   * @param connection borrowed connection
   * @param sql parameterized SQL text
   * @return prepared statement; caller closes it
   * @throws SQLException when preparation fails
   */
  public PreparedStatement prepare(Connection connection, String sql) throws SQLException {
    PreparedStatement statement = connection.prepareStatement(sql);
    if (queryTimeoutSeconds > 0) {
      statement.setQueryTimeout(queryTimeoutSeconds);
    }
    return statement;
  }

  /**
   * Qualifies a table name with a validated schema prefix.
   *
   * @param schema qualifier such as {@code dbo} or {@code Serpro.dbo}; blank for none
   * @param table table name
   * @return qualified name
   */
  public static String qualify(String schema, String table) {
    if (schema == null || schema.isBlank()) {
      return table;
    }
    return Strings.requireSqlQualifier("schema", schema) + "." + table;
  }

  /**
   * Binds a string parameter, or SQL {@code NULL}.
   *
   * @param statement target statement
   * @param index one-based parameter index
   * @param value value or {@code null}
   * @throws SQLException when binding fails
   */
  public static void setString(PreparedStatement statement, int index, String value) throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.VARCHAR);
    } else {
      statement.setString(index, value);
    }
  }

  /**
   * Binds a wall-clock timestamp parameter, or SQL {@code NULL}.
   *
   * @param statement target statement
   * @param index one-based parameter index
   * @param value value or {@code null}
   * @throws SQLException when binding fails
   */
  public static void setTimestamp(PreparedStatement statement, int index, LocalDateTime value) throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.TIMESTAMP);
    } else {
      statement.setTimestamp(index, Timestamp.valueOf(value));
    }
  }

  static LocalDateTime toLocalDateTime(Timestamp value) {
    return value == null ? null : value.toLocalDateTime();
  }
}
