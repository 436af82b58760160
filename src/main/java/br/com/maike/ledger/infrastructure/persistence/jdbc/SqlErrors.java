package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.StoreException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.util.Locale;

/**
 * Classifies {@link SQLException}s into {@link StoreException} kinds.
 *
 * <ul>
 *   <li>TIMEOUT: {@link SQLTimeoutException}, SQLState {@code HYT00}, or a timeout marker in the message.</li>
 *   <li>CONFLICT: SQLState class {@code 23}, SQL Server errors 2601/2627, or a unique-constraint message.</li>
 *   <li>FAILURE: everything else.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class SqlErrors {
  private static final int SQLSERVER_DUPLICATE_INDEX = 2601;
  private static final int SQLSERVER_DUPLICATE_KEY = 2627;

  private SqlErrors() {
    // Utility
  }

  /**
   * Converts a failed statement into a store failure.
   *
   * @param operation label naming the failed operation
   * @param ex driver exception
   * @return classified store exception carrying {@code ex} as cause
   */
  public static StoreException classify(String operation, SQLException ex) {
    return new StoreException(kindOf(ex), operation + " failed: " + ex.getMessage(), ex);
  }

  /**
   * Converts a failure to borrow a connection.
   *
   * @param operation label naming the failed operation
   * @param ex driver or pool exception
   * @return store exception of kind {@code UNAVAILABLE}
   */
  public static StoreException unavailable(String operation, SQLException ex) {
    return new StoreException(StoreException.Kind.UNAVAILABLE,
        operation + ": no connection available: " + ex.getMessage(), ex);
  }

  static StoreException.Kind kindOf(SQLException ex) {
    for (SQLException current = ex; current != null; current = current.getNextException()) {
      if (isTimeout(current)) {
        return StoreException.Kind.TIMEOUT;
      }
      if (isConflict(current)) {
        return StoreException.Kind.CONFLICT;
      }
      if (current.getNextException() == current) {
        break;
      }
    }
    return StoreException.Kind.FAILURE;
  }

  private static boolean isTimeout(SQLException ex) {
    if (ex instanceof SQLTimeoutException || "HYT00".equals(ex.getSQLState())) {
      return true;
    }
    String message = lower(ex.getMessage());
    return message.contains("timeout") || message.contains("timed out") || message.contains("etimeout");
  }

  private static boolean isConflict(SQLException ex) {
    if (ex instanceof SQLIntegrityConstraintViolationException) {
      return true;
    }
    String state = ex.getSQLState();
    if (state != null && state.startsWith("23")) {
      return true;
    }
    int code = ex.getErrorCode();
    if (code == SQLSERVER_DUPLICATE_INDEX || code == SQLSERVER_DUPLICATE_KEY) {
      return true;
    }
    String message = lower(ex.getMessage());
    return message.contains("unique constraint") || message.contains("duplicate key");
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
