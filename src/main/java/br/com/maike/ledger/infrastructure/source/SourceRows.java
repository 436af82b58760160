package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.validation.Strings;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/** Column readers shared by the replicated-table adapters. */
final class SourceRows {
  private SourceRows() {
    // Utility
  }

  static String text(ResultSet rs, String column) throws SQLException {
    return Strings.trimToNull(rs.getString(column));
  }

  static LocalDateTime time(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toLocalDateTime().truncatedTo(ChronoUnit.SECONDS);
  }

  static Long longValue(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
    return rs.getBigDecimal(column);
  }

  /** Reads a version column as text; integral numbers lose any fractional part. */
  static String version(ResultSet rs, String column) throws SQLException {
    Object value = rs.getObject(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return Long.toString(number.longValue());
    }
    String text = Strings.trimToNull(value.toString());
    if (text != null && text.matches("\\d+\\.0+")) {
      return text.substring(0, text.indexOf('.'));
    }
    return text;
  }

  /** Process reference, falling back to the import id when the process number is unknown. */
  static String processReference(String processNumber, Long importId) {
    String reference = Strings.trimToNull(processNumber);
    if (reference != null) {
      return reference;
    }
    return importId == null ? null : "ID:" + importId;
  }

  static void put(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }
}
