package br.com.maike.ledger.application.reconcile;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Alias-driven lookups over loosely shaped key/value payloads.
 */
final class PayloadValues {

  private PayloadValues() {
    // Utility
  }

  /**
   * Returns the first candidate whose value is present and non-blank.
   *
   * <p>Candidates containing dots are also resolved as nested paths when no literal key matches.</p>
   */
  static Hit first(Map<String, ?> payload, List<String> candidates) {
    if (payload == null || payload.isEmpty()) {
      return Hit.NONE;
    }
    for (String candidate : candidates) {
      Object value = lookup(payload, candidate);
      if (isPresent(value)) {
        return new Hit(candidate, value);
      }
    }
    return Hit.NONE;
  }

  /**
   * Renders a scalar as text. Integral numbers lose their fractional part; maps and lists are rejected.
   */
  static String text(Object value) {
    if (value == null || value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      return null;
    }
    if (value instanceof Number number) {
      return numberText(number);
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }

  static boolean isScalar(Object value) {
    return value != null && !(value instanceof Map<?, ?>) && !(value instanceof Iterable<?>);
  }

  private static String numberText(Number number) {
    if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
      return null;
    }
    if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
      return null;
    }
    BigDecimal decimal = number instanceof BigDecimal big ? big : new BigDecimal(number.toString());
    BigDecimal stripped = decimal.stripTrailingZeros();
    return stripped.scale() <= 0 ? stripped.toBigInteger().toString() : stripped.toPlainString();
  }

  private static Object lookup(Map<String, ?> payload, String key) {
    if (payload.containsKey(key)) {
      return payload.get(key);
    }
    if (key.indexOf('.') < 0) {
      return null;
    }
    Object current = payload;
    for (String part : key.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(part);
    }
    return current;
  }

  private static boolean isPresent(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof CharSequence text) {
      return !text.toString().isBlank();
    }
    return true;
  }

  /** Matched alias and its raw value. */
  record Hit(String key, Object value) {
    static final Hit NONE = new Hit(null, null);

    boolean found() {
      return key != null;
    }
  }
}
