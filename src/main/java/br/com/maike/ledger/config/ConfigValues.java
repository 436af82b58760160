package br.com.maike.ledger.config;

import br.com.maike.ledger.validation.Numbers;
import br.com.maike.ledger.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsing helpers shared by the {@code fromMap} factories of the config records.
 */
final class ConfigValues {

  private ConfigValues() {
    // Utility
  }

  static Optional<String> optionalString(Map<String, String> options, String key) {
    return Optional.ofNullable(Strings.trimToNull(options.get(key)));
  }

  static String string(Map<String, String> options, String key, String defaultValue) {
    return optionalString(options, key).orElse(defaultValue);
  }

  static int intValue(Map<String, String> options, String key, int defaultValue, int min, int max) {
    return Numbers.parseInt(key, options.get(key), defaultValue, min, max);
  }

  static long millis(Map<String, String> options, String key, long defaultValue, long max) {
    String raw = Strings.trimToNull(options.get(key));
    if (raw == null) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number of milliseconds (was '" + raw + "')", ex);
    }
    return Numbers.requireRange(key, parsed, 0, max);
  }

  static boolean bool(Map<String, String> options, String key, boolean defaultValue) {
    String raw = Strings.trimToNull(options.get(key));
    if (raw == null) {
      return defaultValue;
    }
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }
}
