package br.com.maike.ledger.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by ledger CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid run limits, batch sizes and retry budgets before any
 * connection pool is opened.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., rows, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; blank input yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed and validated value
   * @throws IllegalArgumentException when the text is not an integer or lies outside the range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
