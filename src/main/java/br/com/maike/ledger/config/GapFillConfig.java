package br.com.maike.ledger.config;

import br.com.maike.ledger.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the gap-fill run over incomplete snapshot rows.
 *
 * @param limit maximum rows examined
 * @param dryRun when {@code true} planned fills are only logged
 * @param minPayloadLength payloads shorter than this are supplemented from the authoritative store
 * @since 0.1.0
 */
public record GapFillConfig(int limit, boolean dryRun, int minPayloadLength) {

  public GapFillConfig {
    Numbers.requireRange("limit", limit, 1, 100_000);
    Numbers.requireRange("minPayloadLength", minPayloadLength, 0, 1_000_000);
  }

  /**
   * Returns the defaults: 500 rows, payloads under 400 characters supplemented.
   *
   * @return default configuration
   */
  public static GapFillConfig defaults() {
    return new GapFillConfig(500, false, 400);
  }

  /**
   * Parses gap-fill settings.
   *
   * @param options effective configuration
   * @return gap-fill settings
   */
  public static GapFillConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    GapFillConfig defaults = defaults();
    return new GapFillConfig(
        ConfigValues.intValue(options, "limit", defaults.limit(), 1, 100_000),
        ConfigValues.bool(options, "dryRun", false),
        ConfigValues.intValue(options, "minPayloadLength", defaults.minPayloadLength(), 0, 1_000_000));
  }

  /**
   * Returns a copy with a different dry-run flag.
   *
   * @param value new flag
   * @return updated configuration
   */
  public GapFillConfig withDryRun(boolean value) {
    return new GapFillConfig(limit, value, minPayloadLength);
  }
}
