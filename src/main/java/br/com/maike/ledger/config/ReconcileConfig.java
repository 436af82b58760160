package br.com.maike.ledger.config;

import br.com.maike.ledger.validation.Numbers;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the per-process reconciliation run.
 *
 * @param limit maximum processes read from the cache when no single process is given
 * @param process single shipment reference to reconcile, if any
 * @param documents whether document snapshots are reconciled
 * @param financials whether declaration values and duties are written
 * @param dryRun when {@code true} only discovery runs
 * @param lookupAttempts attempts per authoritative lookup on timeouts
 * @param backoffMillis first retry delay
 * @param schemaSelfHeal whether narrow status-code columns are widened before the run
 * @since 0.1.0
 */
public record ReconcileConfig(
    int limit,
    Optional<String> process,
    boolean documents,
    boolean financials,
    boolean dryRun,
    int lookupAttempts,
    long backoffMillis,
    boolean schemaSelfHeal) {

  public ReconcileConfig {
    Numbers.requireRange("limit", limit, 1, 100_000);
    process = Objects.requireNonNullElse(process, Optional.<String>empty())
        .map(String::trim)
        .filter(value -> !value.isEmpty());
    if (!documents && !financials) {
      throw new IllegalArgumentException("documents and financials cannot both be disabled");
    }
    Numbers.requireRange("lookupAttempts", lookupAttempts, 1, 10);
    Numbers.requireRange("backoffMillis", backoffMillis, 0, 60_000);
  }

  /**
   * Returns the defaults: 50 processes, documents and financials enabled, self-heal on.
   *
   * @return default configuration
   */
  public static ReconcileConfig defaults() {
    return new ReconcileConfig(50, Optional.empty(), true, true, false, 3, 1_000L, true);
  }

  /**
   * Parses reconciliation settings.
   *
   * @param options effective configuration
   * @return reconciliation settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ReconcileConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ReconcileConfig defaults = defaults();
    return new ReconcileConfig(
        ConfigValues.intValue(options, "limit", defaults.limit(), 1, 100_000),
        ConfigValues.optionalString(options, "process"),
        ConfigValues.bool(options, "documents", true),
        ConfigValues.bool(options, "financials", true),
        ConfigValues.bool(options, "dryRun", false),
        ConfigValues.intValue(options, "lookupAttempts", defaults.lookupAttempts(), 1, 10),
        ConfigValues.millis(options, "backoffMillis", defaults.backoffMillis(), 60_000L),
        ConfigValues.bool(options, "schemaSelfHeal", true));
  }

  /**
   * Returns a copy with a different dry-run flag.
   *
   * @param value new flag
   * @return updated configuration
   */
  public ReconcileConfig withDryRun(boolean value) {
    return new ReconcileConfig(limit, process, documents, financials, value, lookupAttempts, backoffMillis,
        schemaSelfHeal);
  }
}
