package br.com.maike.ledger.config;

import br.com.maike.ledger.domain.document.DateWindow;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.validation.Numbers;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Settings of the historical backfill.
 * <p><strong>Role:</strong> Input of {@link br.com.maike.ledger.application.pipeline.BackfillUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param window historical window to enumerate
 * @param kinds kinds to backfill; a subset of import and unified import declarations
 * @param limit maximum rows per kind, {@code 0} for no limit
 * @param dryRun when {@code true} nothing is written
 * @param existenceBatchSize numbers per existence round-trip
 * @param existenceAttempts attempts per existence batch on timeouts
 * @param writeAttempts attempts per document write on timeouts
 * @param backoffMillis first retry delay; doubles on each further retry
 * @param throttleMillis pause between writes
 * @param unknownPolicy what to do with documents whose existence could not be determined
 * @since 0.1.0
 */
public record BackfillConfig(
    DateWindow window,
    Set<DocumentKind> kinds,
    int limit,
    boolean dryRun,
    int existenceBatchSize,
    int existenceAttempts,
    int writeAttempts,
    long backoffMillis,
    long throttleMillis,
    UnknownPolicy unknownPolicy) {

  /** Default year enumerated when no window is configured. */
  public static final int DEFAULT_YEAR = 2025;

  private static final Set<DocumentKind> SUPPORTED =
      EnumSet.of(DocumentKind.IMPORT_DECLARATION, DocumentKind.UNIFIED_IMPORT_DECLARATION);

  /** Policy applied to documents whose existence is unknown after retries. */
  public enum UnknownPolicy {
    /** Leave the document for a later run and count it as unknown. */
    SKIP,
    /** Ingest anyway; the unique index rejects true duplicates. */
    INGEST
  }

  public BackfillConfig {
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(kinds, "kinds");
    if (kinds.isEmpty()) {
      throw new IllegalArgumentException("at least one document kind is required");
    }
    for (DocumentKind kind : kinds) {
      if (!SUPPORTED.contains(kind)) {
        throw new IllegalArgumentException("backfill does not support kind " + kind.code());
      }
    }
    kinds = Set.copyOf(kinds);
    Numbers.requireRange("limit", limit, 0, 1_000_000);
    Numbers.requireRange("existenceBatchSize", existenceBatchSize, 1, 2_000);
    Numbers.requireRange("existenceAttempts", existenceAttempts, 1, 10);
    Numbers.requireRange("writeAttempts", writeAttempts, 1, 10);
    Numbers.requireRange("backoffMillis", backoffMillis, 0, 60_000);
    Numbers.requireRange("throttleMillis", throttleMillis, 0, 60_000);
    unknownPolicy = Objects.requireNonNullElse(unknownPolicy, UnknownPolicy.SKIP);
  }

  /**
   * Returns the defaults: year {@value #DEFAULT_YEAR}, both kinds, 500 numbers per existence batch,
   * 3 existence attempts, 2 write attempts, 1 s backoff and 100 ms throttle.
   *
   * @return default configuration
   */
  public static BackfillConfig defaults() {
    return new BackfillConfig(
        DateWindow.ofYear(DEFAULT_YEAR), SUPPORTED, 0, false, 500, 3, 2, 1_000L, 100L, UnknownPolicy.SKIP);
  }

  /**
   * Parses backfill settings.
   *
   * @param options effective configuration
   * @return backfill settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static BackfillConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    BackfillConfig defaults = defaults();
    return new BackfillConfig(
        parseWindow(options),
        parseKinds(ConfigValues.optionalString(options, "kind")),
        ConfigValues.intValue(options, "limit", defaults.limit(), 0, 1_000_000),
        ConfigValues.bool(options, "dryRun", false),
        ConfigValues.intValue(options, "batchSize", defaults.existenceBatchSize(), 1, 2_000),
        ConfigValues.intValue(options, "existenceAttempts", defaults.existenceAttempts(), 1, 10),
        ConfigValues.intValue(options, "writeAttempts", defaults.writeAttempts(), 1, 10),
        ConfigValues.millis(options, "backoffMillis", defaults.backoffMillis(), 60_000L),
        ConfigValues.millis(options, "throttleMillis", defaults.throttleMillis(), 60_000L),
        parsePolicy(ConfigValues.optionalString(options, "unknownPolicy")));
  }

  /**
   * Returns a copy with a different dry-run flag.
   *
   * @param value new flag
   * @return updated configuration
   */
  public BackfillConfig withDryRun(boolean value) {
    return new BackfillConfig(window, kinds, limit, value, existenceBatchSize, existenceAttempts,
        writeAttempts, backoffMillis, throttleMillis, unknownPolicy);
  }

  /**
   * Returns the data-source tag written with migrated documents.
   *
   * @return {@code MIGRATION_<year>} for single-year windows, else {@code MIGRATION}
   */
  public String sourceTag() {
    int year = window.singleYear();
    return year > 0 ? "MIGRATION_" + year : "MIGRATION";
  }

  private static DateWindow parseWindow(Map<String, String> options) {
    Optional<String> from = ConfigValues.optionalString(options, "from");
    Optional<String> to = ConfigValues.optionalString(options, "to");
    if (from.isPresent() || to.isPresent()) {
      if (from.isEmpty() || to.isEmpty()) {
        throw new IllegalArgumentException("from and to must be given together");
      }
      return new DateWindow(parseDate("from", from.get()), parseDate("to", to.get()));
    }
    int year = ConfigValues.intValue(options, "year", DEFAULT_YEAR, 2000, 2100);
    return DateWindow.ofYear(year);
  }

  private static LocalDate parseDate(String key, String raw) {
    try {
      return LocalDate.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(key + " must be an ISO date (was '" + raw + "')", ex);
    }
  }

  private static Set<DocumentKind> parseKinds(Optional<String> raw) {
    if (raw.isEmpty()) {
      return SUPPORTED;
    }
    String value = raw.get().toUpperCase(Locale.ROOT);
    if (value.equals("ALL") || value.equals("TODOS")) {
      return SUPPORTED;
    }
    return EnumSet.of(DocumentKind.fromCode(value));
  }

  private static UnknownPolicy parsePolicy(Optional<String> raw) {
    if (raw.isEmpty()) {
      return UnknownPolicy.SKIP;
    }
    try {
      return UnknownPolicy.valueOf(raw.get().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknownPolicy must be SKIP or INGEST (was '" + raw.get() + "')", ex);
    }
  }
}
