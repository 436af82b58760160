package br.com.maike.ledger.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each ledger command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  /** Commands that accept configuration. */
  public static final Set<String> MODES = Set.of("ingest", "backfill", "gapfill", "reconcile");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (ingest, backfill, gapfill, reconcile)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      case "backfill" -> buildBackfillDefaults();
      case "gapfill" -> buildGapFillDefaults();
      case "reconcile" -> buildReconcileDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("ledgerJdbcUrl", "");
    map.put("ledgerUser", "");
    map.put("ledgerPassword", "");
    map.put("ledgerSchema", "dbo");
    map.put("serproSchema", "Serpro.dbo");
    map.put("duimpSchema", "Duimp.dbo");
    map.put("cacheJdbcUrl", "jdbc:sqlite:chat_ia.db");
    map.put("poolSize", "4");
    map.put("connectionTimeoutMillis", "10000");
    map.put("queryTimeoutSeconds", "60");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kind", "");
    map.put("number", "");
    map.put("payload", "");
    map.put("process", "");
    map.put("source", IngestConfig.DEFAULT_SOURCE_TAG);
    map.put("endpoint", "");
    return map;
  }

  private static Map<String, String> buildBackfillDefaults() {
    BackfillConfig defaults = BackfillConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("year", Integer.toString(BackfillConfig.DEFAULT_YEAR));
    map.put("from", "");
    map.put("to", "");
    map.put("kind", "ALL");
    map.put("limit", Integer.toString(defaults.limit()));
    map.put("dryRun", Boolean.toString(defaults.dryRun()));
    map.put("batchSize", Integer.toString(defaults.existenceBatchSize()));
    map.put("existenceAttempts", Integer.toString(defaults.existenceAttempts()));
    map.put("writeAttempts", Integer.toString(defaults.writeAttempts()));
    map.put("backoffMillis", Long.toString(defaults.backoffMillis()));
    map.put("throttleMillis", Long.toString(defaults.throttleMillis()));
    map.put("unknownPolicy", defaults.unknownPolicy().name());
    return map;
  }

  private static Map<String, String> buildGapFillDefaults() {
    GapFillConfig defaults = GapFillConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("limit", Integer.toString(defaults.limit()));
    map.put("dryRun", Boolean.toString(defaults.dryRun()));
    map.put("minPayloadLength", Integer.toString(defaults.minPayloadLength()));
    return map;
  }

  private static Map<String, String> buildReconcileDefaults() {
    ReconcileConfig defaults = ReconcileConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("limit", Integer.toString(defaults.limit()));
    map.put("process", "");
    map.put("documents", Boolean.toString(defaults.documents()));
    map.put("financials", Boolean.toString(defaults.financials()));
    map.put("dryRun", Boolean.toString(defaults.dryRun()));
    map.put("lookupAttempts", Integer.toString(defaults.lookupAttempts()));
    map.put("backoffMillis", Long.toString(defaults.backoffMillis()));
    map.put("schemaSelfHeal", Boolean.toString(defaults.schemaSelfHeal()));
    return map;
  }
}
