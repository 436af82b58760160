package br.com.maike.ledger.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("backfill".equalsIgnoreCase(mode)) {
      boolean hasFrom = !trim(effective.get("from")).isEmpty();
      boolean hasTo = !trim(effective.get("to")).isEmpty();
      if (hasFrom != hasTo) {
        throw new IllegalArgumentException("from and to must be given together");
      }
    }

    if ("reconcile".equalsIgnoreCase(mode)) {
      boolean documents = parseBoolean(effective.get("documents"), true);
      boolean financials = parseBoolean(effective.get("financials"), true);
      if (!documents && !financials) {
        throw new IllegalArgumentException("At least one of documents or financials must be true for reconcile");
      }
    }

    if ("ingest".equalsIgnoreCase(mode)) {
      if (trim(effective.get("kind")).isEmpty()) {
        throw new IllegalArgumentException("kind is required for ingest");
      }
      if (trim(effective.get("payload")).isEmpty()) {
        throw new IllegalArgumentException("payload is required for ingest");
      }
    }

    String exporter = trim(effective.get("metricsExporter"));
    if (!exporter.isEmpty() && !exporter.equalsIgnoreCase("otlp") && !exporter.equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none");
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
