package br.com.maike.ledger.api;

import br.com.maike.ledger.config.ConfigMerger;
import br.com.maike.ledger.config.DefaultsForMode;
import br.com.maike.ledger.config.YamlConfigLoader;
import br.com.maike.ledger.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers mixing CLI flags with YAML and embedded defaults for the ledger commands.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Outcome of resolving the effective configuration: either a mutable map or the exit code to return.
   */
  record Resolution(Map<String, String> config, ExitCode failure) {
    boolean failed() {
      return failure != null;
    }
  }

  /**
   * Parses arguments, loads the optional YAML file, merges defaults and applies telemetry settings.
   *
   * @param mode command name
   * @param input parsed CLI input
   * @param usage one-line usage printed on invalid input
   * @param log logger of the calling command
   * @return effective configuration, or the failure exit code
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArray()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return new Resolution(null, ExitCode.INVALID_ARGS);
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath;
      try {
        yamlPath = Path.of(configPath);
      } catch (InvalidPathException ex) {
        log.error("Invalid configuration path: {}", configPath);
        CliPrinter.println(usage);
        return new Resolution(null, ExitCode.INVALID_ARGS);
      }
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return new Resolution(null, ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return new Resolution(null, ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return new Resolution(null, ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      if (!input.verbose() && parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return new Resolution(null, ExitCode.INVALID_ARGS);
    }
    return new Resolution(effective, null);
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1");
  }
}
