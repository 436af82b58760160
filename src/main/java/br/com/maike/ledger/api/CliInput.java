package br.com.maike.ledger.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command line split into {@code --flags} and {@code key=value} arguments.
 *
 * <p>Aliases collapse to one canonical flag: {@code -h} and {@code help} become {@code --help};
 * {@code -v} and {@code --debug} become {@code --verbose}; {@code --dryrun} becomes {@code --dry-run}.</p>
 *
 * @param keyValueArgs arguments that are neither flags nor blank
 * @param flags canonical lower-case flags
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--dryrun", "--dry-run");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(lower, lower);
        if (canonical.startsWith("-") && !arg.contains("=")) {
          flags.add(canonical);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Returns the {@code key=value} arguments as an array for {@link CliArgsParser}.
   *
   * @return copy of the arguments
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Indicates whether help output was requested.
   *
   * @return {@code true} for {@code --help} or an alias
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether DEBUG logging was requested.
   *
   * @return {@code true} for {@code --verbose} or an alias
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    String normalized = flag.trim().toLowerCase(Locale.ROOT);
    return flags.contains(ALIASES.getOrDefault(normalized, normalized));
  }
}
