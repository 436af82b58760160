package br.com.maike.ledger.config;

import br.com.maike.ledger.logging.Logs;
import br.com.maike.ledger.validation.Numbers;
import br.com.maike.ledger.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Connection settings for the authoritative SQL Server store and the local SQLite cache.
 * <p><strong>Why:</strong> Every command opens the same pools; keeping the settings in one record lets the
 * composition root build them once and hand them to each adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Security:</strong> {@link #toString()} never prints the password.</p>
 *
 * @param ledgerJdbcUrl JDBC URL of the database holding the ledger tables
 * @param ledgerUser database user, may be blank when the URL carries credentials
 * @param ledgerPassword database password, may be blank
 * @param ledgerSchema qualifier of the ledger tables, such as {@code dbo}; blank for none
 * @param serproSchema qualifier of the replicated Serpro tables, such as {@code Serpro.dbo}
 * @param duimpSchema qualifier of the unified declaration tables, such as {@code Duimp.dbo}
 * @param cacheJdbcUrl JDBC URL of the local SQLite cache
 * @param poolSize maximum connections per pool
 * @param connectionTimeoutMillis maximum wait for a pooled connection
 * @param queryTimeoutSeconds per-statement timeout, {@code 0} for the driver default
 * @since 0.1.0
 */
public record StorageConfig(
    String ledgerJdbcUrl,
    String ledgerUser,
    String ledgerPassword,
    String ledgerSchema,
    String serproSchema,
    String duimpSchema,
    String cacheJdbcUrl,
    int poolSize,
    long connectionTimeoutMillis,
    int queryTimeoutSeconds) {

  public StorageConfig {
    ledgerJdbcUrl = Strings.requireNonBlank("ledgerJdbcUrl", ledgerJdbcUrl);
    ledgerUser = Objects.requireNonNullElse(Strings.trimToNull(ledgerUser), "");
    ledgerPassword = Objects.requireNonNullElse(ledgerPassword, "");
    ledgerSchema = ledgerSchema == null || ledgerSchema.isBlank()
        ? "" : Strings.requireSqlQualifier("ledgerSchema", ledgerSchema);
    serproSchema = Strings.requireSqlQualifier("serproSchema", serproSchema);
    duimpSchema = Strings.requireSqlQualifier("duimpSchema", duimpSchema);
    cacheJdbcUrl = Strings.requireNonBlank("cacheJdbcUrl", cacheJdbcUrl);
    Numbers.requireRange("poolSize", poolSize, 1, 64);
    Numbers.requireRange("connectionTimeoutMillis", connectionTimeoutMillis, 250, 600_000);
    Numbers.requireRange("queryTimeoutSeconds", queryTimeoutSeconds, 0, 3_600);
  }

  /**
   * Parses storage settings from flattened configuration.
   *
   * @param options effective configuration
   * @return storage settings
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static StorageConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String url = ConfigValues.optionalString(options, "ledgerJdbcUrl")
        .orElseThrow(() -> new IllegalArgumentException("ledgerJdbcUrl is required"));
    return new StorageConfig(
        url,
        ConfigValues.string(options, "ledgerUser", ""),
        options.getOrDefault("ledgerPassword", ""),
        ConfigValues.string(options, "ledgerSchema", ""),
        ConfigValues.string(options, "serproSchema", "Serpro.dbo"),
        ConfigValues.string(options, "duimpSchema", "Duimp.dbo"),
        ConfigValues.string(options, "cacheJdbcUrl", "jdbc:sqlite:chat_ia.db"),
        ConfigValues.intValue(options, "poolSize", 4, 1, 64),
        ConfigValues.millis(options, "connectionTimeoutMillis", 10_000L, 600_000L),
        ConfigValues.intValue(options, "queryTimeoutSeconds", 60, 0, 3_600));
  }

  @Override
  public String toString() {
    return "StorageConfig[ledgerJdbcUrl=" + Logs.redactJdbcUrl(ledgerJdbcUrl)
        + ", ledgerUser=" + ledgerUser
        + ", ledgerPassword=" + (ledgerPassword.isEmpty() ? "" : Logs.redact(ledgerPassword))
        + ", ledgerSchema=" + ledgerSchema
        + ", serproSchema=" + serproSchema
        + ", duimpSchema=" + duimpSchema
        + ", cacheJdbcUrl=" + cacheJdbcUrl
        + ", poolSize=" + poolSize
        + ", connectionTimeoutMillis=" + connectionTimeoutMillis
        + ", queryTimeoutSeconds=" + queryTimeoutSeconds + "]";
  }
}
