package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.config.StorageConfig;
import br.com.maike.ledger.logging.Logs;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds HikariCP pools for the authoritative store and the local cache.
 *
 * <p>Pools are created lazily: an unreachable database surfaces on the first borrow, where the adapters classify
 * it as {@code UNAVAILABLE}, instead of failing the composition root.</p>
 *
 * @since 0.1.0
 */
public final class DataSourceFactory {
  private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

  private DataSourceFactory() {
    // Utility
  }

  /**
   * Creates the pool of the SQL Server database holding the ledger and the replicated source tables.
   *
   * @param config storage settings
   * @return pool; caller closes it
   */
  public static HikariDataSource ledger(StorageConfig config) {
    Objects.requireNonNull(config, "config");
    HikariConfig hikari = base("ledger", config.ledgerJdbcUrl(), config);
    if (!config.ledgerUser().isEmpty()) {
      hikari.setUsername(config.ledgerUser());
    }
    if (!config.ledgerPassword().isEmpty()) {
      hikari.setPassword(config.ledgerPassword());
    }
    hikari.setAutoCommit(true);
    return open(hikari);
  }

  /**
   * Creates the pool of the local SQLite cache.
   *
   * @param config storage settings
   * @return pool; caller closes it
   */
  public static HikariDataSource cache(StorageConfig config) {
    Objects.requireNonNull(config, "config");
    HikariConfig hikari = base("cache", config.cacheJdbcUrl(), config);
    // SQLite serializes access; the cache adapters only read, one connection is enough
    hikari.setMaximumPoolSize(1);
    return open(hikari);
  }

  private static HikariConfig base(String name, String url, StorageConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("customs-ledger-" + name);
    hikari.setJdbcUrl(url);
    hikari.setMaximumPoolSize(config.poolSize());
    hikari.setMinimumIdle(0);
    hikari.setConnectionTimeout(config.connectionTimeoutMillis());
    hikari.setValidationTimeout(Math.min(Duration.ofSeconds(3).toMillis(), config.connectionTimeoutMillis()));
    hikari.setIdleTimeout(Duration.ofMinutes(5).toMillis());
    hikari.setMaxLifetime(Duration.ofMinutes(25).toMillis());
    hikari.setInitializationFailTimeout(-1);
    return hikari;
  }

  private static HikariDataSource open(HikariConfig hikari) {
    log.info("Opening pool {} for {}", hikari.getPoolName(), Logs.redactJdbcUrl(hikari.getJdbcUrl()));
    return new HikariDataSource(hikari);
  }
}
