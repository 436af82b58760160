package br.com.maike.ledger.config;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.pipeline.BackfillUseCase;
import br.com.maike.ledger.application.pipeline.FinancialAggregateWriter;
import br.com.maike.ledger.application.pipeline.GapFillUseCase;
import br.com.maike.ledger.application.pipeline.ProcessReconciliationUseCase;
import br.com.maike.ledger.application.pipeline.SchemaSelfHeal;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.ClockPort;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.Sleeper;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.reconcile.DocumentReconciler;
import br.com.maike.ledger.application.reconcile.FieldExtractor;
import br.com.maike.ledger.application.reconcile.VersionResolver;
import br.com.maike.ledger.infrastructure.cache.CachedNumberLocator;
import br.com.maike.ledger.infrastructure.cache.SqliteLegacyPayloadCache;
import br.com.maike.ledger.infrastructure.cache.SqliteProcessCatalog;
import br.com.maike.ledger.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import br.com.maike.ledger.infrastructure.persistence.jdbc.DataSourceFactory;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcFinancialStore;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcHistoryStore;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcSchemaMaintenance;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcSnapshotStore;
import br.com.maike.ledger.infrastructure.source.DuimpBulkSource;
import br.com.maike.ledger.infrastructure.source.DuimpDocumentSource;
import br.com.maike.ledger.infrastructure.source.DuimpNumberLocator;
import br.com.maike.ledger.infrastructure.source.SerproDeclarationBulkSource;
import br.com.maike.ledger.infrastructure.source.SerproDocumentSource;
import br.com.maike.ledger.infrastructure.source.SerproFinancialsSource;
import br.com.maike.ledger.infrastructure.source.SerproNumberLocator;
import br.com.maike.ledger.infrastructure.time.SystemClockAdapter;
import br.com.maike.ledger.infrastructure.time.ThreadSleeper;
import com.zaxxer.hikari.HikariDataSource;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root wiring the ledger use cases to JDBC, cache and metrics adapters.
 * <p><strong>Role:</strong> The only place that knows concrete adapters; use cases receive ports through their
 * constructors.</p>
 * <p><strong>Lifecycle:</strong> Connection pools open on first use and close with {@link #close()}, together with
 * the metrics adapter when it owns an exporter.</p>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread; pool creation is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final StorageConfig storage;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Sleeper sleeper;
  private final PayloadJson json = new PayloadJson();
  private HikariDataSource ledgerPool;
  private HikariDataSource cachePool;

  /**
   * Creates a root with the OpenTelemetry metrics adapter, the system clock and real sleeps.
   *
   * @param storage storage settings
   */
  public CompositionRoot(StorageConfig storage) {
    this(storage, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter(), new ThreadSleeper());
  }

  /**
   * Creates a root with explicit shared collaborators.
   *
   * @param storage storage settings
   * @param metrics metrics sink handed to every use case
   * @param clock clock handed to every use case
   * @param sleeper pause used for backoff and throttling
   */
  public CompositionRoot(StorageConfig storage, MetricsPort metrics, ClockPort clock, Sleeper sleeper) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Returns the metrics sink shared by all use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the single-observation pipeline over the ledger store.
   *
   * @return reconciler
   */
  public DocumentReconciler documentReconciler() {
    SnapshotStore snapshots = snapshotStore();
    return DocumentReconciler.create(snapshots, new JdbcHistoryStore(ledger(), storage.ledgerSchema()), clock, metrics);
  }

  /**
   * Builds the historical backfill.
   *
   * @return backfill use case
   */
  public BackfillUseCase backfillUseCase() {
    JdbcRunner ledger = ledger();
    return new BackfillUseCase(
        List.of(
            new SerproDeclarationBulkSource(ledger, storage.serproSchema(), storage.ledgerSchema()),
            new DuimpBulkSource(ledger, storage.duimpSchema())),
        snapshotStore(),
        documentReconciler(),
        sleeper,
        metrics);
  }

  /**
   * Builds the per-process reconciliation.
   *
   * @return reconciliation use case
   */
  public ProcessReconciliationUseCase processReconciliationUseCase() {
    JdbcRunner ledger = ledger();
    FinancialAggregateWriter financials = new FinancialAggregateWriter(
        new SerproFinancialsSource(ledger, storage.serproSchema()),
        new JdbcFinancialStore(ledger, storage.ledgerSchema(), clock),
        json,
        metrics);
    return new ProcessReconciliationUseCase(
        new SqliteProcessCatalog(cache()),
        List.of(
            new CachedNumberLocator(),
            new SerproNumberLocator(ledger, storage.serproSchema()),
            new DuimpNumberLocator(ledger, storage.duimpSchema())),
        authoritativeSources(ledger),
        documentReconciler(),
        financials,
        new SchemaSelfHeal(new JdbcSchemaMaintenance(ledger, storage.ledgerSchema()), metrics),
        sleeper,
        metrics);
  }

  /**
   * Builds the gap-fill of incomplete snapshot rows.
   *
   * @return gap-fill use case
   */
  public GapFillUseCase gapFillUseCase() {
    return new GapFillUseCase(
        snapshotStore(),
        new SqliteLegacyPayloadCache(cache()),
        authoritativeSources(ledger()),
        new FieldExtractor(new VersionResolver(metrics), metrics),
        json,
        clock,
        metrics);
  }

  private List<AuthoritativeDocumentSource> authoritativeSources(JdbcRunner ledger) {
    return List.of(
        new SerproDocumentSource(ledger, storage.serproSchema()),
        new DuimpDocumentSource(ledger, storage.duimpSchema()));
  }

  private SnapshotStore snapshotStore() {
    return new JdbcSnapshotStore(ledger(), storage.ledgerSchema());
  }

  private synchronized JdbcRunner ledger() {
    if (ledgerPool == null) {
      ledgerPool = DataSourceFactory.ledger(storage);
    }
    return new JdbcRunner(ledgerPool, storage.queryTimeoutSeconds());
  }

  private synchronized JdbcRunner cache() {
    if (cachePool == null) {
      cachePool = DataSourceFactory.cache(storage);
    }
    return new JdbcRunner(cachePool, storage.queryTimeoutSeconds());
  }

  @Override
  public synchronized void close() {
    closePool(ledgerPool);
    closePool(cachePool);
    ledgerPool = null;
    cachePool = null;
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static void closePool(HikariDataSource pool) {
    if (pool != null && !pool.isClosed()) {
      pool.close();
    }
  }
}
