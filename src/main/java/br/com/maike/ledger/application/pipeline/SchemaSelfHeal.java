package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.SchemaMaintenance;
import br.com.maike.ledger.application.port.StoreException;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Widens the historically undersized {@code status_documento_codigo} columns before the first write.
 *
 * <p>Runs at most once per instance. Failures are logged as warnings and never stop the caller.</p>
 *
 * @since 0.1.0
 */
public final class SchemaSelfHeal {
  private static final Logger log = LoggerFactory.getLogger(SchemaSelfHeal.class);

  static final String COLUMN = "status_documento_codigo";
  static final List<String> TABLES = List.of("DOCUMENTO_ADUANEIRO", "HISTORICO_DOCUMENTO_ADUANEIRO");
  static final int TARGET_LENGTH = 50;

  private final SchemaMaintenance schema;
  private final MetricsPort metrics;
  private boolean attempted;

  /**
   * Creates the self-heal step.
   *
   * @param schema schema maintenance port
   * @param metrics metrics sink
   */
  public SchemaSelfHeal(SchemaMaintenance schema, MetricsPort metrics) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Widens narrow columns on the first call; later calls return immediately.
   *
   * @return number of columns widened by this call
   */
  public synchronized int ensure() {
    if (attempted) {
      return 0;
    }
    attempted = true;
    int widened = 0;
    for (String table : TABLES) {
      try {
        OptionalInt length = schema.columnLength(table, COLUMN);
        if (length.isPresent() && length.getAsInt() > 0 && length.getAsInt() < TARGET_LENGTH) {
          schema.widenColumn(table, COLUMN, TARGET_LENGTH);
          widened++;
          metrics.increment("schema.widened");
          log.info("Widened {}.{} from {} to {}", table, COLUMN, length.getAsInt(), TARGET_LENGTH);
        }
      } catch (StoreException ex) {
        metrics.increment("schema.selfheal.failed");
        log.warn("Could not verify {}.{} ({}): {}", table, COLUMN, ex.kind(), ex.getMessage());
      }
    }
    return widened;
  }
}
