package br.com.maike.ledger.infrastructure.metrics;

import br.com.maike.ledger.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records ledger counters and histograms through OpenTelemetry.
 * <p><strong>Naming:</strong> keys such as {@code ledger.snapshot.inserted} become instrument names after
 * lower-casing and replacing unsupported characters; the original key is kept as the
 * {@code ledger.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("ledger.metric.key");
  static final String FALLBACK_NAME = "ledger.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counted> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Observed> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from system properties and the environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("Metrics export disabled; counters are discarded");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (bootstrap.isNoop()) {
      return;
    }
    Counted counted = counters.computeIfAbsent(key, this::counter);
    counted.counter().add(1, counted.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (bootstrap.isNoop()) {
      return;
    }
    Observed observed = histograms.computeIfAbsent(key, this::histogram);
    observed.histogram().record(value, observed.attributes());
  }

  /**
   * Pushes pending measurements to the exporter.
   */
  public void flush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Counted counter(String key) {
    String name = instrumentName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Ledger counter " + key)
        .build();
    return new Counted(counter, Attributes.of(METRIC_KEY, key));
  }

  private Observed histogram(String key) {
    String name = instrumentName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Ledger observation " + key)
        .build();
    return new Observed(histogram, Attributes.of(METRIC_KEY, key));
  }

  /**
   * Converts a metric key into a valid instrument name.
   *
   * @param key dotted metric key
   * @return lower-case name starting with a letter; {@value #FALLBACK_NAME} for blank keys
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counted(LongCounter counter, Attributes attributes) {}

  private record Observed(LongHistogram histogram, Attributes attributes) {}
}
