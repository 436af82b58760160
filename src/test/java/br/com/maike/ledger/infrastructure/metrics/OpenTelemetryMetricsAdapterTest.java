package br.com.maike.ledger.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAndResource() {
    adapter.increment("ledger.history.appended");
    adapter.increment("ledger.history.appended");
    adapter.increment("ledger.history.appended");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "ledger.history.appended").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("ledger.history.appended", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));

    assertEquals("customs-ledger", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("br.com.maike", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramUnderNormalizedName() {
    adapter.observe("backfill.write.latencyMillis", 10L);
    adapter.observe("backfill.write.latencyMillis", 30L);
    adapter.flush();

    MetricData histogram = find(reader.collectAllMetrics(), "backfill.write.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("backfill.write.latencyMillis",
        point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("ledger.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
    assertEquals("m9.retries", OpenTelemetryMetricsAdapter.instrumentName("9.retries"));
    assertEquals("gapfill.di_payload", OpenTelemetryMetricsAdapter.instrumentName("gapfill.DI payload"));
  }

  @Test
  void noopBootstrapDiscardsMeasurements() {
    try (OpenTelemetryMetricsAdapter noop =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop())) {
      noop.increment("ledger.snapshot.conflict");
      noop.observe("ledger.snapshot.latency", 5L);
      noop.flush();
    }
    assertTrue(reader.collectAllMetrics().isEmpty());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
