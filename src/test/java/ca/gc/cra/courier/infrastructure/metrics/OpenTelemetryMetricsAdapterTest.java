package ca.gc.cra.courier.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.withReader(reader);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsPrefixedCounter() {
    adapter.increment("binding.dropped");
    adapter.increment("binding.dropped");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "courier.binding.dropped");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
  }

  @Test
  void observeExportsHistogram() {
    adapter.observe("tracker.delay.nanos", 2_000_000L);
    adapter.observe("tracker.delay.nanos", 4_000_000L);
    adapter.flush();

    MetricData histogram = find(reader.collectAllMetrics(), "courier.tracker.delay.nanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(6_000_000.0, point.getSum());
  }

  @Test
  void readerBackedAdapterIsNotNoop() {
    assertFalse(adapter.isNoop());
  }

  @Test
  void disabledSettingsProduceNoopAdapter() {
    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(ExporterSettings.disabled())) {
      assertTrue(disabled.isNoop());
      disabled.increment("binding.matched");
      disabled.observe("pacer.fragments", 3L);
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name + " in " + metrics));
  }
}
