package ca.gc.cra.courier.infrastructure.metrics;

import ca.gc.cra.courier.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Adapter created by the composition root for each CLI run.</p>
 * <p><strong>Naming:</strong> Dotted keys are prefixed with {@code courier.}, so {@code binding.dropped} becomes the
 * instrument {@code courier.binding.dropped}. Instruments are created on first use.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  static final String PREFIX = "courier.";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to the given settings.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(ExporterSettings settings) {
    this(OpenTelemetryBootstrap.start(settings));
  }

  /**
   * Creates an adapter recording into a caller-supplied reader, such as an in-memory reader in tests.
   *
   * @param reader metric reader
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forReader(reader));
  }

  private OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> meter
        .counterBuilder(PREFIX + k)
        .setUnit("1")
        .setDescription("COURIER counter " + k)
        .build())
        .add(1);
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> meter
        .histogramBuilder(PREFIX + k)
        .ofLongs()
        .setDescription("COURIER observation " + k)
        .build())
        .record(value);
  }

  /**
   * Indicates whether measurements are discarded.
   *
   * @return {@code true} when no exporter or reader is attached
   */
  public boolean isNoop() {
    return handle.isNoop();
  }

  /**
   * Pushes pending measurements to the exporter.
   */
  public void flush() {
    handle.flush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    handle.flush();
    handle.close();
  }
}
