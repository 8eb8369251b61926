package ca.gc.cra.courier.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.courier";
  private static final String SERVICE_VERSION = "0.1.0";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static MeterHandle start(ExporterSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.mode() == ExporterSettings.Mode.NONE) {
      log.debug("Metrics export disabled");
      return MeterHandle.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      MeterHandle handle = build(reader, resource(settings));
      log.info("OpenTelemetry metrics exporting over OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forReader(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), resource(ExporterSettings.disabled()));
  }

  private static MeterHandle build(MetricReader reader, Resource resource) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(SERVICE_VERSION)
        .build();
    return new MeterHandle(meter, provider);
  }

  private static Resource resource(ExporterSettings settings) {
    AttributesBuilder builder = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "courier")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), SERVICE_VERSION);
    settings.resourceAttributes().forEach((k, v) -> builder.put(AttributeKey.stringKey(k), v));
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  /** Meter plus the provider that must be flushed and shut down with it. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void flush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
