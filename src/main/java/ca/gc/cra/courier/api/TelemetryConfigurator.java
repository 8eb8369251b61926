package ca.gc.cra.courier.api;

import ca.gc.cra.courier.infrastructure.metrics.ExporterSettings;
import ca.gc.cra.courier.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the JVM system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Publishes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} as
   * {@code otel.*} system properties and resolves the resulting exporter settings.
   *
   * @param effective merged configuration
   * @return exporter settings; environment variables apply where a key is blank
   * @throws IllegalArgumentException if the exporter or endpoint is invalid
   */
  static ExporterSettings configureMetrics(Map<String, String> effective) {
    String exporter = trimmed(effective, "metricsExporter");
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = trimmed(effective, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimmed(effective, "otelResourceAttributes");
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return ExporterSettings.fromEnvironment();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(Map<String, String> map, String key) {
    String value = map.get(key);
    return value == null ? "" : value.trim();
  }
}
