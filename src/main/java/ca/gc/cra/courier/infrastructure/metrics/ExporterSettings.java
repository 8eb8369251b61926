package ca.gc.cra.courier.infrastructure.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics exporter selection resolved from system properties, then environment variables.
 *
 * <p>Recognized keys: {@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER} ({@code none} or {@code otlp}),
 * {@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}, and
 * {@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES} ({@code k=v,k2=v2}).</p>
 *
 * @param mode exporter to use
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes in declaration order
 * @since 0.1.0
 */
public record ExporterSettings(Mode mode, String endpoint, Map<String, String> resourceAttributes) {
  private static final Logger log = LoggerFactory.getLogger(ExporterSettings.class);
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum Mode {
    /** Metrics are recorded into a no-op meter. */
    NONE,
    /** Metrics are pushed periodically over OTLP gRPC. */
    OTLP;

    static Mode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      switch (normalized) {
        case "none":
          return NONE;
        case "otlp":
          return OTLP;
        default:
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          return NONE;
      }
    }
  }

  /**
   * Normalizes components.
   */
  public ExporterSettings {
    Objects.requireNonNull(mode, "mode");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(resourceAttributes));
  }

  /**
   * Settings that disable export.
   *
   * @return disabled settings
   */
  public static ExporterSettings disabled() {
    return new ExporterSettings(Mode.NONE, DEFAULT_ENDPOINT, Map.of());
  }

  /**
   * Resolves settings from the JVM system properties and the process environment.
   *
   * @return settings
   */
  public static ExporterSettings fromEnvironment() {
    return resolve(System.getProperties(), System.getenv());
  }

  static ExporterSettings resolve(Properties props, Map<String, String> env) {
    Mode mode = Mode.from(firstNonBlank(props.getProperty("otel.metrics.exporter"),
        env.get("OTEL_METRICS_EXPORTER")));
    String endpoint = firstNonBlank(props.getProperty("otel.exporter.otlp.endpoint"),
        env.get("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String attrs = firstNonBlank(props.getProperty("otel.resource.attributes"),
        env.get("OTEL_RESOURCE_ATTRIBUTES"));
    return new ExporterSettings(mode, endpoint, parseAttributes(attrs));
  }

  static Map<String, String> parseAttributes(String raw) {
    Map<String, String> out = new LinkedHashMap<>();
    if (raw == null || raw.isBlank()) {
      return out;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      String key = idx > 0 ? trimmed.substring(0, idx).trim() : "";
      String value = idx > 0 ? trimmed.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute '{}'", trimmed);
        continue;
      }
      out.put(key, value);
    }
    return out;
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }
}
