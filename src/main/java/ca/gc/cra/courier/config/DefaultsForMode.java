package ca.gc.cra.courier.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each COURIER CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; typed records such as
 * {@link SimulationConfig#defaults()} are built from them.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code simulate} or {@code classify})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "simulate" -> buildSimulateDefaults();
      case "classify" -> buildClassifyDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("classes", "MESSI,RONALDO,NEYMAR,MBAPPE,HAALAND");
    map.put("confidenceThreshold", "100.0");
    map.put("fallbackClass", "");
    map.put("classifierScript", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSimulateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("fragmentSize", "1024");
    map.put("dataRate", "1Mbps");
    map.put("linkRate", "5Mbps");
    map.put("linkDelay", "2ms");
    map.put("linkQueueBytes", "65536");
    map.put("lossRate", "0.0");
    map.put("seed", "1");
    map.put("simulationTime", "10s");
    map.put("imageSize", "50000");
    map.put("imagesPerClass", "1");
    map.put("imageDir", "");
    map.put("startTime", "2s");
    map.put("stagger", "500ms");
    map.put("originAddress", "10.1.0.1");
    map.put("port", "9");
    map.put("backpressureRetry", "");
    map.put("report", "");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildClassifyDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("imageDir", "");
    return map;
  }
}
