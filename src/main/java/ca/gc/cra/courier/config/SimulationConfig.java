package ca.gc.cra.courier.config;

import static ca.gc.cra.courier.config.ConfigValues.optionalPath;
import static ca.gc.cra.courier.config.ConfigValues.optionalString;
import static ca.gc.cra.courier.config.ConfigValues.parseBoolean;
import static ca.gc.cra.courier.config.ConfigValues.parseDouble;
import static ca.gc.cra.courier.config.ConfigValues.parseInt;
import static ca.gc.cra.courier.config.ConfigValues.parseLong;
import static ca.gc.cra.courier.config.ConfigValues.required;

import ca.gc.cra.courier.application.pipeline.OrchestratorSettings;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.net.Destination;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.domain.net.FragmentFrame;
import ca.gc.cra.courier.infrastructure.net.LinkProfile;
import ca.gc.cra.courier.validation.ConfigurationException;
import ca.gc.cra.courier.validation.Numbers;
import ca.gc.cra.courier.validation.Strings;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed configuration of a {@code simulate} run.
 * <p><strong>Why:</strong> Validates every tunable once, before any component is built, so that invalid values fail
 * with a {@link ConfigurationException} instead of mid-run.</p>
 * <p><strong>Role:</strong> Built from the merged flat map (CLI &gt; YAML &gt; defaults) and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param classes active destination classes in submission order
 * @param fragmentSize bytes per fragment
 * @param dataRateBps pacing rate
 * @param linkRateBps link bandwidth
 * @param linkDelayNanos link propagation delay
 * @param linkQueueBytes link transmit queue limit
 * @param lossRate independent frame loss probability
 * @param seed loss generator seed
 * @param confidenceThreshold classifier distance threshold
 * @param fallbackClass optional fallback class
 * @param simulationTimeNanos run horizon
 * @param imageSize synthetic payload size
 * @param imagesPerClass synthetic payloads per class
 * @param imageDir optional directory of images used instead of synthetic payloads
 * @param startTimeNanos start time of the first payload
 * @param staggerNanos offset between payload starts
 * @param originAddress origin address
 * @param port destination port
 * @param backpressureRetryNanos retry delay after backpressure; {@code 0} derives it from the link rate
 * @param classifierScript optional scripted classifier results ({@code CLASS:score,...})
 * @param report optional JSON report path
 * @param dryRun whether to print the plan without running
 * @since 0.1.0
 */
public record SimulationConfig(
    List<DestinationClass> classes,
    int fragmentSize,
    long dataRateBps,
    long linkRateBps,
    long linkDelayNanos,
    int linkQueueBytes,
    double lossRate,
    long seed,
    double confidenceThreshold,
    Optional<DestinationClass> fallbackClass,
    long simulationTimeNanos,
    int imageSize,
    int imagesPerClass,
    Optional<Path> imageDir,
    long startTimeNanos,
    long staggerNanos,
    String originAddress,
    int port,
    long backpressureRetryNanos,
    Optional<String> classifierScript,
    Optional<Path> report,
    boolean dryRun) {

  /**
   * Validates cross-field invariants.
   *
   * @throws ConfigurationException if any value is out of range
   */
  public SimulationConfig {
    classes = List.copyOf(Objects.requireNonNull(classes, "classes"));
    Objects.requireNonNull(fallbackClass, "fallbackClass");
    Objects.requireNonNull(imageDir, "imageDir");
    Objects.requireNonNull(classifierScript, "classifierScript");
    Objects.requireNonNull(report, "report");
    if (classes.isEmpty()) {
      throw new ConfigurationException("classes must name at least one destination class");
    }
    Numbers.requireRange("fragmentSize", fragmentSize, 1, 65_507 - FragmentFrame.HEADER_BYTES);
    Numbers.requirePositive("dataRate", dataRateBps);
    Numbers.requirePositive("linkRate", linkRateBps);
    Numbers.requireRange("linkDelay", linkDelayNanos, 0, Long.MAX_VALUE);
    Numbers.requirePositive("linkQueueBytes", linkQueueBytes);
    Numbers.requireRange("lossRate", lossRate, 0.0, 1.0);
    if (!Double.isFinite(confidenceThreshold) || confidenceThreshold <= 0) {
      throw new ConfigurationException("confidenceThreshold must be a positive number (was " + confidenceThreshold + ")");
    }
    if (fallbackClass.isPresent() && !classes.contains(fallbackClass.get())) {
      throw new ConfigurationException("fallbackClass " + fallbackClass.get() + " is not among the active classes");
    }
    Numbers.requirePositive("simulationTime", simulationTimeNanos);
    Numbers.requireRange("imageSize", imageSize, 0, Integer.MAX_VALUE);
    Numbers.requirePositive("imagesPerClass", imagesPerClass);
    int capacity = OrchestratorSettings.sourcePortCapacity(OrchestratorSettings.DEFAULT_FIRST_SOURCE_PORT);
    if (imageDir.isEmpty() && (long) imagesPerClass * classes.size() > capacity) {
      throw new ConfigurationException("imagesPerClass " + imagesPerClass + " x " + classes.size()
          + " classes exceeds the " + capacity + " payloads one run can carry");
    }
    Numbers.requireRange("startTime", startTimeNanos, 0, Long.MAX_VALUE);
    Numbers.requireRange("stagger", staggerNanos, 0, Long.MAX_VALUE);
    originAddress = Strings.requireNonBlank("originAddress", originAddress);
    Numbers.requireRange("port", port, 1, 65_535);
    Numbers.requireRange("backpressureRetry", backpressureRetryNanos, 0, Long.MAX_VALUE);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return configuration equivalent to running {@code simulate} with no arguments
   */
  public static SimulationConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap("simulate"));
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param args merged configuration
   * @return validated configuration
   * @throws ConfigurationException if a key is missing or invalid
   */
  public static SimulationConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    List<DestinationClass> classes = ConfigValues.parseClasses(args.get("classes"));
    return new SimulationConfig(
        classes,
        parseInt(args, "fragmentSize"),
        Units.parseRate("dataRate", args.get("dataRate")),
        Units.parseRate("linkRate", args.get("linkRate")),
        Units.parseDurationNanos("linkDelay", args.get("linkDelay")),
        parseInt(args, "linkQueueBytes"),
        parseDouble(args, "lossRate"),
        parseLong(args, "seed"),
        parseDouble(args, "confidenceThreshold"),
        ConfigValues.parseFallback(args.get("fallbackClass"), classes),
        Units.parseDurationNanos("simulationTime", args.get("simulationTime")),
        parseInt(args, "imageSize"),
        parseInt(args, "imagesPerClass"),
        optionalPath(args.get("imageDir")),
        Units.parseDurationNanos("startTime", args.get("startTime")),
        Units.parseDurationNanos("stagger", args.get("stagger")),
        required(args, "originAddress"),
        parseInt(args, "port"),
        optionalString(args.get("backpressureRetry"))
            .map(v -> Units.parseDurationNanos("backpressureRetry", v))
            .orElse(0L),
        optionalString(args.get("classifierScript")),
        optionalPath(args.get("report")),
        parseBoolean(args.get("dryRun"), false));
  }

  /**
   * Link characteristics shared by every destination link.
   *
   * @return link profile
   */
  public LinkProfile linkProfile() {
    return new LinkProfile(linkRateBps, linkDelayNanos, linkQueueBytes, lossRate,
        LinkProfile.DEFAULT_OVERHEAD_BYTES);
  }

  /**
   * Destination endpoint of a class: {@code 10.1.<ordinal + 1>.2:<port>}.
   *
   * @param cls named class
   * @return endpoint
   */
  public Endpoint endpointFor(DestinationClass cls) {
    return endpointFor(cls, port);
  }

  /**
   * Destination of every active class.
   *
   * @return new map in class order
   */
  public Map<DestinationClass, Destination> destinations() {
    return destinationsFor(classes, port);
  }

  /**
   * Destination of every listed class on the given port.
   *
   * @param classes named classes
   * @param port destination port
   * @return new map in class order
   */
  public static Map<DestinationClass, Destination> destinationsFor(List<DestinationClass> classes, int port) {
    Map<DestinationClass, Destination> out = new EnumMap<>(DestinationClass.class);
    for (DestinationClass cls : classes) {
      out.put(cls, new Destination(cls, endpointFor(cls, port)));
    }
    return out;
  }

  private static Endpoint endpointFor(DestinationClass cls, int port) {
    return new Endpoint("10.1." + (cls.ordinal() + 1) + ".2", port);
  }

  /**
   * Retry delay after backpressure. When not configured, one full-size frame's transmission time on the link.
   *
   * @return nanoseconds; at least 1
   */
  public long effectiveBackpressureRetryNanos() {
    if (backpressureRetryNanos > 0) {
      return backpressureRetryNanos;
    }
    int wireBytes = fragmentSize + FragmentFrame.HEADER_BYTES + LinkProfile.DEFAULT_OVERHEAD_BYTES;
    return Math.max(1L, linkProfile().transmissionNanos(wireBytes));
  }
}
