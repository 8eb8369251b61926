package ca.gc.cra.courier.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SimulationConfigTest {

  @Test
  void defaultsDescribeFiveClassRun() {
    SimulationConfig config = SimulationConfig.defaults();

    assertEquals(List.copyOf(DestinationClass.named()), config.classes());
    assertEquals(1024, config.fragmentSize());
    assertEquals(1_000_000L, config.dataRateBps());
    assertEquals(5_000_000L, config.linkRateBps());
    assertEquals(2_000_000L, config.linkDelayNanos());
    assertEquals(100.0, config.confidenceThreshold());
    assertTrue(config.fallbackClass().isEmpty());
    assertEquals(10_000_000_000L, config.simulationTimeNanos());
    assertEquals(2_000_000_000L, config.startTimeNanos());
    assertEquals(500_000_000L, config.staggerNanos());
    assertTrue(config.imageDir().isEmpty());
    assertTrue(config.report().isEmpty());
  }

  @Test
  void destinationsUseOneSubnetPerClass() {
    SimulationConfig config = SimulationConfig.defaults();

    assertEquals(new Endpoint("10.1.1.2", 9), config.endpointFor(DestinationClass.MESSI));
    assertEquals(new Endpoint("10.1.5.2", 9), config.destinations().get(DestinationClass.HAALAND).endpoint());
    assertEquals(5, config.destinations().size());
  }

  @Test
  void parsesOverridesFromFlatMap() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap("simulate"));
    args.put("classes", "Messi, neymar");
    args.put("fallbackClass", "NEYMAR");
    args.put("fragmentSize", "500");
    args.put("dataRate", "2Mbps");
    args.put("imageDir", "/tmp/images");
    args.put("report", "out/report.json");
    args.put("backpressureRetry", "3ms");

    SimulationConfig config = SimulationConfig.fromMap(args);

    assertEquals(List.of(DestinationClass.MESSI, DestinationClass.NEYMAR), config.classes());
    assertEquals(Optional.of(DestinationClass.NEYMAR), config.fallbackClass());
    assertEquals(500, config.fragmentSize());
    assertEquals(2_000_000L, config.dataRateBps());
    assertEquals(Optional.of(Path.of("/tmp/images")), config.imageDir());
    assertEquals(Optional.of(Path.of("out/report.json")), config.report());
    assertEquals(3_000_000L, config.effectiveBackpressureRetryNanos());
  }

  @Test
  void retryDefaultsToOneFrameTransmissionTime() {
    // (1024 payload + 12 header + 30 link overhead) bytes at 5 Mbps.
    assertEquals(1_705_600L, SimulationConfig.defaults().effectiveBackpressureRetryNanos());
  }

  @Test
  void zeroFragmentSizeIsAConfigurationError() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap("simulate"));
    args.put("fragmentSize", "0");

    assertThrows(ConfigurationException.class, () -> SimulationConfig.fromMap(args));
  }

  @Test
  void rejectsInvalidValues() {
    assertInvalid("classes", "Messi,Pele");
    assertInvalid("classes", "Messi,messi");
    assertInvalid("classes", "Unknown");
    assertInvalid("fallbackClass", "Haaland,");
    assertInvalid("confidenceThreshold", "0");
    assertInvalid("confidenceThreshold", "abc");
    assertInvalid("lossRate", "1.5");
    assertInvalid("dataRate", "0bps");
    assertInvalid("port", "0");
    assertInvalid("originAddress", " ");
  }

  @Test
  void fallbackMustBeActive() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap("simulate"));
    args.put("classes", "Messi");
    args.put("fallbackClass", "Ronaldo");

    assertThrows(ConfigurationException.class, () -> SimulationConfig.fromMap(args));
  }

  @Test
  void syntheticPayloadCountIsBoundedBySourcePorts() {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap("simulate"));
    args.put("imagesPerClass", "3276");
    assertEquals(3276, SimulationConfig.fromMap(args).imagesPerClass());

    args.put("imagesPerClass", "3300");
    ConfigurationException ex = assertThrows(ConfigurationException.class, () -> SimulationConfig.fromMap(args));
    assertTrue(ex.getMessage().contains("16384"), ex.getMessage());

    args.put("classes", "Messi");
    assertEquals(3300, SimulationConfig.fromMap(args).imagesPerClass());
  }

  private static void assertInvalid(String key, String value) {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap("simulate"));
    args.put(key, value);
    assertThrows(ConfigurationException.class, () -> SimulationConfig.fromMap(args), key + "=" + value);
  }
}
