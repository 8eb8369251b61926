package ca.gc.cra.courier.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void simulateIncludesCommonAndLinkDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("simulate");

    assertEquals("MESSI,RONALDO,NEYMAR,MBAPPE,HAALAND", defaults.get("classes"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("5Mbps", defaults.get("linkRate"));
    assertEquals("9", defaults.get("port"));
  }

  @Test
  void classifyOmitsSimulationKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("CLASSIFY");

    assertTrue(defaults.containsKey("imageDir"));
    assertTrue(defaults.containsKey("confidenceThreshold"));
    assertTrue(!defaults.containsKey("linkRate"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("replay"));
  }
}
