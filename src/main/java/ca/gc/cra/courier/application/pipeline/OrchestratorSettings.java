package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.validation.ConfigurationException;
import ca.gc.cra.courier.validation.Strings;

/**
 * Tunables of a {@link DeliveryOrchestrator}.
 *
 * @param originAddress address of the origin; each payload gets its own port on it
 * @param firstSourcePort port allocated to the first payload; later payloads take the following ports
 * @param backpressureRetryNanos delay before a fragment refused by the transport is offered again
 * @since 0.1.0
 */
public record OrchestratorSettings(String originAddress, int firstSourcePort, long backpressureRetryNanos) {
  /** First port of the dynamic range, used for per-payload source endpoints. */
  public static final int DEFAULT_FIRST_SOURCE_PORT = 49_152;

  /**
   * Validates the settings.
   *
   * @throws ConfigurationException if the port or retry delay is out of range
   */
  public OrchestratorSettings {
    originAddress = Strings.requireNonBlank("originAddress", originAddress);
    if (firstSourcePort < 1 || firstSourcePort > 65_535) {
      throw new ConfigurationException("firstSourcePort must be between 1 and 65535 (was " + firstSourcePort + ")");
    }
    if (backpressureRetryNanos <= 0) {
      throw new ConfigurationException("backpressureRetry must be positive (was " + backpressureRetryNanos + "ns)");
    }
  }

  /**
   * Number of payloads that can be given a source port, from {@code firstSourcePort} through 65535.
   *
   * @param firstSourcePort first allocated port
   * @return port count
   */
  public static int sourcePortCapacity(int firstSourcePort) {
    return 65_536 - firstSourcePort;
  }

  /**
   * Number of payloads one orchestrator with these settings can carry.
   *
   * @return port count
   */
  public int sourcePortCapacity() {
    return sourcePortCapacity(firstSourcePort);
  }
}
