package ca.gc.cra.courier.infrastructure.net;

import ca.gc.cra.courier.validation.ConfigurationException;

/**
 * Characteristics shared by every point-to-point link of a run.
 *
 * @param bandwidthBitsPerSecond serialization rate of the link
 * @param propagationDelayNanos one-way propagation delay
 * @param queueLimitBytes bytes a link may hold in transmission before refusing further frames
 * @param lossRate independent drop probability per frame, {@code [0, 1]}
 * @param overheadBytes per-frame lower-layer overhead added to the wire size
 * @since 0.1.0
 */
public record LinkProfile(
    long bandwidthBitsPerSecond,
    long propagationDelayNanos,
    int queueLimitBytes,
    double lossRate,
    int overheadBytes) {
  /** UDP (8), IPv4 (20), and PPP (2) header bytes. */
  public static final int DEFAULT_OVERHEAD_BYTES = 30;

  /**
   * Validates the profile.
   *
   * @throws ConfigurationException if any value is out of range
   */
  public LinkProfile {
    if (bandwidthBitsPerSecond <= 0) {
      throw new ConfigurationException("linkRate must be positive (was " + bandwidthBitsPerSecond + " bps)");
    }
    if (propagationDelayNanos < 0) {
      throw new ConfigurationException("linkDelay must be non-negative (was " + propagationDelayNanos + "ns)");
    }
    if (queueLimitBytes <= 0) {
      throw new ConfigurationException("linkQueueBytes must be positive (was " + queueLimitBytes + ")");
    }
    if (!(lossRate >= 0.0 && lossRate <= 1.0)) {
      throw new ConfigurationException("lossRate must be between 0 and 1 (was " + lossRate + ")");
    }
    if (overheadBytes < 0) {
      throw new ConfigurationException("overheadBytes must be non-negative (was " + overheadBytes + ")");
    }
  }

  /**
   * Time the link needs to serialize a frame.
   *
   * @param wireBytes frame size including overhead
   * @return nanoseconds, floored
   */
  public long transmissionNanos(int wireBytes) {
    return wireBytes * 8L * 1_000_000_000L / bandwidthBitsPerSecond;
  }
}
