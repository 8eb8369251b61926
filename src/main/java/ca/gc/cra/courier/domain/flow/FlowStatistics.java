package ca.gc.cra.courier.domain.flow;

import java.util.Objects;

/**
 * Immutable snapshot of one flow's delivery statistics.
 *
 * <p>Undefined values are {@link Double#NaN}: the mean delay when nothing was received, the
 * throughput when nothing was received or the send-to-receive span is not positive. Loss is
 * {@code 0} when nothing was sent.</p>
 *
 * @param key flow identity
 * @param sent fragments sent
 * @param received fragments received
 * @param bytesSent fragment payload bytes sent
 * @param bytesReceived fragment payload bytes received
 * @param meanDelayNanos mean one-way delay in nanoseconds
 * @param throughputBps received bits per second between first send and last receive
 * @param lossRatio {@code (sent - received) / sent}
 * @since 0.1.0
 */
public record FlowStatistics(
    FlowKey key,
    long sent,
    long received,
    long bytesSent,
    long bytesReceived,
    double meanDelayNanos,
    double throughputBps,
    double lossRatio) {

  /**
   * Validates the key.
   *
   * @throws NullPointerException if {@code key} is {@code null}
   */
  public FlowStatistics {
    Objects.requireNonNull(key, "key");
  }

  /**
   * Indicates whether a mean delay is defined.
   *
   * @return {@code true} when at least one fragment was received
   */
  public boolean hasMeanDelay() {
    return !Double.isNaN(meanDelayNanos);
  }
}
