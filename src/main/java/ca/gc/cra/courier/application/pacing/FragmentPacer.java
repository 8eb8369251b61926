package ca.gc.cra.courier.application.pacing;

import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.domain.payload.Fragment;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits payloads into fixed-size fragments and assigns each a paced send time.
 * <p><strong>Why:</strong> Delivery must respect a target rate regardless of payload size.</p>
 * <p><strong>Role:</strong> Stateless application service; the orchestrator sends what it plans.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Partition {@code [0, L)} into {@code ceil(L / S)} ranges where only the last may be short.</li>
 *   <li>Schedule fragment {@code i} at {@code start + bits(0..i-1) * 1e9 / R} nanoseconds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 * <p><strong>Performance:</strong> O(n) in the fragment count. Send times derive from the cumulative bit count, so
 * integer rounding never accumulates across fragments.</p>
 * <p><strong>Observability:</strong> Records {@code pacer.fragments} per planned payload.</p>
 *
 * @implNote The pacer is open-loop. It never advances time and never reacts to congestion; transport
 * backpressure is handled by the orchestrator.
 * @since 0.1.0
 */
public final class FragmentPacer {
  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final BigInteger BIG_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);

  private final int fragmentSize;
  private final long rateBitsPerSecond;
  private final MetricsPort metrics;

  /**
   * Creates a pacer.
   *
   * @param fragmentSize bytes per fragment; must be positive
   * @param rateBitsPerSecond pacing rate; must be positive
   * @param metrics metrics sink
   * @throws ConfigurationException if the size or rate is not positive
   */
  public FragmentPacer(int fragmentSize, long rateBitsPerSecond, MetricsPort metrics) {
    if (fragmentSize <= 0) {
      throw new ConfigurationException("fragmentSize must be positive (was " + fragmentSize + ")");
    }
    if (rateBitsPerSecond <= 0) {
      throw new ConfigurationException("dataRate must be positive (was " + rateBitsPerSecond + " bps)");
    }
    this.fragmentSize = fragmentSize;
    this.rateBitsPerSecond = rateBitsPerSecond;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Computes the fragment plan for a payload.
   *
   * @param payload payload to fragment
   * @param startNanos virtual time of the first fragment; must be non-negative
   * @return schedule; empty for a zero-length payload
   * @throws IllegalArgumentException if {@code startNanos} is negative
   */
  public FragmentSchedule schedule(Payload payload, long startNanos) {
    Objects.requireNonNull(payload, "payload");
    if (startNanos < 0) {
      throw new IllegalArgumentException("startNanos must be non-negative (was " + startNanos + ")");
    }
    int length = payload.length();
    int count = fragmentCount(length);
    List<Fragment> fragments = new ArrayList<>(count);
    long cumulativeBits = 0;
    for (int i = 0; i < count; i++) {
      int offset = i * fragmentSize;
      int size = Math.min(fragmentSize, length - offset);
      fragments.add(new Fragment(payload.tag(), i, offset, size, startNanos + nanosFor(cumulativeBits)));
      cumulativeBits += size * 8L;
    }
    metrics.observe("pacer.fragments", count);
    return new FragmentSchedule(payload.tag(), startNanos, startNanos + nanosFor(cumulativeBits), fragments);
  }

  /**
   * Number of fragments a payload of the given length produces.
   *
   * @param length payload length in bytes; must be non-negative
   * @return {@code ceil(length / fragmentSize)}
   */
  public int fragmentCount(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must be non-negative (was " + length + ")");
    }
    return (int) (((long) length + fragmentSize - 1) / fragmentSize);
  }

  /**
   * Time needed to pace out the given number of bits.
   *
   * @param bits bit count
   * @return nanoseconds, floored
   */
  public long nanosFor(long bits) {
    try {
      return Math.multiplyExact(bits, NANOS_PER_SECOND) / rateBitsPerSecond;
    } catch (ArithmeticException overflow) {
      return BigInteger.valueOf(bits)
          .multiply(BIG_NANOS_PER_SECOND)
          .divide(BigInteger.valueOf(rateBitsPerSecond))
          .longValueExact();
    }
  }

  /**
   * Configured fragment size.
   *
   * @return bytes per fragment
   */
  public int fragmentSize() {
    return fragmentSize;
  }

  /**
   * Configured pacing rate.
   *
   * @return bits per second
   */
  public long rateBitsPerSecond() {
    return rateBitsPerSecond;
  }
}
