package ca.gc.cra.courier.domain.flow;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Mutable per-flow aggregate of fragment send and receive events.
 * <p><strong>Why:</strong> Keeps the counters needed to derive delay, throughput, and loss without retaining payload bytes.</p>
 * <p><strong>Role:</strong> Domain aggregate owned by the delivery tracker; one instance per {@link FlowKey}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Remember the send time of every outstanding sequence number.</li>
 *   <li>Reject sends that do not advance the sequence and receives with no matching send.</li>
 *   <li>Produce immutable {@link FlowStatistics} snapshots.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the simulation thread.</p>
 *
 * @since 0.1.0
 */
public final class FlowRecord {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final FlowKey key;
  private final Map<Integer, Long> outstandingSends = new HashMap<>();
  private long sent;
  private long received;
  private long bytesSent;
  private long bytesReceived;
  private long delaySumNanos;
  private long firstSendNanos = -1L;
  private long lastReceiveNanos = -1L;
  private int highestSequence = -1;

  /**
   * Creates an empty record.
   *
   * @param key flow identity; must not be {@code null}
   */
  public FlowRecord(FlowKey key) {
    this.key = Objects.requireNonNull(key, "key");
  }

  /**
   * Returns the flow identity.
   *
   * @return flow key
   */
  public FlowKey key() {
    return key;
  }

  /**
   * Registers a fragment handed to the transport.
   *
   * @param sequence fragment sequence number
   * @param sentNanos virtual send time
   * @param sizeBytes fragment payload size
   * @throws StatsInconsistencyException if {@code sequence} does not exceed every previously sent sequence
   */
  public void registerSend(int sequence, long sentNanos, int sizeBytes) throws StatsInconsistencyException {
    if (sequence <= highestSequence) {
      throw new StatsInconsistencyException(key, sequence,
          "send of sequence " + sequence + " does not advance past " + highestSequence);
    }
    highestSequence = sequence;
    outstandingSends.put(sequence, sentNanos);
    sent++;
    bytesSent += sizeBytes;
    if (firstSendNanos < 0 || sentNanos < firstSendNanos) {
      firstSendNanos = sentNanos;
    }
  }

  /**
   * Registers an arrival and consumes the matching send.
   *
   * @param sequence fragment sequence number
   * @param receivedNanos virtual arrival time
   * @param sizeBytes fragment payload size
   * @return one-way delay in nanoseconds
   * @throws StatsInconsistencyException if no outstanding send matches {@code sequence}
   */
  public long registerReceive(int sequence, long receivedNanos, int sizeBytes) throws StatsInconsistencyException {
    Long sentNanos = outstandingSends.remove(sequence);
    if (sentNanos == null) {
      throw new StatsInconsistencyException(key, sequence,
          "receive of sequence " + sequence + " has no outstanding send");
    }
    long delay = receivedNanos - sentNanos;
    received++;
    bytesReceived += sizeBytes;
    delaySumNanos += delay;
    if (receivedNanos > lastReceiveNanos) {
      lastReceiveNanos = receivedNanos;
    }
    return delay;
  }

  /**
   * Fragments sent so far.
   *
   * @return send count
   */
  public long sent() {
    return sent;
  }

  /**
   * Fragments received so far.
   *
   * @return receive count
   */
  public long received() {
    return received;
  }

  /**
   * Derives the current statistics. Calling this does not change the record.
   *
   * @return immutable snapshot
   */
  public FlowStatistics toStatistics() {
    double meanDelay = received == 0 ? Double.NaN : (double) delaySumNanos / received;
    double throughput = Double.NaN;
    if (received > 0) {
      long duration = lastReceiveNanos - firstSendNanos;
      if (duration > 0) {
        throughput = bytesReceived * 8.0 / (duration / NANOS_PER_SECOND);
      }
    }
    double loss = sent == 0 ? 0.0 : (double) (sent - received) / sent;
    return new FlowStatistics(key, sent, received, bytesSent, bytesReceived, meanDelay, throughput, loss);
  }
}
