package ca.gc.cra.courier.application.stats;

import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.domain.flow.FlowKey;
import ca.gc.cra.courier.domain.flow.FlowRecord;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.flow.StatsInconsistencyException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Correlates fragment sends with arrivals per flow and derives delivery statistics.
 * <p><strong>Why:</strong> Delay, throughput, and loss are only meaningful when every arrival is matched to the
 * send that produced it.</p>
 * <p><strong>Role:</strong> Application service owned by one run; fed by the orchestrator on both sides.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create a {@link FlowRecord} lazily on the first send of a flow.</li>
 *   <li>Reject arrivals with no matching send, and sends that do not advance the sequence.</li>
 *   <li>Produce statistics on demand without mutating the records.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the simulation thread.</p>
 * <p><strong>Observability:</strong> Increments {@code tracker.receive} and {@code tracker.inconsistency}; records
 * {@code tracker.delayNanos}. Inconsistencies are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryTracker {
  private static final Logger log = LoggerFactory.getLogger(DeliveryTracker.class);

  private final MetricsPort metrics;
  private final Map<FlowKey, FlowRecord> flows = new LinkedHashMap<>();
  private long inconsistencies;

  /**
   * Creates an empty tracker.
   *
   * @param metrics metrics sink
   */
  public DeliveryTracker(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a flow without recording a send, so that flows of zero-length payloads appear in reports.
   *
   * @param key flow identity
   */
  public void openFlow(FlowKey key) {
    flows.computeIfAbsent(Objects.requireNonNull(key, "key"), FlowRecord::new);
  }

  /**
   * Records a fragment handed to the transport.
   *
   * @param key flow identity
   * @param sequence fragment sequence number
   * @param sentNanos virtual send time
   * @param sizeBytes fragment payload size
   * @return {@code false} when the send was rejected as inconsistent
   */
  public boolean recordSend(FlowKey key, int sequence, long sentNanos, int sizeBytes) {
    FlowRecord flow = flows.computeIfAbsent(Objects.requireNonNull(key, "key"), FlowRecord::new);
    try {
      flow.registerSend(sequence, sentNanos, sizeBytes);
      return true;
    } catch (StatsInconsistencyException ex) {
      inconsistent(ex);
      return false;
    }
  }

  /**
   * Records an arrival.
   *
   * @param key flow identity
   * @param sequence fragment sequence number
   * @param receivedNanos virtual arrival time
   * @param sizeBytes fragment payload size
   * @return {@code false} when the arrival matched no outstanding send and was dropped
   */
  public boolean recordReceive(FlowKey key, int sequence, long receivedNanos, int sizeBytes) {
    Objects.requireNonNull(key, "key");
    FlowRecord flow = flows.get(key);
    try {
      if (flow == null) {
        throw new StatsInconsistencyException(key, sequence, "receive on unknown flow");
      }
      long delay = flow.registerReceive(sequence, receivedNanos, sizeBytes);
      metrics.increment("tracker.receive");
      metrics.observe("tracker.delayNanos", delay);
      return true;
    } catch (StatsInconsistencyException ex) {
      inconsistent(ex);
      return false;
    }
  }

  /**
   * Computes the statistics of one flow. Idempotent; may be called while the run is active.
   *
   * @param key flow identity
   * @return statistics snapshot
   * @throws IllegalArgumentException if the flow is unknown
   */
  public FlowStatistics finalizeFlow(FlowKey key) {
    FlowRecord flow = flows.get(Objects.requireNonNull(key, "key"));
    if (flow == null) {
      throw new IllegalArgumentException("Unknown flow " + key);
    }
    return flow.toStatistics();
  }

  /**
   * Known flows in first-seen order.
   *
   * @return unmodifiable view
   */
  public Set<FlowKey> flowKeys() {
    return Collections.unmodifiableSet(flows.keySet());
  }

  /**
   * Statistics of every known flow in first-seen order.
   *
   * @return new list of snapshots
   */
  public List<FlowStatistics> snapshot() {
    List<FlowStatistics> out = new ArrayList<>(flows.size());
    for (FlowRecord flow : flows.values()) {
      out.add(flow.toStatistics());
    }
    return out;
  }

  /**
   * Number of rejected events.
   *
   * @return inconsistency count
   */
  public long inconsistencyCount() {
    return inconsistencies;
  }

  private void inconsistent(StatsInconsistencyException ex) {
    inconsistencies++;
    metrics.increment("tracker.inconsistency");
    log.warn("Stats inconsistency on flow {} seq {}: {}", ex.flowKey(), ex.sequence(), ex.getMessage());
  }
}
