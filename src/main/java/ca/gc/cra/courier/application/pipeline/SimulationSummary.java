package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.stats.ClassStatisticsAggregator;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.payload.PayloadState;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one complete run.
 *
 * @param horizonNanos virtual time the run was driven to
 * @param eventsExecuted scheduler events executed
 * @param droppedCount payloads dropped by the binding
 * @param inconsistencyCount arrivals the tracker could not reconcile
 * @param payloads per-payload outcomes in submission order
 * @param flows per-flow statistics in first-send order
 * @param classes per-class statistics in class order
 * @since 0.1.0
 */
public record SimulationSummary(
    long horizonNanos,
    long eventsExecuted,
    long droppedCount,
    long inconsistencyCount,
    List<PayloadOutcome> payloads,
    List<FlowStatistics> flows,
    Map<DestinationClass, ClassStatistics> classes) {

  /**
   * Copies the collections.
   */
  public SimulationSummary {
    payloads = List.copyOf(payloads);
    flows = List.copyOf(flows);
    classes = Collections.unmodifiableMap(classes.isEmpty()
        ? new EnumMap<>(DestinationClass.class)
        : new EnumMap<>(classes));
  }

  /**
   * Counts payloads by final state.
   *
   * @param state lifecycle state
   * @return number of payloads in that state
   */
  public long countInState(PayloadState state) {
    return payloads.stream().filter(p -> p.state() == state).count();
  }

  /**
   * Payloads whose delivery was cut short by the horizon.
   *
   * @return interrupted count
   */
  public long interruptedCount() {
    return payloads.stream().filter(PayloadOutcome::interrupted).count();
  }

  /**
   * Fragments sent over all flows.
   *
   * @return send count
   */
  public long totalSent() {
    return flows.stream().mapToLong(FlowStatistics::sent).sum();
  }

  /**
   * Fragments received over all flows.
   *
   * @return receive count
   */
  public long totalReceived() {
    return flows.stream().mapToLong(FlowStatistics::received).sum();
  }

  /**
   * Unweighted mean of the flow mean delays; NaN when no flow received anything.
   *
   * @return nanoseconds
   */
  public double meanFlowDelayNanos() {
    return ClassStatisticsAggregator.mean(flows, FlowStatistics::meanDelayNanos);
  }

  /**
   * Unweighted mean of the defined flow throughputs.
   *
   * @return bits per second, or NaN
   */
  public double meanFlowThroughputBps() {
    return ClassStatisticsAggregator.mean(flows, FlowStatistics::throughputBps);
  }

  /**
   * Unweighted mean of the flow loss ratios; NaN when there are no flows.
   *
   * @return ratio in [0, 1]
   */
  public double meanFlowLossRatio() {
    return ClassStatisticsAggregator.mean(flows, FlowStatistics::lossRatio);
  }
}
