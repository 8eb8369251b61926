package ca.gc.cra.courier.application.stats;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import java.util.Collection;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Rolls flow statistics up into per-class statistics.
 *
 * <p>Each mean is the unweighted arithmetic mean over the flows of the class. NaN flow values are skipped;
 * a statistic with no defined value stays NaN.</p>
 *
 * @since 0.1.0
 */
public final class ClassStatisticsAggregator {
  private ClassStatisticsAggregator() {
    // Utility
  }

  /**
   * Aggregates the flows of one class.
   *
   * @param cls destination class
   * @param assigned payloads the binding assigned to the class
   * @param flows statistics of the class's flows
   * @return class statistics
   */
  public static ClassStatistics aggregate(
      DestinationClass cls, long assigned, Collection<FlowStatistics> flows) {
    Objects.requireNonNull(cls, "cls");
    Objects.requireNonNull(flows, "flows");
    long sent = 0;
    long received = 0;
    for (FlowStatistics flow : flows) {
      sent += flow.sent();
      received += flow.received();
    }
    return new ClassStatistics(
        cls,
        assigned,
        flows.size(),
        sent,
        received,
        mean(flows, FlowStatistics::meanDelayNanos),
        mean(flows, FlowStatistics::throughputBps),
        mean(flows, FlowStatistics::lossRatio));
  }

  /**
   * Unweighted mean of a flow statistic, skipping NaN values.
   *
   * @param flows flows to average
   * @param extractor statistic to read
   * @return mean, or NaN when no flow defines the statistic
   */
  public static double mean(Collection<FlowStatistics> flows, ToDoubleFunction<FlowStatistics> extractor) {
    double sum = 0;
    int defined = 0;
    for (FlowStatistics flow : flows) {
      double value = extractor.applyAsDouble(flow);
      if (!Double.isNaN(value)) {
        sum += value;
        defined++;
      }
    }
    return defined == 0 ? Double.NaN : sum / defined;
  }
}
