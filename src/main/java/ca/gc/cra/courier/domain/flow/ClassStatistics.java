package ca.gc.cra.courier.domain.flow;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import java.util.Objects;

/**
 * Per destination class roll-up of flow statistics.
 *
 * <p>Mean values are unweighted means over the flows of the class; flows whose value is undefined
 * are left out, and a class without any defined value reports {@link Double#NaN}.</p>
 *
 * @param destinationClass class the flows were bound to
 * @param assigned payloads the binding assigned to this class
 * @param flows number of flows aggregated
 * @param sent total fragments sent
 * @param received total fragments received
 * @param meanDelayNanos mean of per-flow mean delays
 * @param throughputBps mean of per-flow throughputs
 * @param lossRatio mean of per-flow loss ratios
 * @since 0.1.0
 */
public record ClassStatistics(
    DestinationClass destinationClass,
    long assigned,
    int flows,
    long sent,
    long received,
    double meanDelayNanos,
    double throughputBps,
    double lossRatio) {

  /**
   * Validates the class.
   *
   * @throws NullPointerException if {@code destinationClass} is {@code null}
   */
  public ClassStatistics {
    Objects.requireNonNull(destinationClass, "destinationClass");
  }
}
