package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.payload.PayloadState;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of what happened to one payload during a run.
 *
 * @param tag payload tag
 * @param label payload label
 * @param length payload length in bytes
 * @param classifiedAs class reported by the classifier; {@code null} while classifying
 * @param score classifier distance; NaN while classifying
 * @param reason binding reason; {@code null} while classifying
 * @param boundTo class whose destination received the payload; {@code null} when dropped or classifying
 * @param state final lifecycle state
 * @param fragmentsPlanned fragments the pacer planned
 * @param fragmentsSent fragments handed to the transport
 * @param backpressureEvents transport refusals
 * @param interrupted whether the run stopped before completion
 * @param statistics flow statistics; {@code null} when the payload never got a flow
 * @since 0.1.0
 */
public record PayloadOutcome(
    int tag,
    String label,
    int length,
    DestinationClass classifiedAs,
    double score,
    BindingDecision.Reason reason,
    DestinationClass boundTo,
    PayloadState state,
    int fragmentsPlanned,
    int fragmentsSent,
    long backpressureEvents,
    boolean interrupted,
    FlowStatistics statistics) {

  /**
   * Validates required components.
   *
   * @throws NullPointerException if {@code label} or {@code state} is {@code null}
   */
  public PayloadOutcome {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(state, "state");
  }

  /**
   * Flow statistics, if any.
   *
   * @return statistics or empty
   */
  public Optional<FlowStatistics> flowStatistics() {
    return Optional.ofNullable(statistics);
  }
}
