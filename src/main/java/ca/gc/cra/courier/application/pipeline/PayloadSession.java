package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.pacing.FragmentSchedule;
import ca.gc.cra.courier.application.port.EventHandle;
import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.domain.flow.FlowKey;
import ca.gc.cra.courier.domain.net.Destination;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.domain.payload.PayloadState;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle of one submitted payload inside a {@link DeliveryOrchestrator}.
 *
 * <p>Confined to the simulation thread. Mutators are package-private; callers outside the orchestrator only read.</p>
 *
 * @since 0.1.0
 */
public final class PayloadSession {
  private final Payload payload;
  private final long submittedStartNanos;
  private PayloadState state = PayloadState.CLASSIFYING;
  private BindingDecision decision;
  private FlowKey flowKey;
  private FragmentSchedule schedule;
  private EventHandle pending;
  private int nextFragment;
  private long backpressureEvents;
  private long completedNanos = -1L;
  private boolean interrupted;

  PayloadSession(Payload payload, long submittedStartNanos) {
    this.payload = Objects.requireNonNull(payload, "payload");
    this.submittedStartNanos = submittedStartNanos;
  }

  /**
   * Payload being delivered.
   *
   * @return payload
   */
  public Payload payload() {
    return payload;
  }

  /**
   * Virtual time the payload was submitted for.
   *
   * @return nanoseconds
   */
  public long submittedStartNanos() {
    return submittedStartNanos;
  }

  /**
   * Current lifecycle state.
   *
   * @return state
   */
  public PayloadState state() {
    return state;
  }

  /**
   * Binding decision, once classified.
   *
   * @return decision or empty while classifying
   */
  public Optional<BindingDecision> decision() {
    return Optional.ofNullable(decision);
  }

  /**
   * Destination the payload was bound to.
   *
   * @return destination, or empty while classifying or when dropped
   */
  public Optional<Destination> destination() {
    return decision == null ? Optional.empty() : decision.route();
  }

  /**
   * Flow carrying the payload.
   *
   * @return flow key, or empty before fragmentation or when dropped
   */
  public Optional<FlowKey> flowKey() {
    return Optional.ofNullable(flowKey);
  }

  /**
   * Fragment plan.
   *
   * @return schedule, or empty before fragmentation or when dropped
   */
  public Optional<FragmentSchedule> schedule() {
    return Optional.ofNullable(schedule);
  }

  /**
   * Fragments handed to the transport so far.
   *
   * @return sent fragment count
   */
  public int fragmentsSent() {
    return nextFragment;
  }

  /**
   * Fragments still to be handed to the transport.
   *
   * @return remaining count; zero once completed or dropped
   */
  public int fragmentsRemaining() {
    return schedule == null ? 0 : schedule.size() - nextFragment;
  }

  /**
   * Times the transport refused one of this payload's fragments.
   *
   * @return backpressure count
   */
  public long backpressureEvents() {
    return backpressureEvents;
  }

  /**
   * Virtual time the session reached {@link PayloadState#COMPLETED}.
   *
   * @return nanoseconds, or {@code -1} when not completed
   */
  public long completedNanos() {
    return completedNanos;
  }

  /**
   * Indicates whether the run stopped before the session completed.
   *
   * @return {@code true} when pending work was cancelled
   */
  public boolean interrupted() {
    return interrupted;
  }

  /**
   * Indicates whether the payload was dropped by the binding.
   *
   * @return {@code true} when no destination was chosen
   */
  public boolean dropped() {
    return decision != null && decision.isDropped();
  }

  void transition(PayloadState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Payload " + payload.tag() + " cannot move from " + state + " to " + next);
    }
    state = next;
  }

  void decided(BindingDecision decision) {
    this.decision = Objects.requireNonNull(decision, "decision");
  }

  void planned(FlowKey flowKey, FragmentSchedule schedule) {
    this.flowKey = Objects.requireNonNull(flowKey, "flowKey");
    this.schedule = Objects.requireNonNull(schedule, "schedule");
  }

  void pending(EventHandle handle) {
    this.pending = handle;
  }

  EventHandle pending() {
    return pending;
  }

  void fragmentSent() {
    nextFragment++;
  }

  int nextFragmentIndex() {
    return nextFragment;
  }

  void backpressure() {
    backpressureEvents++;
  }

  void completed(long nowNanos) {
    transition(PayloadState.COMPLETED);
    completedNanos = nowNanos;
    pending = null;
  }

  void interrupt() {
    interrupted = true;
    pending = null;
  }
}
