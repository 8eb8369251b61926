package ca.gc.cra.courier.application.routing;

import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.net.Destination;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of binding one classification result to a destination.
 *
 * @param reason why the destination was chosen, or why none was
 * @param classification result the decision was based on
 * @param destination chosen destination; {@code null} exactly when {@code reason} is {@link Reason#DROPPED}
 * @since 0.1.0
 */
public record BindingDecision(Reason reason, ClassificationResult classification, Destination destination) {

  /** Decision reasons. */
  public enum Reason {
    /** Known, active class with a score below the threshold. */
    MATCHED,
    /** Score at or above the threshold; routed to the fallback class. */
    FALLBACK_LOW_CONFIDENCE,
    /** Unresolved result, or a class with no active destination; routed to the fallback class. */
    FALLBACK_UNRESOLVED,
    /** No acceptable class and no fallback configured. */
    DROPPED
  }

  /**
   * Validates consistency between reason and destination.
   *
   * @throws IllegalArgumentException if a dropped decision carries a destination or vice versa
   */
  public BindingDecision {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(classification, "classification");
    if ((reason == Reason.DROPPED) != (destination == null)) {
      throw new IllegalArgumentException("destination must be absent exactly for dropped decisions");
    }
  }

  /**
   * Destination to deliver to.
   *
   * @return destination, or empty when dropped
   */
  public Optional<Destination> route() {
    return Optional.ofNullable(destination);
  }

  /**
   * Indicates whether the payload is dropped.
   *
   * @return {@code true} when no destination was chosen
   */
  public boolean isDropped() {
    return reason == Reason.DROPPED;
  }

  /**
   * Indicates whether the fallback class was used.
   *
   * @return {@code true} for either fallback reason
   */
  public boolean isFallback() {
    return reason == Reason.FALLBACK_LOW_CONFIDENCE || reason == Reason.FALLBACK_UNRESOLVED;
  }
}
