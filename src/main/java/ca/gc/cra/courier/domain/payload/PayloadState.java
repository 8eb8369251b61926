package ca.gc.cra.courier.domain.payload;

/**
 * Lifecycle of one payload inside the orchestrator.
 *
 * <p>Legal transitions: {@code CLASSIFYING -> FRAGMENTING -> SENDING -> COMPLETED}, plus
 * {@code CLASSIFYING -> COMPLETED} for dropped payloads. {@link #COMPLETED} is terminal.</p>
 *
 * @since 0.1.0
 */
public enum PayloadState {
  /** Waiting for the classification result. */
  CLASSIFYING,
  /** Destination bound; schedule being computed. */
  FRAGMENTING,
  /** Fragments are being handed to the transport. */
  SENDING,
  /** Every fragment was handed over, or the payload was dropped. */
  COMPLETED;

  /**
   * Checks whether moving from this state to {@code next} is allowed.
   *
   * @param next candidate state
   * @return {@code true} when the transition is legal
   */
  public boolean canTransitionTo(PayloadState next) {
    return switch (this) {
      case CLASSIFYING -> next == FRAGMENTING || next == COMPLETED;
      case FRAGMENTING -> next == SENDING;
      case SENDING -> next == COMPLETED;
      case COMPLETED -> false;
    };
  }
}
