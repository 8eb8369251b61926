package ca.gc.cra.courier.domain.flow;

import java.util.Objects;

/**
 * Thrown by {@link FlowRecord} when a send or receive cannot be reconciled with the events already recorded.
 *
 * <p>The record is left unchanged. Callers drop the event and keep going.</p>
 *
 * @since 0.1.0
 */
public class StatsInconsistencyException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient FlowKey flowKey;
  private final int sequence;

  /**
   * Creates an exception.
   *
   * @param flowKey flow the event belonged to
   * @param sequence fragment sequence number
   * @param message description of the mismatch
   */
  public StatsInconsistencyException(FlowKey flowKey, int sequence, String message) {
    super(message);
    this.flowKey = Objects.requireNonNull(flowKey, "flowKey");
    this.sequence = sequence;
  }

  /**
   * Flow the event belonged to.
   *
   * @return flow key
   */
  public FlowKey flowKey() {
    return flowKey;
  }

  /**
   * Sequence number of the rejected event.
   *
   * @return sequence
   */
  public int sequence() {
    return sequence;
  }
}
