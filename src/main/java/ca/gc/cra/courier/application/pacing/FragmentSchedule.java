package ca.gc.cra.courier.application.pacing;

import ca.gc.cra.courier.domain.payload.Fragment;
import java.util.List;

/**
 * Timed fragment plan for one payload.
 *
 * @param payloadTag tag of the payload the plan was computed for
 * @param startNanos virtual time of the first fragment
 * @param endNanos virtual time at which the last fragment has been fully paced out; equals {@code startNanos} for
 *     an empty plan
 * @param fragments fragments in sequence order; unmodifiable
 * @since 0.1.0
 */
public record FragmentSchedule(int payloadTag, long startNanos, long endNanos, List<Fragment> fragments) {

  /**
   * Copies the fragment list and validates the time span.
   *
   * @throws IllegalArgumentException if {@code endNanos < startNanos}
   */
  public FragmentSchedule {
    fragments = List.copyOf(fragments);
    if (endNanos < startNanos) {
      throw new IllegalArgumentException("endNanos precedes startNanos");
    }
  }

  /**
   * Number of fragments.
   *
   * @return fragment count
   */
  public int size() {
    return fragments.size();
  }

  /**
   * Indicates a zero-length payload.
   *
   * @return {@code true} when no fragment must be sent
   */
  public boolean isEmpty() {
    return fragments.isEmpty();
  }

  /**
   * Paced duration of the whole payload.
   *
   * @return {@code endNanos - startNanos}
   */
  public long durationNanos() {
    return endNanos - startNanos;
  }
}
