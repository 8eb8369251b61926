package ca.gc.cra.courier.domain.payload;

/**
 * <strong>What:</strong> Descriptor of one fixed-size slice of a payload and its scheduled send time.
 * <p><strong>Role:</strong> Domain value created by the pacer and consumed (sent) exactly once by the orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param payloadTag tag of the owning payload
 * @param sequence 0-based sequence number, strictly increasing within the payload
 * @param offset first byte covered (inclusive)
 * @param length number of bytes covered; positive
 * @param scheduledNanos virtual time, in nanoseconds, at which the fragment should be handed to the transport
 * @since 0.1.0
 */
public record Fragment(int payloadTag, int sequence, int offset, int length, long scheduledNanos) {

  /**
   * Validates the descriptor.
   *
   * @throws IllegalArgumentException if any field is out of range
   */
  public Fragment {
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be non-negative (was " + sequence + ")");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be non-negative (was " + offset + ")");
    }
    if (length <= 0) {
      throw new IllegalArgumentException("length must be positive (was " + length + ")");
    }
    if (scheduledNanos < 0) {
      throw new IllegalArgumentException("scheduledNanos must be non-negative (was " + scheduledNanos + ")");
    }
  }

  /**
   * Returns the exclusive end offset.
   *
   * @return {@code offset + length}
   */
  public int endOffset() {
    return offset + length;
  }

  /**
   * Returns the fragment size in bits, the unit used for pacing.
   *
   * @return {@code length * 8}
   */
  public long bits() {
    return length * 8L;
  }
}
