package ca.gc.cra.courier.domain.payload;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable payload (an image) submitted by the origin for delivery.
 * <p><strong>Why:</strong> Gives the classifier, pacer, and tracker one shared, tamper-proof view of the bytes.</p>
 * <p><strong>Role:</strong> Domain value owned by the orchestrator until fully fragmented.</p>
 * <p><strong>Thread-safety:</strong> Immutable; data is copied on construction.</p>
 * <p><strong>Observability:</strong> {@link #tag()} is placed in the logging MDC as {@code payloadId}.</p>
 *
 * @param tag origin-assigned identity (submission index); must be non-negative
 * @param label human-readable name such as a file name; never {@code null}
 * @param data payload bytes; copied on construction
 * @since 0.1.0
 */
public record Payload(int tag, String label, byte[] data) {

  /**
   * Validates the tag and normalizes label and data.
   *
   * @throws IllegalArgumentException if {@code tag} is negative
   */
  public Payload {
    if (tag < 0) {
      throw new IllegalArgumentException("tag must be non-negative (was " + tag + ")");
    }
    label = label == null || label.isBlank() ? "payload-" + tag : label;
    data = data != null ? data.clone() : new byte[0];
  }

  /**
   * Provides the payload bytes without copying.
   *
   * @return internal array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Payload bytes are copied on construction; fragments slice the canonical array without extra allocations.")
  public byte[] data() {
    return data;
  }

  /**
   * Returns the payload length in bytes.
   *
   * @return number of bytes
   */
  public int length() {
    return data.length;
  }

  /**
   * Copies the byte range covered by a fragment.
   *
   * @param fragment fragment descriptor belonging to this payload
   * @return new array holding {@code fragment.length()} bytes
   * @throws IllegalArgumentException if the fragment belongs to another payload or exceeds the bounds
   */
  public byte[] slice(Fragment fragment) {
    Objects.requireNonNull(fragment, "fragment");
    if (fragment.payloadTag() != tag) {
      throw new IllegalArgumentException(
          "fragment belongs to payload " + fragment.payloadTag() + ", not " + tag);
    }
    if (fragment.endOffset() > data.length) {
      throw new IllegalArgumentException("fragment exceeds payload bounds: " + fragment);
    }
    return Arrays.copyOfRange(data, fragment.offset(), fragment.endOffset());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Payload other)) {
      return false;
    }
    return tag == other.tag && label.equals(other.label) && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(tag, label);
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "Payload{tag=" + tag + ", label=" + label + ", length=" + data.length + '}';
  }
}
