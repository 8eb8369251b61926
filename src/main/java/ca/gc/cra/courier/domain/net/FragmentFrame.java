package ca.gc.cra.courier.domain.net;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Datagram carrying one fragment, prefixed by a fixed 12-byte header.
 * <p><strong>Why:</strong> The receiver must recover the payload tag and sequence number to correlate an arrival
 * with its send.</p>
 * <p><strong>Role:</strong> Wire format shared by the sending and receiving sides of the orchestrator.</p>
 * <p><strong>Layout (big-endian):</strong> {@code int payloadTag | int sequence | short classOrdinal |
 * short version | body}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the body is copied on construction.</p>
 *
 * @param payloadTag tag of the payload the fragment belongs to
 * @param sequence fragment sequence number
 * @param destinationClass class the payload was bound to
 * @param body fragment bytes
 * @since 0.1.0
 */
public record FragmentFrame(int payloadTag, int sequence, DestinationClass destinationClass, byte[] body) {
  /** Header length in bytes. */
  public static final int HEADER_BYTES = 12;
  /** Current header version. */
  public static final short VERSION = 1;

  /**
   * Validates fields and copies the body.
   *
   * @throws IllegalArgumentException if the tag or sequence is negative
   */
  public FragmentFrame {
    if (payloadTag < 0 || sequence < 0) {
      throw new IllegalArgumentException("payloadTag and sequence must be non-negative");
    }
    Objects.requireNonNull(destinationClass, "destinationClass");
    body = body != null ? body.clone() : new byte[0];
  }

  /**
   * Provides the body without copying.
   *
   * @return internal array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Frame body is copied on construction; receivers only read its length.")
  public byte[] body() {
    return body;
  }

  /**
   * Serializes header and body.
   *
   * @return new array of {@code HEADER_BYTES + body.length} bytes
   */
  public byte[] encode() {
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + body.length);
    buffer.putInt(payloadTag);
    buffer.putInt(sequence);
    buffer.putShort((short) destinationClass.ordinal());
    buffer.putShort(VERSION);
    buffer.put(body);
    return buffer.array();
  }

  /**
   * Parses a datagram.
   *
   * @param datagram received bytes
   * @return frame, or empty when the datagram is too short or carries an unknown version or class
   */
  public static Optional<FragmentFrame> decode(byte[] datagram) {
    if (datagram == null || datagram.length < HEADER_BYTES) {
      return Optional.empty();
    }
    ByteBuffer buffer = ByteBuffer.wrap(datagram);
    int tag = buffer.getInt();
    int sequence = buffer.getInt();
    int ordinal = buffer.getShort();
    short version = buffer.getShort();
    DestinationClass[] classes = DestinationClass.values();
    if (version != VERSION || tag < 0 || sequence < 0 || ordinal < 0 || ordinal >= classes.length) {
      return Optional.empty();
    }
    return Optional.of(new FragmentFrame(tag, sequence, classes[ordinal],
        Arrays.copyOfRange(datagram, HEADER_BYTES, datagram.length)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FragmentFrame other)) {
      return false;
    }
    return payloadTag == other.payloadTag
        && sequence == other.sequence
        && destinationClass == other.destinationClass
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(payloadTag, sequence, destinationClass) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "FragmentFrame{tag=" + payloadTag + ", seq=" + sequence + ", class=" + destinationClass
        + ", bodyLength=" + body.length + '}';
  }
}
