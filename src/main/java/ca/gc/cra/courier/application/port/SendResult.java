package ca.gc.cra.courier.application.port;

/**
 * Outcome of handing bytes to a {@link TransportPort}.
 *
 * @since 0.1.0
 */
public enum SendResult {
  /** The transport took ownership of the bytes. */
  ACCEPTED,
  /** The transport cannot take the bytes now; the caller should retry later. */
  BACKPRESSURE
}
