package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.net.Endpoint;

/**
 * <strong>What:</strong> Port to a datagram-style transport between the origin and destination endpoints.
 * <p><strong>Why:</strong> Keeps link modelling (bandwidth, delay, queueing, loss) out of the orchestrator.</p>
 * <p><strong>Role:</strong> Implemented by {@code PointToPointTransport}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept bytes or report backpressure without blocking.</li>
 *   <li>Deliver accepted bytes, possibly later or not at all, to the listener bound at the destination.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded; arrivals are delivered from scheduler callbacks.</p>
 *
 * @since 0.1.0
 */
public interface TransportPort {
  /**
   * Hands bytes to the transport.
   *
   * @param source sending endpoint
   * @param destination receiving endpoint
   * @param bytes datagram bytes; the transport does not retain the caller's array after returning
   * @return {@link SendResult#ACCEPTED} or {@link SendResult#BACKPRESSURE}
   * @throws IllegalArgumentException if no route to {@code destination} exists
   */
  SendResult send(Endpoint source, Endpoint destination, byte[] bytes);

  /**
   * Binds a listener to a destination endpoint, replacing any previous listener.
   *
   * @param destination endpoint to listen on
   * @param listener arrival callback
   */
  void onReceive(Endpoint destination, ReceiveListener listener);
}
