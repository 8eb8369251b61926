package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.net.Endpoint;

/**
 * Callback invoked by a {@link TransportPort} when bytes arrive at a bound endpoint.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ReceiveListener {
  /**
   * Handles an arrival.
   *
   * @param destination endpoint the bytes arrived at
   * @param source endpoint the bytes were sent from
   * @param bytes received bytes; owned by the listener
   * @param arrivedNanos virtual arrival time
   */
  void onReceive(Endpoint destination, Endpoint source, byte[] bytes, long arrivedNanos);
}
