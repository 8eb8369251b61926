package ca.gc.cra.courier.domain.net;

import java.util.Objects;

/**
 * <strong>What:</strong> Address and port pair naming one side of a simulated link.
 * <p><strong>Role:</strong> Domain value object used in flow keys, destinations, and transport calls.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for sharing.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders {@code address:port} for logs.</p>
 *
 * @param address host address, typically a dotted IPv4 literal; never {@code null}
 * @param port port number (0-65535)
 * @since 0.1.0
 */
public record Endpoint(String address, int port) {

  /**
   * Validates the address and port.
   *
   * @throws NullPointerException if {@code address} is {@code null}
   * @throws IllegalArgumentException if the address is blank or the port lies outside 0-65535
   */
  public Endpoint {
    Objects.requireNonNull(address, "address");
    if (address.isBlank()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    if (port < 0 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 0 and 65535 (was " + port + ")");
    }
  }

  @Override
  public String toString() {
    return address + ':' + port;
  }
}
