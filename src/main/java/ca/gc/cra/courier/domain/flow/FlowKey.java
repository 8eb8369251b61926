package ca.gc.cra.courier.domain.flow;

import ca.gc.cra.courier.domain.net.Endpoint;
import java.util.Objects;

/**
 * <strong>What:</strong> Identity of one delivery flow: the payload's ephemeral source endpoint and its destination.
 * <p><strong>Why:</strong> Lets the tracker correlate outbound fragment events with inbound arrivals.</p>
 * <p><strong>Role:</strong> Domain value used as a map key by the delivery tracker.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders {@code src -> dst} for logs and reports.</p>
 *
 * @param source origin endpoint allocated for the payload
 * @param destination endpoint bound to the payload's destination class
 * @since 0.1.0
 */
public record FlowKey(Endpoint source, Endpoint destination) {

  /**
   * Validates endpoints.
   *
   * @throws NullPointerException if either endpoint is {@code null}
   */
  public FlowKey {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
  }

  @Override
  public String toString() {
    return source + " -> " + destination;
  }
}
