package ca.gc.cra.courier.domain.net;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import java.util.Objects;

/**
 * Endpoint bound one-to-one to a named destination class for the lifetime of a run.
 *
 * @param destinationClass named class served by this endpoint; never {@link DestinationClass#UNRESOLVED}
 * @param endpoint receiving endpoint
 * @since 0.1.0
 */
public record Destination(DestinationClass destinationClass, Endpoint endpoint) {

  /**
   * Validates the binding.
   *
   * @throws NullPointerException if any component is {@code null}
   * @throws IllegalArgumentException if the class is {@link DestinationClass#UNRESOLVED}
   */
  public Destination {
    Objects.requireNonNull(destinationClass, "destinationClass");
    Objects.requireNonNull(endpoint, "endpoint");
    if (!destinationClass.isNamed()) {
      throw new IllegalArgumentException("UNRESOLVED cannot own a destination");
    }
  }
}
