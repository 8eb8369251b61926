package ca.gc.cra.courier.domain.classify;

import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of one classification pass over a payload.
 * <p><strong>Role:</strong> Domain value produced by the classifier port and consumed once by the binding.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param destinationClass predicted class; {@link DestinationClass#UNRESOLVED} when no subject was found
 * @param score distance score where lower means more confident; may be {@link Double#NaN} or infinite for
 *     unresolved results
 * @since 0.1.0
 */
public record ClassificationResult(DestinationClass destinationClass, double score) {

  /**
   * Validates the predicted class.
   *
   * @throws NullPointerException if {@code destinationClass} is {@code null}
   */
  public ClassificationResult {
    Objects.requireNonNull(destinationClass, "destinationClass");
  }

  /**
   * Creates an unresolved result with an infinite distance.
   *
   * @return unresolved classification
   */
  public static ClassificationResult unresolved() {
    return new ClassificationResult(DestinationClass.UNRESOLVED, Double.POSITIVE_INFINITY);
  }

  /**
   * Indicates whether the classifier failed to name a class.
   *
   * @return {@code true} when the class is {@link DestinationClass#UNRESOLVED}
   */
  public boolean isUnresolved() {
    return destinationClass == DestinationClass.UNRESOLVED;
  }
}
