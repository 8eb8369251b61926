package ca.gc.cra.courier.infrastructure.classify;

import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Reference classifier that recognizes the byte patterns of synthetic payloads.
 * <p><strong>Why:</strong> Runs need a deterministic backend whose confidence behaves like a distance, without any
 * image-processing dependency.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link ClassifierPort}.</p>
 * <p><strong>Scoring:</strong> For each candidate class the classifier counts bytes equal to the class pattern
 * {@code (ordinal * 50 + 10 + i) mod 256}. The best class wins with distance
 * {@code (1 - matches / length) * 255}, so an exact synthetic payload scores {@code 0}. Empty payloads and payloads
 * matching no byte are {@link DestinationClass#UNRESOLVED}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.courier.infrastructure.payload.SyntheticPayloadSource
 */
public final class PatternClassifier implements ClassifierPort {
  /** Upper end of the distance scale. */
  public static final double MAX_DISTANCE = 255.0;

  private final Set<DestinationClass> candidates;

  /**
   * Creates a classifier that considers every named class.
   */
  public PatternClassifier() {
    this(DestinationClass.named());
  }

  /**
   * Creates a classifier restricted to some classes.
   *
   * @param candidates classes to consider; {@code UNRESOLVED} is ignored
   */
  public PatternClassifier(Set<DestinationClass> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    EnumSet<DestinationClass> copy = EnumSet.noneOf(DestinationClass.class);
    for (DestinationClass cls : candidates) {
      if (cls.isNamed()) {
        copy.add(cls);
      }
    }
    this.candidates = copy;
  }

  /**
   * Pattern byte of a class at a position.
   *
   * @param cls named class
   * @param index byte position
   * @return expected byte
   */
  public static byte patternByte(DestinationClass cls, int index) {
    return (byte) ((cls.ordinal() * 50 + 10 + index) % 256);
  }

  @Override
  public ClassificationResult classify(byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    if (payload.length == 0) {
      return ClassificationResult.unresolved();
    }
    DestinationClass best = null;
    int bestMatches = 0;
    for (DestinationClass cls : candidates) {
      int matches = 0;
      for (int i = 0; i < payload.length; i++) {
        if (payload[i] == patternByte(cls, i)) {
          matches++;
        }
      }
      if (matches > bestMatches) {
        best = cls;
        bestMatches = matches;
      }
    }
    if (best == null) {
      return ClassificationResult.unresolved();
    }
    double distance = (1.0 - (double) bestMatches / payload.length) * MAX_DISTANCE;
    return new ClassificationResult(best, distance);
  }
}
