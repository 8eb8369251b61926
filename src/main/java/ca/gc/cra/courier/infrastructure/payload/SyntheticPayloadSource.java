package ca.gc.cra.courier.infrastructure.payload;

import ca.gc.cra.courier.application.port.PayloadSource;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.infrastructure.classify.PatternClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Generates patterned stand-in images, one or more per destination class.
 * <p><strong>Why:</strong> Runs must work without image files; the patterns let {@link PatternClassifier} recover the
 * intended class exactly.</p>
 * <p><strong>Layout:</strong> Byte {@code i} of a payload for class {@code c} is {@code (c * 50 + 10 + i) mod 256}.
 * Payloads are emitted round by round, each round covering the classes in order.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class SyntheticPayloadSource implements PayloadSource {
  private final List<DestinationClass> classes;
  private final int imagesPerClass;
  private final int imageSize;

  /**
   * Creates a generator.
   *
   * @param classes classes to generate payloads for, in submission order
   * @param imagesPerClass rounds to generate; must be positive
   * @param imageSize bytes per payload; may be zero
   * @throws IllegalArgumentException if a count is out of range or a class is {@code UNRESOLVED}
   */
  public SyntheticPayloadSource(List<DestinationClass> classes, int imagesPerClass, int imageSize) {
    this.classes = List.copyOf(Objects.requireNonNull(classes, "classes"));
    if (this.classes.stream().anyMatch(cls -> !cls.isNamed())) {
      throw new IllegalArgumentException("synthetic payloads need named classes");
    }
    if (imagesPerClass <= 0) {
      throw new IllegalArgumentException("imagesPerClass must be positive (was " + imagesPerClass + ")");
    }
    if (imageSize < 0) {
      throw new IllegalArgumentException("imageSize must be non-negative (was " + imageSize + ")");
    }
    this.imagesPerClass = imagesPerClass;
    this.imageSize = imageSize;
  }

  @Override
  public List<Payload> load() {
    List<Payload> payloads = new ArrayList<>(classes.size() * imagesPerClass);
    int tag = 0;
    for (int round = 0; round < imagesPerClass; round++) {
      for (DestinationClass cls : classes) {
        payloads.add(new Payload(tag++, cls.displayName().toLowerCase(Locale.ROOT) + "-" + round,
            generate(cls, imageSize)));
      }
    }
    return payloads;
  }

  /**
   * Builds the patterned bytes for one class.
   *
   * @param cls named class
   * @param size payload size
   * @return new array
   */
  public static byte[] generate(DestinationClass cls, int size) {
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = PatternClassifier.patternByte(cls, i);
    }
    return data;
  }
}
