package ca.gc.cra.courier.domain.classify;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * <strong>What:</strong> Closed set of destination classes a payload can be routed to.
 * <p><strong>Why:</strong> Makes the fallback path an explicit branch ({@link #UNRESOLVED}) instead of a magic integer.</p>
 * <p><strong>Role:</strong> Domain value used by classification results, bindings, and per-class statistics.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum DestinationClass {
  /** Lionel Messi receiver. */
  MESSI("Messi"),
  /** Cristiano Ronaldo receiver. */
  RONALDO("Ronaldo"),
  /** Neymar receiver. */
  NEYMAR("Neymar"),
  /** Kylian Mbappe receiver. */
  MBAPPE("Mbappe"),
  /** Erling Haaland receiver. */
  HAALAND("Haaland"),
  /** Classifier could not resolve a subject; never bound to a destination of its own. */
  UNRESOLVED("Unknown");

  private static final Set<DestinationClass> NAMED =
      EnumSet.of(MESSI, RONALDO, NEYMAR, MBAPPE, HAALAND);

  private final String displayName;

  DestinationClass(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable label used in logs and reports.
   *
   * @return display name such as {@code "Messi"}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Indicates whether this constant names a real destination (anything but {@link #UNRESOLVED}).
   *
   * @return {@code true} for the five named classes
   */
  public boolean isNamed() {
    return this != UNRESOLVED;
  }

  /**
   * Returns the named classes in declaration order.
   *
   * @return mutable copy of the named classes
   */
  public static EnumSet<DestinationClass> named() {
    return EnumSet.copyOf(NAMED);
  }

  /**
   * Parses a class identifier, accepting either the constant name or the display name.
   *
   * @param raw identifier such as {@code "MESSI"} or {@code "Messi"}
   * @return matching class
   * @throws IllegalArgumentException if the identifier is blank or unknown
   */
  public static DestinationClass fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("destination class must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (DestinationClass candidate : values()) {
      if (candidate.name().equals(normalized)
          || candidate.displayName.toUpperCase(Locale.ROOT).equals(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown destination class: " + raw);
  }
}
