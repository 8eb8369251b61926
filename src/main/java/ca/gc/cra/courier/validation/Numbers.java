package ca.gc.cra.courier.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by COURIER configuration parsing and components.
 * <p><strong>Why:</strong> Guards against invalid fragment sizes, rates, and probabilities before a run schedules
 * anything.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link ConfigurationException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ns)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws ConfigurationException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ConfigurationException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a value is strictly positive.
   *
   * @param name logical parameter name
   * @param value candidate value
   * @return the validated value
   * @throws ConfigurationException if {@code value <= 0}
   */
  public static long requirePositive(String name, long value) {
    if (value <= 0) {
      throw new ConfigurationException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and within an inclusive range.
   *
   * @param name logical parameter name
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws ConfigurationException if {@code value} is NaN, infinite, or out of range
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new ConfigurationException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
