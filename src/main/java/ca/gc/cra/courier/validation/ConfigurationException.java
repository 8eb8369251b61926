package ca.gc.cra.courier.validation;

/**
 * <strong>What:</strong> Signals a configuration value that makes a run impossible.
 * <p><strong>Why:</strong> Zero fragment sizes, non-positive rates, and unknown class names must fail before any
 * event is scheduled.</p>
 * <p><strong>Role:</strong> Thrown by configuration parsing and by component constructors; the CLI maps it to
 * {@code ExitCode.CONFIG_ERROR}.</p>
 *
 * @since 0.1.0
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the invalid value
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the invalid value
   * @param cause underlying parse failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
