package ca.gc.cra.courier.api;

import ca.gc.cra.courier.validation.ConfigurationException;
import java.io.IOException;

/**
 * <strong>What:</strong> Canonical exit codes shared by COURIER command-line tools.
 * <p><strong>Why:</strong> Gives scripts stable process status semantics.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or out of range. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a failure raised while preparing or running a command to its exit code.
   *
   * @param failure caught exception
   * @return {@link #CONFIG_ERROR} for configuration values, {@link #INVALID_ARGS} for other argument errors,
   *     {@link #IO_ERROR} for I/O failures, {@link #RUNTIME_FAILURE} otherwise
   */
  public static ExitCode forFailure(Exception failure) {
    if (failure instanceof ConfigurationException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof IllegalArgumentException) {
      return INVALID_ARGS;
    }
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
