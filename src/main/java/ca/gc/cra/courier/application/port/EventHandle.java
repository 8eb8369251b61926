package ca.gc.cra.courier.application.port;

/**
 * Handle to an event registered with a {@link SchedulerPort}.
 *
 * @since 0.1.0
 */
public interface EventHandle {
  /**
   * Virtual time the event was scheduled for.
   *
   * @return nanoseconds
   */
  long timeNanos();

  /**
   * Indicates whether the event will still run.
   *
   * @return {@code true} until the event has run or was cancelled
   */
  boolean isPending();
}
