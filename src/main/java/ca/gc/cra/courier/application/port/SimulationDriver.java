package ca.gc.cra.courier.application.port;

/**
 * Scheduler that can be driven to a horizon by the run facade.
 *
 * @since 0.1.0
 */
public interface SimulationDriver extends SchedulerPort {
  /**
   * Runs events up to and including {@code horizonNanos}, then cancels whatever is still pending.
   *
   * @param horizonNanos last virtual time to process
   * @return number of events executed
   */
  long runUntil(long horizonNanos);

  /**
   * Number of events still pending.
   *
   * @return pending count
   */
  int pendingCount();
}
