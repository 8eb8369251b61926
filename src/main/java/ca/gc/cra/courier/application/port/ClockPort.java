package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Port supplying the current virtual time.
 * <p><strong>Why:</strong> Components that stamp events (tracker, orchestrator) never read the wall clock, so runs
 * are reproducible.</p>
 * <p><strong>Thread-safety:</strong> Reads happen on the simulation thread.</p>
 *
 * @since 0.1.0
 * @see SchedulerPort
 */
public interface ClockPort {
  /**
   * Returns the current virtual time.
   *
   * @return nanoseconds since the start of the run; never decreases
   */
  long nowNanos();
}
