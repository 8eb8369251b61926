package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Port to a virtual-time event scheduler.
 * <p><strong>Why:</strong> Decouples pacing and delivery from how virtual time is advanced.</p>
 * <p><strong>Role:</strong> Implemented by {@code EventQueueScheduler}; consumed by the orchestrator and the transport.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run callbacks in non-decreasing virtual time order.</li>
 *   <li>Run callbacks registered for the same time in insertion order.</li>
 *   <li>Allow pending callbacks to be cancelled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded; callbacks run on the thread that drives the scheduler and may
 * schedule further events.</p>
 *
 * @since 0.1.0
 */
public interface SchedulerPort extends ClockPort {
  /**
   * Registers a callback.
   *
   * @param virtualNanos absolute virtual time; must not precede {@link #nowNanos()}
   * @param action callback; must not be {@code null}
   * @return handle usable with {@link #cancel(EventHandle)}
   * @throws IllegalArgumentException if {@code virtualNanos} lies in the past
   */
  EventHandle scheduleAt(long virtualNanos, Runnable action);

  /**
   * Cancels a pending callback.
   *
   * @param handle handle returned by {@link #scheduleAt(long, Runnable)}
   * @return {@code true} if the callback was pending and will no longer run
   */
  boolean cancel(EventHandle handle);
}
