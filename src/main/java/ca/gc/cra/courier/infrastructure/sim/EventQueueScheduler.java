package ca.gc.cra.courier.infrastructure.sim;

import ca.gc.cra.courier.application.port.EventHandle;
import ca.gc.cra.courier.application.port.SimulationDriver;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single-threaded discrete-event scheduler over a virtual nanosecond clock.
 * <p><strong>Why:</strong> Gives runs a reproducible notion of time that advances only when events run.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link SimulationDriver}; shared by the orchestrator and transport of
 * one run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Order events by {@code (time, insertion sequence)} so equal times run first-in first-out.</li>
 *   <li>Cancel lazily: cancelled entries stay queued and are skipped when polled.</li>
 *   <li>Cancel everything beyond the horizon once {@link #runUntil(long)} returns.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callbacks run on the caller of {@link #runUntil(long)}.</p>
 * <p><strong>Performance:</strong> O(log n) insertion and removal.</p>
 *
 * @since 0.1.0
 */
public final class EventQueueScheduler implements SimulationDriver {
  private static final Logger log = LoggerFactory.getLogger(EventQueueScheduler.class);

  private static final Comparator<ScheduledEvent> ORDER =
      Comparator.comparingLong((ScheduledEvent e) -> e.timeNanos).thenComparingLong(e -> e.sequence);

  private final PriorityQueue<ScheduledEvent> queue = new PriorityQueue<>(ORDER);
  private long nowNanos;
  private long nextSequence;
  private int pending;
  private boolean running;

  /**
   * Creates a scheduler at virtual time zero.
   */
  public EventQueueScheduler() {}

  @Override
  public long nowNanos() {
    return nowNanos;
  }

  @Override
  public EventHandle scheduleAt(long virtualNanos, Runnable action) {
    Objects.requireNonNull(action, "action");
    if (virtualNanos < nowNanos) {
      throw new IllegalArgumentException(
          "Cannot schedule at " + virtualNanos + "ns; current time is " + nowNanos + "ns");
    }
    ScheduledEvent event = new ScheduledEvent(virtualNanos, nextSequence++, action);
    queue.add(event);
    pending++;
    return event;
  }

  @Override
  public boolean cancel(EventHandle handle) {
    if (!(handle instanceof ScheduledEvent event) || !event.pending) {
      return false;
    }
    event.pending = false;
    pending--;
    return true;
  }

  @Override
  public long runUntil(long horizonNanos) {
    if (running) {
      throw new IllegalStateException("runUntil is not re-entrant");
    }
    if (horizonNanos < nowNanos) {
      throw new IllegalArgumentException("horizon " + horizonNanos + "ns precedes current time " + nowNanos + "ns");
    }
    running = true;
    long executed = 0;
    try {
      while (!queue.isEmpty() && queue.peek().timeNanos <= horizonNanos) {
        ScheduledEvent event = queue.poll();
        if (!event.pending) {
          continue;
        }
        event.pending = false;
        pending--;
        nowNanos = event.timeNanos;
        event.action.run();
        executed++;
      }
      nowNanos = horizonNanos;
    } finally {
      running = false;
    }
    int leftover = cancelAll();
    if (leftover > 0) {
      log.debug("Cancelled {} events scheduled after horizon t={}ns", leftover, horizonNanos);
    }
    return executed;
  }

  @Override
  public int pendingCount() {
    return pending;
  }

  private int cancelAll() {
    int cancelled = 0;
    for (ScheduledEvent event : queue) {
      if (event.pending) {
        event.pending = false;
        cancelled++;
      }
    }
    queue.clear();
    pending = 0;
    return cancelled;
  }

  private static final class ScheduledEvent implements EventHandle {
    private final long timeNanos;
    private final long sequence;
    private final Runnable action;
    private boolean pending = true;

    private ScheduledEvent(long timeNanos, long sequence, Runnable action) {
      this.timeNanos = timeNanos;
      this.sequence = sequence;
      this.action = action;
    }

    @Override
    public long timeNanos() {
      return timeNanos;
    }

    @Override
    public boolean isPending() {
      return pending;
    }
  }
}
