package ca.gc.cra.courier.infrastructure.sim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.port.EventHandle;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventQueueSchedulerTest {

  @Test
  void runsEventsInTimeOrderAndEqualTimesFirstInFirstOut() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<String> order = new ArrayList<>();
    scheduler.scheduleAt(20, () -> order.add("late"));
    scheduler.scheduleAt(10, () -> order.add("first"));
    scheduler.scheduleAt(10, () -> order.add("second"));
    scheduler.scheduleAt(10, () -> order.add("third"));

    long executed = scheduler.runUntil(100);

    assertEquals(4, executed);
    assertEquals(List.of("first", "second", "third", "late"), order);
    assertEquals(100, scheduler.nowNanos());
  }

  @Test
  void clockReflectsEventTimeDuringCallback() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<Long> seen = new ArrayList<>();
    scheduler.scheduleAt(7, () -> seen.add(scheduler.nowNanos()));
    scheduler.scheduleAt(3, () -> seen.add(scheduler.nowNanos()));

    scheduler.runUntil(10);

    assertEquals(List.of(3L, 7L), seen);
  }

  @Test
  void callbacksMayScheduleFurtherEventsAtCurrentTime() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<String> order = new ArrayList<>();
    scheduler.scheduleAt(5, () -> {
      order.add("outer");
      scheduler.scheduleAt(scheduler.nowNanos(), () -> order.add("inner"));
    });
    scheduler.scheduleAt(5, () -> order.add("sibling"));

    scheduler.runUntil(5);

    assertEquals(List.of("outer", "sibling", "inner"), order);
  }

  @Test
  void cancelledEventsDoNotRun() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<String> order = new ArrayList<>();
    EventHandle handle = scheduler.scheduleAt(5, () -> order.add("cancelled"));
    scheduler.scheduleAt(6, () -> order.add("kept"));

    assertTrue(scheduler.cancel(handle));
    assertFalse(scheduler.cancel(handle));
    assertFalse(handle.isPending());
    assertEquals(1, scheduler.pendingCount());

    assertEquals(1, scheduler.runUntil(10));
    assertEquals(List.of("kept"), order);
  }

  @Test
  void rejectsSchedulingInThePast() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    scheduler.runUntil(50);

    assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAt(49, () -> {}));
    assertThrows(IllegalArgumentException.class, () -> scheduler.runUntil(10));
  }

  @Test
  void eventsBeyondHorizonAreCancelled() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<String> order = new ArrayList<>();
    scheduler.scheduleAt(10, () -> order.add("inside"));
    EventHandle late = scheduler.scheduleAt(1_000, () -> order.add("outside"));

    scheduler.runUntil(100);

    assertEquals(List.of("inside"), order);
    assertFalse(late.isPending());
    assertEquals(0, scheduler.pendingCount());
  }

  @Test
  void runUntilIsNotReentrant() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    List<Throwable> failures = new ArrayList<>();
    scheduler.scheduleAt(1, () -> {
      try {
        scheduler.runUntil(5);
      } catch (IllegalStateException expected) {
        failures.add(expected);
      }
    });

    scheduler.runUntil(10);

    assertEquals(1, failures.size());
  }
}
