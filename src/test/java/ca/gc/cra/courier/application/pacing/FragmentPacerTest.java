package ca.gc.cra.courier.application.pacing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.RecordingMetricsPort;
import ca.gc.cra.courier.domain.payload.Fragment;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class FragmentPacerTest {
  private static final long START = 2_000_000_000L;

  @Test
  void fiftyThousandBytesAtOneMegabitYieldsFortyNineFragments() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    FragmentPacer pacer = new FragmentPacer(1024, 1_000_000L, metrics);

    FragmentSchedule schedule = pacer.schedule(new Payload(0, "messi-0", new byte[50_000]), START);

    List<Fragment> fragments = schedule.fragments();
    assertEquals(49, fragments.size());
    assertEquals(848, fragments.get(48).length());
    for (int i = 0; i < 48; i++) {
      assertEquals(1024, fragments.get(i).length());
    }
    assertEquals(START, fragments.get(0).scheduledNanos());
    assertEquals(8_192_000L, fragments.get(1).scheduledNanos() - fragments.get(0).scheduledNanos());
    assertEquals(START + 48 * 8_192_000L, fragments.get(48).scheduledNanos());
    assertEquals(List.of(49L), metrics.observed("pacer.fragments"));
  }

  @Test
  void fragmentsPartitionThePayloadInOrder() {
    FragmentPacer pacer = new FragmentPacer(300, 64_000L, MetricsPort.NO_OP);

    FragmentSchedule schedule = pacer.schedule(new Payload(7, "p", new byte[1000]), 0L);

    int expectedOffset = 0;
    long previous = -1;
    for (int i = 0; i < schedule.size(); i++) {
      Fragment f = schedule.fragments().get(i);
      assertEquals(7, f.payloadTag());
      assertEquals(i, f.sequence());
      assertEquals(expectedOffset, f.offset());
      assertTrue(f.scheduledNanos() >= previous);
      expectedOffset += f.length();
      previous = f.scheduledNanos();
    }
    assertEquals(1000, expectedOffset);
    assertEquals(4, schedule.size());
    assertEquals(100, schedule.fragments().get(3).length());
  }

  @Test
  void fragmentsPartitionAndReassembleAcrossSizeBoundaries() {
    int k = 3;
    for (int size : new int[] {1, 7, 1024}) {
      for (long rate : new long[] {64_000L, 1_000_003L}) {
        FragmentPacer pacer = new FragmentPacer(size, rate, MetricsPort.NO_OP);
        int[] lengths = {0, 1, size - 1, size, size + 1, k * size - 1, k * size, k * size + 1};
        for (int length : lengths) {
          String label = "S=" + size + " R=" + rate + " L=" + length;
          byte[] data = new byte[length];
          for (int i = 0; i < length; i++) {
            data[i] = (byte) (i * 31 + 7);
          }
          Payload payload = new Payload(1, "grid", data);

          FragmentSchedule schedule = pacer.schedule(payload, START);

          List<Fragment> fragments = schedule.fragments();
          assertEquals((length + size - 1) / size, fragments.size(), label);
          assertEquals(pacer.fragmentCount(length), fragments.size(), label);
          byte[] reassembled = new byte[length];
          int offset = 0;
          long bits = 0;
          long previous = START;
          for (int i = 0; i < fragments.size(); i++) {
            Fragment f = fragments.get(i);
            assertEquals(i, f.sequence(), label);
            assertEquals(offset, f.offset(), label);
            assertTrue(f.length() > 0 && f.length() <= size, label);
            if (i < fragments.size() - 1) {
              assertEquals(size, f.length(), label);
            }
            assertEquals(START + bits * 1_000_000_000L / rate, f.scheduledNanos(), label);
            assertTrue(f.scheduledNanos() >= previous, label);
            byte[] body = payload.slice(f);
            System.arraycopy(body, 0, reassembled, offset, body.length);
            offset += f.length();
            bits += f.length() * 8L;
            previous = f.scheduledNanos();
          }
          assertEquals(length, offset, label);
          assertArrayEquals(data, reassembled, label);
          assertEquals(START + bits * 1_000_000_000L / rate, schedule.endNanos(), label);
        }
      }
    }
  }

  @Test
  void emptyPayloadHasNoFragments() {
    FragmentPacer pacer = new FragmentPacer(1024, 1_000_000L, MetricsPort.NO_OP);

    FragmentSchedule schedule = pacer.schedule(new Payload(0, "empty", new byte[0]), START);

    assertTrue(schedule.isEmpty());
    assertEquals(0, pacer.fragmentCount(0));
  }

  @Test
  void exactMultipleHasNoShortTail() {
    FragmentPacer pacer = new FragmentPacer(1000, 1_000_000L, MetricsPort.NO_OP);

    assertEquals(5, pacer.fragmentCount(5000));
    assertEquals(6, pacer.fragmentCount(5001));
  }

  @Test
  void rejectsZeroFragmentSizeAndRate() {
    assertThrows(ConfigurationException.class, () -> new FragmentPacer(0, 1_000_000L, MetricsPort.NO_OP));
    assertThrows(ConfigurationException.class, () -> new FragmentPacer(1024, 0L, MetricsPort.NO_OP));
  }

  @Test
  void nanosForFallsBackToExactArithmeticOnOverflow() {
    FragmentPacer pacer = new FragmentPacer(1024, 1_000_000_000L, MetricsPort.NO_OP);

    assertEquals(20_000_000_000L, pacer.nanosFor(20_000_000_000L));
    assertEquals(1L, pacer.nanosFor(1L));
  }
}
