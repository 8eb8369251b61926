package ca.gc.cra.courier.infrastructure.payload;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.payload.Payload;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntheticPayloadSourceTest {

  @Test
  void interleavesClassesPerRound() {
    SyntheticPayloadSource source =
        new SyntheticPayloadSource(List.of(DestinationClass.MESSI, DestinationClass.NEYMAR), 2, 4);

    List<Payload> payloads = source.load();

    assertEquals(List.of("messi-0", "neymar-0", "messi-1", "neymar-1"),
        payloads.stream().map(Payload::label).toList());
    assertEquals(List.of(0, 1, 2, 3), payloads.stream().map(Payload::tag).toList());
    assertArrayEquals(new byte[] {110, 111, 112, 113}, payloads.get(1).data());
  }

  @Test
  void patternWrapsAtByteBoundary() {
    byte[] data = SyntheticPayloadSource.generate(DestinationClass.MESSI, 250);

    assertEquals((byte) 255, data[245]);
    assertEquals((byte) 0, data[246]);
  }

  @Test
  void zeroSizeProducesEmptyPayloads() {
    List<Payload> payloads = new SyntheticPayloadSource(List.of(DestinationClass.HAALAND), 1, 0).load();

    assertEquals(0, payloads.get(0).length());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new SyntheticPayloadSource(List.of(DestinationClass.UNRESOLVED), 1, 10));
    assertThrows(IllegalArgumentException.class,
        () -> new SyntheticPayloadSource(List.of(DestinationClass.MESSI), 0, 10));
    assertThrows(IllegalArgumentException.class,
        () -> new SyntheticPayloadSource(List.of(DestinationClass.MESSI), 1, -1));
  }
}
