package ca.gc.cra.courier.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.port.RecordingMetricsPort;
import ca.gc.cra.courier.application.port.SendResult;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.infrastructure.sim.EventQueueScheduler;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PointToPointTransportTest {
  private static final Endpoint ORIGIN = new Endpoint("10.1.0.1", 49152);
  private static final Endpoint SINK = new Endpoint("10.1.1.2", 9);

  private final EventQueueScheduler scheduler = new EventQueueScheduler();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<long[]> arrivals = new ArrayList<>();

  private PointToPointTransport transport(int queueLimitBytes, double lossRate) {
    // 1 Mbps, 1 ms propagation, no framing overhead: 1000 bytes take 8 ms on the wire.
    LinkProfile profile = new LinkProfile(1_000_000L, 1_000_000L, queueLimitBytes, lossRate, 0);
    PointToPointTransport transport = new PointToPointTransport(scheduler, profile, 42L, metrics);
    transport.onReceive(SINK, (destination, source, bytes, at) -> {
      assertEquals(SINK, destination);
      assertEquals(ORIGIN, source);
      arrivals.add(new long[] {at, bytes.length});
    });
    return transport;
  }

  @Test
  void deliversAfterTransmissionAndPropagationDelay() {
    PointToPointTransport transport = transport(10_000, 0.0);

    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[1000]));
    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[1000]));
    scheduler.runUntil(1_000_000_000L);

    assertEquals(2, arrivals.size());
    assertEquals(9_000_000L, arrivals.get(0)[0]);
    assertEquals(17_000_000L, arrivals.get(1)[0]);
    assertEquals(2, transport.framesAccepted());
    assertEquals(2, transport.framesDelivered());
  }

  @Test
  void refusesWhenQueueIsFullAndAcceptsOnceDrained() {
    PointToPointTransport transport = transport(2000, 0.0);

    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[1000]));
    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[1000]));
    assertEquals(SendResult.BACKPRESSURE, transport.send(ORIGIN, SINK, new byte[1000]));
    assertEquals(1, transport.framesRefused());

    List<SendResult> later = new ArrayList<>();
    scheduler.scheduleAt(8_000_000L, () -> later.add(transport.send(ORIGIN, SINK, new byte[1000])));
    scheduler.runUntil(1_000_000_000L);

    assertEquals(List.of(SendResult.ACCEPTED), later);
    assertEquals(3, arrivals.size());
  }

  @Test
  void oversizedFrameIsAcceptedOnAnIdleLink() {
    PointToPointTransport transport = transport(500, 0.0);

    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[1000]));
    assertEquals(SendResult.BACKPRESSURE, transport.send(ORIGIN, SINK, new byte[10]));
  }

  @Test
  void lossIsCountedButStillAccepted() {
    PointToPointTransport transport = transport(10_000, 1.0);

    assertEquals(SendResult.ACCEPTED, transport.send(ORIGIN, SINK, new byte[100]));
    scheduler.runUntil(1_000_000_000L);

    assertTrue(arrivals.isEmpty());
    assertEquals(1, transport.framesLost());
    assertEquals(1, metrics.count("transport.link.lost"));
  }

  @Test
  void sameSeedLosesSameFrames() {
    List<Long> first = lossPattern();
    List<Long> second = lossPattern();

    assertEquals(first, second);
  }

  @Test
  void deliveredBytesAreACopy() {
    PointToPointTransport transport = transport(10_000, 0.0);
    List<byte[]> received = new ArrayList<>();
    transport.onReceive(SINK, (destination, source, bytes, at) -> received.add(bytes));
    byte[] frame = {1, 2, 3};

    transport.send(ORIGIN, SINK, frame);
    frame[0] = 9;
    scheduler.runUntil(1_000_000_000L);

    assertArrayEquals(new byte[] {1, 2, 3}, received.get(0));
  }

  @Test
  void rejectsUnknownDestination() {
    PointToPointTransport transport = transport(10_000, 0.0);

    assertThrows(IllegalArgumentException.class,
        () -> transport.send(ORIGIN, new Endpoint("10.1.9.2", 9), new byte[1]));
  }

  @Test
  void rejectsInvalidLinkProfile() {
    assertThrows(ConfigurationException.class, () -> new LinkProfile(0, 0, 100, 0.0, 0));
    assertThrows(ConfigurationException.class, () -> new LinkProfile(1, -1, 100, 0.0, 0));
    assertThrows(ConfigurationException.class, () -> new LinkProfile(1, 0, 0, 0.0, 0));
    assertThrows(ConfigurationException.class, () -> new LinkProfile(1, 0, 100, 1.5, 0));
    assertThrows(ConfigurationException.class, () -> new LinkProfile(1, 0, 100, Double.NaN, 0));
  }

  private static List<Long> lossPattern() {
    EventQueueScheduler local = new EventQueueScheduler();
    LinkProfile profile = new LinkProfile(1_000_000_000L, 0L, 1_000_000, 0.5, 0);
    PointToPointTransport transport = new PointToPointTransport(local, profile, 7L, new RecordingMetricsPort());
    List<Long> delivered = new ArrayList<>();
    transport.onReceive(SINK, (destination, source, bytes, at) -> delivered.add((long) bytes[0]));
    for (int i = 0; i < 50; i++) {
      transport.send(ORIGIN, SINK, new byte[] {(byte) i});
    }
    local.runUntil(1_000_000_000L);
    return delivered;
  }
}
