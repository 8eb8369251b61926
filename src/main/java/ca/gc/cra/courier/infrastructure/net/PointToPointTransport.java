package ca.gc.cra.courier.infrastructure.net;

import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.ReceiveListener;
import ca.gc.cra.courier.application.port.SchedulerPort;
import ca.gc.cra.courier.application.port.SendResult;
import ca.gc.cra.courier.application.port.TransportPort;
import ca.gc.cra.courier.domain.net.Endpoint;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Star topology of point-to-point links between the origin and each bound destination.
 * <p><strong>Why:</strong> Lets runs observe realistic delay, queueing, and loss without a network stack.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link TransportPort} on top of a {@link SchedulerPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize frames on one link per (source address, destination address) pair:
 *   {@code arrival = max(now, linkFree) + wireBits / bandwidth + delay}.</li>
 *   <li>Refuse frames with {@link SendResult#BACKPRESSURE} while the link's transmit backlog would exceed the
 *   queue limit.</li>
 *   <li>Drop accepted frames independently with the configured loss rate, from a seeded generator.</li>
 *   <li>Deliver surviving frames to the listener bound at the destination endpoint.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the simulation thread.</p>
 * <p><strong>Observability:</strong> Increments {@code transport.link.lost} per dropped frame.</p>
 *
 * @since 0.1.0
 */
public final class PointToPointTransport implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(PointToPointTransport.class);

  private final SchedulerPort scheduler;
  private final LinkProfile profile;
  private final MetricsPort metrics;
  private final Random random;
  private final Map<Endpoint, ReceiveListener> listeners = new HashMap<>();
  private final Map<String, Link> links = new HashMap<>();
  private long framesAccepted;
  private long framesLost;
  private long framesDelivered;
  private long framesRefused;

  /**
   * Creates a transport.
   *
   * @param scheduler scheduler used to deliver frames
   * @param profile link characteristics
   * @param seed seed of the loss generator
   * @param metrics metrics sink
   */
  public PointToPointTransport(SchedulerPort scheduler, LinkProfile profile, long seed, MetricsPort metrics) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.profile = Objects.requireNonNull(profile, "profile");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.random = new Random(seed);
  }

  @Override
  public void onReceive(Endpoint destination, ReceiveListener listener) {
    listeners.put(Objects.requireNonNull(destination, "destination"), Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public SendResult send(Endpoint source, Endpoint destination, byte[] bytes) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(bytes, "bytes");
    if (!listeners.containsKey(destination)) {
      throw new IllegalArgumentException("No route to " + destination);
    }
    long now = scheduler.nowNanos();
    Link link = links.computeIfAbsent(source.address() + "->" + destination.address(), k -> new Link());
    int wireBytes = bytes.length + profile.overheadBytes();
    link.drain(now);
    if (link.backlogBytes > 0 && link.backlogBytes + wireBytes > profile.queueLimitBytes()) {
      framesRefused++;
      return SendResult.BACKPRESSURE;
    }
    long txStart = Math.max(now, link.freeAtNanos);
    long txEnd = txStart + profile.transmissionNanos(wireBytes);
    link.enqueue(txEnd, wireBytes);
    framesAccepted++;
    if (profile.lossRate() > 0.0 && random.nextDouble() < profile.lossRate()) {
      framesLost++;
      metrics.increment("transport.link.lost");
      log.debug("Frame {} -> {} lost on link", source, destination);
      return SendResult.ACCEPTED;
    }
    long arrival = txEnd + profile.propagationDelayNanos();
    byte[] copy = bytes.clone();
    scheduler.scheduleAt(arrival, () -> deliver(source, destination, copy, arrival));
    return SendResult.ACCEPTED;
  }

  /**
   * Frames accepted for transmission, including those later lost.
   *
   * @return accepted count
   */
  public long framesAccepted() {
    return framesAccepted;
  }

  /**
   * Frames dropped by the loss model.
   *
   * @return lost count
   */
  public long framesLost() {
    return framesLost;
  }

  /**
   * Frames handed to a listener.
   *
   * @return delivered count
   */
  public long framesDelivered() {
    return framesDelivered;
  }

  /**
   * Frames refused with backpressure.
   *
   * @return refused count
   */
  public long framesRefused() {
    return framesRefused;
  }

  private void deliver(Endpoint source, Endpoint destination, byte[] bytes, long arrival) {
    ReceiveListener listener = listeners.get(destination);
    if (listener == null) {
      log.warn("Listener for {} disappeared; discarding frame from {}", destination, source);
      return;
    }
    framesDelivered++;
    listener.onReceive(destination, source, bytes, arrival);
  }

  /** Transmit backlog of one link. */
  private static final class Link {
    private final Deque<long[]> inFlight = new ArrayDeque<>();
    private long freeAtNanos;
    private long backlogBytes;

    void drain(long now) {
      while (!inFlight.isEmpty() && inFlight.peekFirst()[0] <= now) {
        backlogBytes -= inFlight.pollFirst()[1];
      }
    }

    void enqueue(long txEndNanos, int wireBytes) {
      inFlight.addLast(new long[] {txEndNanos, wireBytes});
      backlogBytes += wireBytes;
      freeAtNanos = txEndNanos;
    }
  }
}
