package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.pacing.FragmentPacer;
import ca.gc.cra.courier.application.pacing.FragmentSchedule;
import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.SchedulerPort;
import ca.gc.cra.courier.application.port.SendResult;
import ca.gc.cra.courier.application.port.TransportPort;
import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.application.routing.ClassifierBinding;
import ca.gc.cra.courier.application.stats.ClassStatisticsAggregator;
import ca.gc.cra.courier.application.stats.DeliveryTracker;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowKey;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.net.Destination;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.domain.net.FragmentFrame;
import ca.gc.cra.courier.domain.payload.Fragment;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.domain.payload.PayloadState;
import ca.gc.cra.courier.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives payloads through classification, pacing, and sending on a virtual-time scheduler.
 * <p><strong>Why:</strong> Composes the binding, pacer, and tracker with the scheduler and transport ports so that
 * each payload follows {@code CLASSIFYING -> FRAGMENTING -> SENDING -> COMPLETED}.</p>
 * <p><strong>Role:</strong> Application-layer use case; one instance per run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify each payload at its start time and bind it to a destination or drop it.</li>
 *   <li>Allocate one source endpoint per payload so every delivery is its own flow.</li>
 *   <li>Send fragments in sequence order at their paced times, retrying after backpressure.</li>
 *   <li>Feed sends and arrivals to the {@link DeliveryTracker}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; all methods and callbacks run on the simulation thread.</p>
 * <p><strong>Performance:</strong> At most one pending send event per payload.</p>
 * <p><strong>Observability:</strong> Increments {@code orchestrator.fragment.sent}, {@code orchestrator.backpressure},
 * {@code orchestrator.payload.completed}, and {@code orchestrator.frame.malformed}; logs with the payload tag in MDC
 * under {@code payloadId}.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(DeliveryOrchestrator.class);
  static final String MDC_PAYLOAD_ID = "payloadId";

  private final SchedulerPort scheduler;
  private final TransportPort transport;
  private final ClassifierPort classifier;
  private final ClassifierBinding binding;
  private final FragmentPacer pacer;
  private final DeliveryTracker tracker;
  private final MetricsPort metrics;
  private final OrchestratorSettings settings;
  private final Map<Integer, PayloadSession> sessions = new LinkedHashMap<>();
  private int nextSourcePort;
  private boolean stopped;

  /**
   * Creates an orchestrator and binds a receive listener on every active destination.
   *
   * @param scheduler virtual-time scheduler
   * @param transport datagram transport
   * @param classifier classification backend
   * @param binding classification-to-destination binding
   * @param pacer fragment planner
   * @param tracker delivery tracker owned by this run
   * @param metrics metrics sink
   * @param settings origin addressing and retry settings
   */
  public DeliveryOrchestrator(
      SchedulerPort scheduler,
      TransportPort transport,
      ClassifierPort classifier,
      ClassifierBinding binding,
      FragmentPacer pacer,
      DeliveryTracker tracker,
      MetricsPort metrics,
      OrchestratorSettings settings) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.binding = Objects.requireNonNull(binding, "binding");
    this.pacer = Objects.requireNonNull(pacer, "pacer");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.nextSourcePort = settings.firstSourcePort();
    for (Destination destination : binding.destinations().values()) {
      transport.onReceive(destination.endpoint(), this::onArrival);
    }
  }

  /**
   * Submits a payload for delivery starting at a virtual time.
   *
   * @param payload payload; its tag must be unique within the run
   * @param startNanos virtual time at which classification happens; clamped to the current time
   * @return session tracking the payload
   * @throws IllegalStateException if the orchestrator was stopped or has no source port left
   * @throws IllegalArgumentException if a payload with the same tag was already submitted
   */
  public PayloadSession submit(Payload payload, long startNanos) {
    Objects.requireNonNull(payload, "payload");
    if (stopped) {
      throw new IllegalStateException("Orchestrator stopped; cannot submit payload " + payload.tag());
    }
    if (sessions.containsKey(payload.tag())) {
      throw new IllegalArgumentException("Payload tag " + payload.tag() + " already submitted");
    }
    if (remainingSourcePorts() == 0) {
      throw new IllegalStateException("Source ports exhausted on " + settings.originAddress()
          + "; cannot submit payload " + payload.tag());
    }
    long at = Math.max(startNanos, scheduler.nowNanos());
    PayloadSession session = new PayloadSession(payload, at);
    sessions.put(payload.tag(), session);
    session.pending(scheduler.scheduleAt(at, () -> withPayloadContext(session, () -> start(session))));
    log.debug("Payload {} ({} bytes) submitted for t={}ns", payload.tag(), payload.length(), at);
    return session;
  }

  /**
   * Payloads that can still be submitted. Every submitted payload reserves one source port, whether or not it is
   * later dropped.
   *
   * @return remaining source ports
   */
  public int remainingSourcePorts() {
    return settings.sourcePortCapacity() - sessions.size();
  }

  /**
   * Cancels every pending event. Sessions that had not completed are marked interrupted and keep their counts.
   * Pending events may already be gone when the scheduler discarded them at the horizon; the interrupted count is
   * logged either way.
   */
  public void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    int interrupted = 0;
    int cancelled = 0;
    for (PayloadSession session : sessions.values()) {
      if (session.state() == PayloadState.COMPLETED) {
        continue;
      }
      if (session.pending() != null && scheduler.cancel(session.pending())) {
        cancelled++;
      }
      session.interrupt();
      interrupted++;
      log.debug("Payload {} interrupted in {} after {} fragments", session.payload().tag(), session.state(),
          session.fragmentsSent());
    }
    log.info("Orchestrator stopped at t={}ns; {} of {} payloads interrupted, {} pending events cancelled",
        scheduler.nowNanos(), interrupted, sessions.size(), cancelled);
  }

  /**
   * Statistics of every flow in first-send order.
   *
   * @return new list of snapshots
   */
  public List<FlowStatistics> flowStatistics() {
    return tracker.snapshot();
  }

  /**
   * Statistics per active destination class, in class order.
   *
   * @return new map; classes without flows report NaN means
   */
  public Map<DestinationClass, ClassStatistics> classStatistics() {
    Map<DestinationClass, List<FlowStatistics>> byClass = new EnumMap<>(DestinationClass.class);
    for (DestinationClass cls : binding.destinations().keySet()) {
      byClass.put(cls, new ArrayList<>());
    }
    for (PayloadSession session : sessions.values()) {
      Optional<FlowKey> key = session.flowKey();
      Optional<Destination> destination = session.destination();
      if (key.isPresent() && destination.isPresent()) {
        byClass.get(destination.get().destinationClass()).add(tracker.finalizeFlow(key.get()));
      }
    }
    Map<DestinationClass, ClassStatistics> out = new EnumMap<>(DestinationClass.class);
    byClass.forEach((cls, flows) ->
        out.put(cls, ClassStatisticsAggregator.aggregate(cls, binding.assignedCount(cls), flows)));
    return out;
  }

  /**
   * Per-payload view of the run so far, in submission order.
   *
   * @return new list of outcomes
   */
  public List<PayloadOutcome> outcomes() {
    List<PayloadOutcome> out = new ArrayList<>(sessions.size());
    for (PayloadSession session : sessions.values()) {
      Optional<BindingDecision> decision = session.decision();
      Payload payload = session.payload();
      out.add(new PayloadOutcome(
          payload.tag(),
          payload.label(),
          payload.length(),
          decision.map(d -> d.classification().destinationClass()).orElse(null),
          decision.map(d -> d.classification().score()).orElse(Double.NaN),
          decision.map(BindingDecision::reason).orElse(null),
          session.destination().map(Destination::destinationClass).orElse(null),
          session.state(),
          session.schedule().map(FragmentSchedule::size).orElse(0),
          session.fragmentsSent(),
          session.backpressureEvents(),
          session.interrupted(),
          session.flowKey().map(tracker::finalizeFlow).orElse(null)));
    }
    return out;
  }

  /**
   * Sessions in submission order.
   *
   * @return unmodifiable list
   */
  public List<PayloadSession> sessions() {
    return Collections.unmodifiableList(new ArrayList<>(sessions.values()));
  }

  /**
   * Payloads dropped by the binding.
   *
   * @return dropped count
   */
  public long droppedCount() {
    return binding.droppedCount();
  }

  /**
   * Arrivals the tracker could not reconcile.
   *
   * @return inconsistency count
   */
  public long inconsistencyCount() {
    return tracker.inconsistencyCount();
  }

  /**
   * Payloads assigned per active class.
   *
   * @return new map in class order
   */
  public Map<DestinationClass, Long> assignedCounts() {
    Map<DestinationClass, Long> out = new EnumMap<>(DestinationClass.class);
    for (DestinationClass cls : binding.destinations().keySet()) {
      out.put(cls, binding.assignedCount(cls));
    }
    return out;
  }

  private void start(PayloadSession session) {
    session.pending(null);
    Payload payload = session.payload();
    ClassificationResult result = classify(payload);
    BindingDecision decision = binding.decide(result);
    session.decided(decision);
    if (decision.isDropped()) {
      log.info("Payload {} dropped: {} with score {} has no destination", payload.tag(),
          result.destinationClass(), result.score());
      complete(session);
      return;
    }
    session.transition(PayloadState.FRAGMENTING);
    Destination destination = decision.destination();
    FlowKey key = new FlowKey(allocateSource(), destination.endpoint());
    tracker.openFlow(key);
    FragmentSchedule schedule = pacer.schedule(payload, scheduler.nowNanos());
    session.planned(key, schedule);
    session.transition(PayloadState.SENDING);
    log.info("Payload {} bound to {} ({}); {} fragments on flow {}", payload.tag(),
        destination.destinationClass(), decision.reason(), schedule.size(), key);
    if (schedule.isEmpty()) {
      complete(session);
      return;
    }
    scheduleNext(session, schedule.fragments().get(0).scheduledNanos());
  }

  private ClassificationResult classify(Payload payload) {
    ClassificationResult result;
    try {
      result = classifier.classify(payload.data());
    } catch (RuntimeException ex) {
      log.warn("Classifier failed for payload {}; treating as unresolved", payload.tag(), ex);
      return ClassificationResult.unresolved();
    }
    if (result == null || result.isUnresolved()) {
      log.debug("Payload {} unresolved by classifier", payload.tag());
      return ClassificationResult.unresolved();
    }
    return result;
  }

  private void sendNext(PayloadSession session) {
    session.pending(null);
    FragmentSchedule schedule = session.schedule().orElseThrow();
    FlowKey key = session.flowKey().orElseThrow();
    Fragment fragment = schedule.fragments().get(session.nextFragmentIndex());
    Payload payload = session.payload();
    FragmentFrame frame = new FragmentFrame(payload.tag(), fragment.sequence(),
        session.destination().orElseThrow().destinationClass(), payload.slice(fragment));
    long now = scheduler.nowNanos();
    SendResult result = transport.send(key.source(), key.destination(), frame.encode());
    if (result == SendResult.BACKPRESSURE) {
      session.backpressure();
      metrics.increment("orchestrator.backpressure");
      log.debug("Backpressure on fragment {}; retrying in {}ns", fragment.sequence(),
          settings.backpressureRetryNanos());
      scheduleNext(session, now + settings.backpressureRetryNanos());
      return;
    }
    tracker.recordSend(key, fragment.sequence(), now, fragment.length());
    metrics.increment("orchestrator.fragment.sent");
    session.fragmentSent();
    if (session.fragmentsRemaining() == 0) {
      complete(session);
      return;
    }
    Fragment next = schedule.fragments().get(session.nextFragmentIndex());
    scheduleNext(session, Math.max(next.scheduledNanos(), now));
  }

  private void scheduleNext(PayloadSession session, long atNanos) {
    session.pending(scheduler.scheduleAt(atNanos,
        () -> withPayloadContext(session, () -> sendNext(session))));
  }

  private void complete(PayloadSession session) {
    session.completed(scheduler.nowNanos());
    metrics.increment("orchestrator.payload.completed");
    log.debug("Payload {} completed after {} fragments", session.payload().tag(), session.fragmentsSent());
  }

  private Endpoint allocateSource() {
    return new Endpoint(settings.originAddress(), nextSourcePort++);
  }

  private void onArrival(Endpoint destination, Endpoint source, byte[] bytes, long arrivedNanos) {
    Optional<FragmentFrame> decoded = FragmentFrame.decode(bytes);
    if (decoded.isEmpty()) {
      metrics.increment("orchestrator.frame.malformed");
      log.warn("Discarding malformed datagram of {} bytes from {} at {}: {}", bytes.length, source, destination,
          Logs.hexPreview(bytes, FragmentFrame.HEADER_BYTES));
      return;
    }
    FragmentFrame frame = decoded.get();
    tracker.recordReceive(new FlowKey(source, destination), frame.sequence(), arrivedNanos, frame.body().length);
  }

  private static void withPayloadContext(PayloadSession session, Runnable action) {
    String previous = MDC.get(MDC_PAYLOAD_ID);
    try {
      MDC.put(MDC_PAYLOAD_ID, Integer.toString(session.payload().tag()));
      action.run();
    } finally {
      if (previous == null) {
        MDC.remove(MDC_PAYLOAD_ID);
      } else {
        MDC.put(MDC_PAYLOAD_ID, previous);
      }
    }
  }
}
