package ca.gc.cra.courier.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.pacing.FragmentPacer;
import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.ReceiveListener;
import ca.gc.cra.courier.application.port.RecordingMetricsPort;
import ca.gc.cra.courier.application.port.SendResult;
import ca.gc.cra.courier.application.port.TransportPort;
import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.application.routing.ClassifierBinding;
import ca.gc.cra.courier.application.stats.DeliveryTracker;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.net.Destination;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.domain.net.FragmentFrame;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.domain.payload.PayloadState;
import ca.gc.cra.courier.infrastructure.classify.ScriptedClassifier;
import ca.gc.cra.courier.infrastructure.sim.EventQueueScheduler;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DeliveryOrchestratorTest {
  private static final long RETRY_NANOS = 1_000_000L;

  @Test
  void droppedPayloadCompletesWithoutSendingAnything() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 180.0))),
        Optional.empty());

    PayloadSession session = h.orchestrator.submit(new Payload(0, "messi-0", new byte[5000]), 0L);
    h.scheduler.runUntil(1_000_000_000L);

    assertEquals(PayloadState.COMPLETED, session.state());
    assertTrue(session.dropped());
    assertEquals(0, session.fragmentsSent());
    assertEquals(1L, h.orchestrator.droppedCount());
    assertTrue(h.transport.sent.isEmpty());
    assertTrue(h.orchestrator.flowStatistics().isEmpty());
    assertEquals(1, h.metrics.count("binding.dropped"));
  }

  @Test
  void lowConfidenceFallbackSendsEveryFragmentToFallbackDestination() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 180.0))),
        Optional.of(DestinationClass.HAALAND));

    PayloadSession session = h.orchestrator.submit(new Payload(0, "messi-0", new byte[5000]), 0L);
    h.scheduler.runUntil(1_000_000_000L);

    assertEquals(PayloadState.COMPLETED, session.state());
    assertEquals(5, session.fragmentsSent());
    assertEquals(5, h.transport.sent.size());
    Endpoint haaland = Harness.endpoint(DestinationClass.HAALAND);
    assertTrue(h.transport.sent.stream().allMatch(s -> s.destination.equals(haaland)));
    FlowStatistics stats = h.orchestrator.flowStatistics().get(0);
    assertEquals(haaland, stats.key().destination());
    assertEquals(5L, stats.received());
    assertEquals(BindingDecision.Reason.FALLBACK_LOW_CONFIDENCE, session.decision().orElseThrow().reason());
  }

  @Test
  void fragmentsAreSentAtPacedTimesWithIncreasingSequence() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.NEYMAR, 3.0))),
        Optional.empty());

    h.orchestrator.submit(new Payload(0, "neymar-0", new byte[2500]), 2_000_000_000L);
    h.scheduler.runUntil(3_000_000_000L);

    List<Sent> sent = h.transport.sent;
    assertEquals(3, sent.size());
    assertEquals(2_000_000_000L, sent.get(0).atNanos);
    assertEquals(2_008_000_000L, sent.get(1).atNanos);
    assertEquals(2_016_000_000L, sent.get(2).atNanos);
    for (int i = 0; i < sent.size(); i++) {
      FragmentFrame frame = FragmentFrame.decode(sent.get(i).bytes).orElseThrow();
      assertEquals(i, frame.sequence());
      assertEquals(DestinationClass.NEYMAR, frame.destinationClass());
    }
    assertEquals(500, FragmentFrame.decode(sent.get(2).bytes).orElseThrow().body().length);
  }

  @Test
  void zeroLengthPayloadCompletesWithEmptyFlow() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 1.0))),
        Optional.empty());

    PayloadSession session = h.orchestrator.submit(new Payload(0, "empty", new byte[0]), 0L);
    h.scheduler.runUntil(1_000_000L);

    assertEquals(PayloadState.COMPLETED, session.state());
    assertFalse(session.dropped());
    FlowStatistics stats = h.orchestrator.flowStatistics().get(0);
    assertEquals(0L, stats.sent());
    assertEquals(0.0, stats.lossRatio(), 0.0);
    assertTrue(Double.isNaN(stats.meanDelayNanos()));
  }

  @Test
  void classifierFailureIsTreatedAsUnresolved() {
    Harness h = new Harness(
        new ScriptedClassifier().thenFail("model unavailable"),
        Optional.of(DestinationClass.RONALDO));

    PayloadSession session = h.orchestrator.submit(new Payload(0, "x", new byte[100]), 0L);
    h.scheduler.runUntil(1_000_000_000L);

    BindingDecision decision = session.decision().orElseThrow();
    assertTrue(decision.classification().isUnresolved());
    assertEquals(BindingDecision.Reason.FALLBACK_UNRESOLVED, decision.reason());
    assertEquals(DestinationClass.RONALDO, session.destination().orElseThrow().destinationClass());
  }

  @Test
  void backpressureReschedulesTheSameFragment() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 1.0))),
        Optional.empty());
    h.transport.refuseNext = 2;

    PayloadSession session = h.orchestrator.submit(new Payload(0, "messi-0", new byte[2000]), 0L);
    h.scheduler.runUntil(1_000_000_000L);

    assertEquals(2L, session.backpressureEvents());
    assertEquals(2, session.fragmentsSent());
    assertEquals(2 * RETRY_NANOS, h.transport.sent.get(0).atNanos);
    assertEquals(8_000_000L, h.transport.sent.get(1).atNanos);
    assertEquals(2, h.metrics.count("orchestrator.backpressure"));
    assertEquals(0L, h.orchestrator.inconsistencyCount());
  }

  @Test
  void stopCancelsPendingSendsAndKeepsPartialCounts() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 1.0))),
        Optional.empty());

    PayloadSession session = h.orchestrator.submit(new Payload(0, "messi-0", new byte[10_000]), 0L);
    h.scheduler.runUntil(20_000_000L);
    h.orchestrator.stop();

    assertEquals(PayloadState.SENDING, session.state());
    assertTrue(session.interrupted());
    assertEquals(3, session.fragmentsSent());
    assertEquals(0, h.scheduler.pendingCount());
    assertEquals(3L, h.orchestrator.flowStatistics().get(0).sent());
    assertThrows(IllegalStateException.class,
        () -> h.orchestrator.submit(new Payload(1, "late", new byte[1]), 0L));
  }

  @Test
  void malformedDatagramIsCountedAndIgnored() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 1.0))),
        Optional.empty());

    Endpoint messi = Harness.endpoint(DestinationClass.MESSI);
    h.transport.listeners.get(messi).onReceive(messi, new Endpoint("10.9.9.9", 1), new byte[] {1, 2, 3}, 0L);

    assertEquals(1, h.metrics.count("orchestrator.frame.malformed"));
    assertEquals(0L, h.orchestrator.inconsistencyCount());
  }

  @Test
  void duplicateTagIsRejected() {
    Harness h = new Harness(new ScriptedClassifier(), Optional.empty());
    h.orchestrator.submit(new Payload(4, "a", new byte[1]), 0L);

    assertThrows(IllegalArgumentException.class,
        () -> h.orchestrator.submit(new Payload(4, "b", new byte[1]), 0L));
  }

  @Test
  void eachPayloadGetsItsOwnFlow() {
    Harness h = new Harness(
        ScriptedClassifier.of(List.of(new ClassificationResult(DestinationClass.MESSI, 1.0))),
        Optional.empty());

    h.orchestrator.submit(new Payload(0, "a", new byte[10]), 0L);
    h.orchestrator.submit(new Payload(1, "b", new byte[10]), 0L);
    h.scheduler.runUntil(1_000_000_000L);

    List<FlowStatistics> flows = h.orchestrator.flowStatistics();
    assertEquals(2, flows.size());
    assertEquals(49152, flows.get(0).key().source().port());
    assertEquals(49153, flows.get(1).key().source().port());
    assertEquals(2L, h.orchestrator.classStatistics().get(DestinationClass.MESSI).assigned());
    assertEquals(2, h.orchestrator.classStatistics().get(DestinationClass.MESSI).flows());
  }

  @Test
  void submitBeyondLastSourcePortIsRejectedBeforeScheduling() {
    ScriptedClassifier classifier = ScriptedClassifier.parse("MESSI:1");
    Harness h = new Harness(classifier, Optional.empty(), 65_534);

    h.orchestrator.submit(new Payload(0, "a", new byte[10]), 0L);
    h.orchestrator.submit(new Payload(1, "b", new byte[10]), 0L);
    assertEquals(0, h.orchestrator.remainingSourcePorts());
    assertThrows(IllegalStateException.class,
        () -> h.orchestrator.submit(new Payload(2, "c", new byte[10]), 0L));
    h.scheduler.runUntil(1_000_000_000L);

    assertEquals(2, h.orchestrator.sessions().size());
    assertEquals(2, classifier.calls());
    List<FlowStatistics> flows = h.orchestrator.flowStatistics();
    assertEquals(65_534, flows.get(0).key().source().port());
    assertEquals(65_535, flows.get(1).key().source().port());
    assertTrue(h.orchestrator.sessions().stream().allMatch(s -> s.state() == PayloadState.COMPLETED));
  }

  @Test
  void stopAfterSchedulerCleanupStillReportsInterruptedPayloads() {
    Logger logger = (Logger) LoggerFactory.getLogger(DeliveryOrchestrator.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      Harness h = new Harness(ScriptedClassifier.parse("MESSI:1"), Optional.empty());
      PayloadSession cut = h.orchestrator.submit(new Payload(0, "cut", new byte[10_000]), 0L);
      PayloadSession done = h.orchestrator.submit(new Payload(1, "done", new byte[10]), 0L);
      h.scheduler.runUntil(20_000_000L);
      assertEquals(0, h.scheduler.pendingCount());

      h.orchestrator.stop();

      assertTrue(cut.interrupted());
      assertFalse(done.interrupted());
      assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.INFO
          && e.getFormattedMessage().contains("1 of 2 payloads interrupted, 0 pending events cancelled")),
          () -> appender.list.toString());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }
  }

  private static final class Harness {
    final EventQueueScheduler scheduler = new EventQueueScheduler();
    final LoopbackTransport transport = new LoopbackTransport(scheduler);
    final RecordingMetricsPort metrics = new RecordingMetricsPort();
    final DeliveryOrchestrator orchestrator;

    Harness(ClassifierPort classifier, Optional<DestinationClass> fallback) {
      this(classifier, fallback, OrchestratorSettings.DEFAULT_FIRST_SOURCE_PORT);
    }

    Harness(ClassifierPort classifier, Optional<DestinationClass> fallback, int firstSourcePort) {
      Map<DestinationClass, Destination> destinations = new EnumMap<>(DestinationClass.class);
      for (DestinationClass cls : DestinationClass.named()) {
        destinations.put(cls, new Destination(cls, endpoint(cls)));
      }
      ClassifierBinding binding = new ClassifierBinding(destinations, 100.0, fallback, metrics);
      orchestrator = new DeliveryOrchestrator(
          scheduler,
          transport,
          classifier,
          binding,
          new FragmentPacer(1000, 1_000_000L, MetricsPort.NO_OP),
          new DeliveryTracker(metrics),
          metrics,
          new OrchestratorSettings("10.1.0.1", firstSourcePort, RETRY_NANOS));
    }

    static Endpoint endpoint(DestinationClass cls) {
      return new Endpoint("10.1." + (cls.ordinal() + 1) + ".2", 9);
    }
  }

  /** Delivers every accepted frame one millisecond later; can refuse a number of sends first. */
  private static final class LoopbackTransport implements TransportPort {
    final EventQueueScheduler scheduler;
    final Map<Endpoint, ReceiveListener> listeners = new HashMap<>();
    final List<Sent> sent = new ArrayList<>();
    int refuseNext;

    LoopbackTransport(EventQueueScheduler scheduler) {
      this.scheduler = scheduler;
    }

    @Override
    public SendResult send(Endpoint source, Endpoint destination, byte[] bytes) {
      if (refuseNext > 0) {
        refuseNext--;
        return SendResult.BACKPRESSURE;
      }
      long now = scheduler.nowNanos();
      sent.add(new Sent(destination, bytes, now));
      long arrival = now + 1_000_000L;
      scheduler.scheduleAt(arrival, () -> listeners.get(destination).onReceive(destination, source, bytes, arrival));
      return SendResult.ACCEPTED;
    }

    @Override
    public void onReceive(Endpoint destination, ReceiveListener listener) {
      listeners.put(destination, listener);
    }
  }

  private static final class Sent {
    final Endpoint destination;
    final byte[] bytes;
    final long atNanos;

    Sent(Endpoint destination, byte[] bytes, long atNanos) {
      this.destination = destination;
      this.bytes = bytes;
      this.atNanos = atNanos;
    }
  }
}
