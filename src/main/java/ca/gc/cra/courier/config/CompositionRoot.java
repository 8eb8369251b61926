package ca.gc.cra.courier.config;

import ca.gc.cra.courier.application.pacing.FragmentPacer;
import ca.gc.cra.courier.application.pipeline.DeliveryOrchestrator;
import ca.gc.cra.courier.application.pipeline.OrchestratorSettings;
import ca.gc.cra.courier.application.pipeline.SimulationRun;
import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.PayloadSource;
import ca.gc.cra.courier.application.routing.ClassifierBinding;
import ca.gc.cra.courier.application.stats.DeliveryTracker;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.infrastructure.classify.PatternClassifier;
import ca.gc.cra.courier.infrastructure.classify.ScriptedClassifier;
import ca.gc.cra.courier.infrastructure.net.PointToPointTransport;
import ca.gc.cra.courier.infrastructure.payload.DirectoryPayloadSource;
import ca.gc.cra.courier.infrastructure.payload.SyntheticPayloadSource;
import ca.gc.cra.courier.infrastructure.sim.EventQueueScheduler;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Central composition root that wires COURIER use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a validated {@link SimulationConfig} into a runnable
 * {@link SimulationRun}.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning classify -> pace -> deliver stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the classifier backend (pattern matching, or a scripted sequence for rehearsals).</li>
 *   <li>Select the payload source (image directory, or synthetic per-class payloads).</li>
 *   <li>Build a fresh scheduler, transport, tracker, and orchestrator for every run.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new instances and are not
 * synchronized.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.courier.application.pipeline.DeliveryOrchestrator
 */
public final class CompositionRoot {
  private final SimulationConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root that discards metrics.
   *
   * @param config validated simulation configuration
   */
  public CompositionRoot(SimulationConfig config) {
    this(config, MetricsPort.NO_OP);
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config validated simulation configuration
   * @param metrics metrics adapter shared by every component of a run
   */
  public CompositionRoot(SimulationConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Configuration this root was built from.
   *
   * @return configuration
   */
  public SimulationConfig config() {
    return config;
  }

  /**
   * Builds the payload source: the image directory when {@code imageDir} is set, synthetic payloads otherwise.
   *
   * @return payload source
   */
  public PayloadSource payloadSource() {
    return config.imageDir()
        .<PayloadSource>map(DirectoryPayloadSource::new)
        .orElseGet(() -> new SyntheticPayloadSource(
            config.classes(), config.imagesPerClass(), config.imageSize()));
  }

  /**
   * Builds the classifier backend.
   *
   * @return classifier
   */
  public ClassifierPort classifier() {
    return classifier(config.classifierScript(), config.classes());
  }

  /**
   * Builds the binding for the configured classes, threshold, and fallback.
   *
   * @return binding
   */
  public ClassifierBinding binding() {
    return new ClassifierBinding(
        config.destinations(), config.confidenceThreshold(), config.fallbackClass(), metrics);
  }

  /**
   * Wires a complete, isolated run. Each call returns a run with its own clock, links, and tracker.
   *
   * @return run ready to execute
   */
  public SimulationRun simulationRun() {
    EventQueueScheduler scheduler = new EventQueueScheduler();
    PointToPointTransport transport =
        new PointToPointTransport(scheduler, config.linkProfile(), config.seed(), metrics);
    DeliveryOrchestrator orchestrator = new DeliveryOrchestrator(
        scheduler,
        transport,
        classifier(),
        binding(),
        new FragmentPacer(config.fragmentSize(), config.dataRateBps(), metrics),
        new DeliveryTracker(metrics),
        metrics,
        new OrchestratorSettings(
            config.originAddress(),
            OrchestratorSettings.DEFAULT_FIRST_SOURCE_PORT,
            config.effectiveBackpressureRetryNanos()));
    return new SimulationRun(
        scheduler, orchestrator, config.startTimeNanos(), config.staggerNanos(), config.simulationTimeNanos());
  }

  /**
   * Builds the binding used by the {@code classify} command. No links exist there, so destinations use the same
   * endpoints a simulation on the default port would.
   *
   * @param classify classify configuration
   * @param metrics metrics sink
   * @return binding
   */
  public static ClassifierBinding binding(ClassifyConfig classify, MetricsPort metrics) {
    int port = Integer.parseInt(DefaultsForMode.asFlatMap("simulate").get("port"));
    return new ClassifierBinding(
        SimulationConfig.destinationsFor(classify.classes(), port),
        classify.confidenceThreshold(),
        classify.fallbackClass(),
        metrics);
  }

  /**
   * Builds a classifier backend.
   *
   * @param script optional scripted results; when present a {@link ScriptedClassifier} is used
   * @param classes classes the pattern classifier may report
   * @return classifier
   */
  public static ClassifierPort classifier(Optional<String> script, List<DestinationClass> classes) {
    if (script.isPresent()) {
      return ScriptedClassifier.parse(script.get());
    }
    return new PatternClassifier(EnumSet.copyOf(classes));
  }
}
