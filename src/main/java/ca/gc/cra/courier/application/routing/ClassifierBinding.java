package ca.gc.cra.courier.application.routing;

import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.net.Destination;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps classification results to destinations and owns the fallback policy.
 * <p><strong>Why:</strong> Classifier confidence is a distance (lower is better); payloads the classifier is unsure
 * about must go somewhere deliberate or be dropped and counted, never lost silently.</p>
 * <p><strong>Role:</strong> Application service called once per payload by the orchestrator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept a known active class when its score is strictly below the threshold.</li>
 *   <li>Route everything else to the fallback class, or drop it when no fallback is configured.</li>
 *   <li>Count assignments per class and drops.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the simulation thread.</p>
 * <p><strong>Observability:</strong> Increments {@code binding.assigned.<class>}, {@code binding.fallback}, and
 * {@code binding.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class ClassifierBinding {
  private static final Logger log = LoggerFactory.getLogger(ClassifierBinding.class);

  private final Map<DestinationClass, Destination> destinations;
  private final double threshold;
  private final Destination fallback;
  private final MetricsPort metrics;
  private final Map<DestinationClass, Long> assigned = new EnumMap<>(DestinationClass.class);
  private long dropped;

  /**
   * Creates a binding.
   *
   * @param destinations destination per active class; must not be empty or contain {@code UNRESOLVED}
   * @param threshold distance threshold; results are accepted when {@code score < threshold}
   * @param fallbackClass optional fallback class; must be one of the active classes
   * @param metrics metrics sink
   * @throws ConfigurationException if the threshold is not a positive finite number, the destination map is
   *     inconsistent, or the fallback class is not active
   */
  public ClassifierBinding(
      Map<DestinationClass, Destination> destinations,
      double threshold,
      Optional<DestinationClass> fallbackClass,
      MetricsPort metrics) {
    Objects.requireNonNull(destinations, "destinations");
    Objects.requireNonNull(fallbackClass, "fallbackClass");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (destinations.isEmpty()) {
      throw new ConfigurationException("at least one destination class is required");
    }
    if (!Double.isFinite(threshold) || threshold <= 0) {
      throw new ConfigurationException("confidenceThreshold must be a positive number (was " + threshold + ")");
    }
    EnumMap<DestinationClass, Destination> copy = new EnumMap<>(DestinationClass.class);
    destinations.forEach((cls, destination) -> {
      if (!cls.isNamed()) {
        throw new ConfigurationException("UNRESOLVED cannot be bound to a destination");
      }
      if (destination.destinationClass() != cls) {
        throw new ConfigurationException("destination " + destination + " registered under " + cls);
      }
      copy.put(cls, destination);
    });
    this.destinations = Collections.unmodifiableMap(copy);
    this.threshold = threshold;
    this.fallback = fallbackClass.map(cls -> {
      Destination d = copy.get(cls);
      if (d == null) {
        throw new ConfigurationException("fallbackClass " + cls + " is not among the active classes " + copy.keySet());
      }
      return d;
    }).orElse(null);
  }

  /**
   * Binds a result to a destination.
   *
   * @param result classification result
   * @return destination, or empty when the payload is dropped
   */
  public Optional<Destination> bind(ClassificationResult result) {
    return decide(result).route();
  }

  /**
   * Binds a result to a destination and reports why.
   *
   * @param result classification result; must not be {@code null}
   * @return decision; never {@code null}
   */
  public BindingDecision decide(ClassificationResult result) {
    Objects.requireNonNull(result, "result");
    DestinationClass cls = result.destinationClass();
    Destination direct = cls.isNamed() ? destinations.get(cls) : null;
    if (direct != null && result.score() < threshold) {
      return record(new BindingDecision(BindingDecision.Reason.MATCHED, result, direct));
    }
    BindingDecision.Reason reason = direct == null
        ? BindingDecision.Reason.FALLBACK_UNRESOLVED
        : BindingDecision.Reason.FALLBACK_LOW_CONFIDENCE;
    if (fallback == null) {
      log.debug("No destination for {} (score {}); dropping", cls, result.score());
      return record(new BindingDecision(BindingDecision.Reason.DROPPED, result, null));
    }
    log.debug("Routing {} (score {}) to fallback {} ({})", cls, result.score(),
        fallback.destinationClass(), reason);
    return record(new BindingDecision(reason, result, fallback));
  }

  /**
   * Payloads assigned to a class so far, including fallback assignments.
   *
   * @param cls destination class
   * @return assignment count
   */
  public long assignedCount(DestinationClass cls) {
    return assigned.getOrDefault(cls, 0L);
  }

  /**
   * Payloads dropped so far.
   *
   * @return dropped count
   */
  public long droppedCount() {
    return dropped;
  }

  /**
   * Active destinations in class order.
   *
   * @return unmodifiable view
   */
  public Map<DestinationClass, Destination> destinations() {
    return destinations;
  }

  /**
   * Configured fallback class.
   *
   * @return fallback class, or empty when unassigned payloads are dropped
   */
  public Optional<DestinationClass> fallbackClass() {
    return fallback == null ? Optional.empty() : Optional.of(fallback.destinationClass());
  }

  private BindingDecision record(BindingDecision decision) {
    if (decision.isDropped()) {
      dropped++;
      metrics.increment("binding.dropped");
      return decision;
    }
    DestinationClass bound = decision.destination().destinationClass();
    assigned.merge(bound, 1L, Long::sum);
    metrics.increment("binding.assigned." + bound.name().toLowerCase(Locale.ROOT));
    if (decision.isFallback()) {
      metrics.increment("binding.fallback");
    }
    return decision;
  }
}
