package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.port.SimulationDriver;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Executes one complete run: staggered submissions, scheduler drive, and summary.
 * <p><strong>Role:</strong> Application facade used by the CLI and end-to-end tests.</p>
 * <p><strong>Thread-safety:</strong> Single use; not thread-safe.</p>
 * <p><strong>Observability:</strong> Logs run start and completion at INFO.</p>
 *
 * @since 0.1.0
 */
public final class SimulationRun {
  private static final Logger log = LoggerFactory.getLogger(SimulationRun.class);

  private final SimulationDriver driver;
  private final DeliveryOrchestrator orchestrator;
  private final long firstStartNanos;
  private final long staggerNanos;
  private final long horizonNanos;
  private boolean executed;

  /**
   * Creates a run.
   *
   * @param driver scheduler shared with the orchestrator
   * @param orchestrator orchestrator owned by this run
   * @param firstStartNanos start time of the first payload
   * @param staggerNanos offset between consecutive payload starts
   * @param horizonNanos virtual time at which the run stops
   * @throws IllegalArgumentException if a time is negative
   */
  public SimulationRun(
      SimulationDriver driver,
      DeliveryOrchestrator orchestrator,
      long firstStartNanos,
      long staggerNanos,
      long horizonNanos) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    if (firstStartNanos < 0 || staggerNanos < 0 || horizonNanos < 0) {
      throw new IllegalArgumentException("run times must be non-negative");
    }
    this.firstStartNanos = firstStartNanos;
    this.staggerNanos = staggerNanos;
    this.horizonNanos = horizonNanos;
  }

  /**
   * Submits the payloads, drives the scheduler to the horizon, and stops the orchestrator.
   *
   * @param payloads payloads in submission order; payload {@code k} starts at {@code first + k * stagger}
   * @return run summary
   * @throws IllegalStateException if called twice
   * @throws ConfigurationException if there are more payloads than source ports; nothing is submitted
   */
  public SimulationSummary execute(List<Payload> payloads) {
    Objects.requireNonNull(payloads, "payloads");
    if (executed) {
      throw new IllegalStateException("SimulationRun already executed");
    }
    if (payloads.size() > orchestrator.remainingSourcePorts()) {
      throw new ConfigurationException(payloads.size() + " payloads exceed the "
          + orchestrator.remainingSourcePorts() + " source ports available for one run");
    }
    executed = true;
    log.info("Starting run with {} payloads; horizon t={}ns", payloads.size(), horizonNanos);
    for (int k = 0; k < payloads.size(); k++) {
      long start = firstStartNanos + k * staggerNanos;
      if (start > horizonNanos) {
        log.warn("Payload {} starts after the horizon ({}ns > {}ns) and will not be classified",
            payloads.get(k).tag(), start, horizonNanos);
      }
      orchestrator.submit(payloads.get(k), start);
    }
    long events = driver.runUntil(horizonNanos);
    orchestrator.stop();
    SimulationSummary summary = new SimulationSummary(
        horizonNanos,
        events,
        orchestrator.droppedCount(),
        orchestrator.inconsistencyCount(),
        orchestrator.outcomes(),
        orchestrator.flowStatistics(),
        orchestrator.classStatistics());
    log.info("Run finished: {} events, {} flows, {} dropped, {} interrupted, {} inconsistencies",
        events, summary.flows().size(), summary.droppedCount(), summary.interruptedCount(),
        summary.inconsistencyCount());
    return summary;
  }
}
