package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Port abstracting COURIER metrics emission.
 * <p><strong>Why:</strong> Lets the binding, orchestrator, and tracker count events without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events such as dropped payloads or backpressure retries.</li>
 *   <li>Record numeric observations such as per-fragment delays.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread, although a run only calls
 * them from the simulation thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code tracker.delayNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code binding.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p>Useful for tests and for runs with {@code metricsExporter=none}.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
