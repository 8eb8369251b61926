/**
 * Metrics adapters implementing {@code MetricsPort}.
 * <p><strong>Role:</strong> Bridges {@code binding.*}, {@code orchestrator.*}, {@code tracker.*}, and
 * {@code transport.*} keys to OpenTelemetry instruments.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.</p>
 */
package ca.gc.cra.courier.infrastructure.metrics;
