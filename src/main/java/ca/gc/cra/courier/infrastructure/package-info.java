/**
 * Adapters implementing COURIER ports.
 * <p><strong>Role:</strong> Scheduler, transport, classifier, payload, metrics, and report adapters.</p>
 * <p><strong>Concurrency:</strong> Simulation adapters are single-threaded; metrics adapters are thread-safe.</p>
 */
package ca.gc.cra.courier.infrastructure;
