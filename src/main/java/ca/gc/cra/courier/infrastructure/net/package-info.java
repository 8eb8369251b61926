/**
 * Simulated network transport adapters.
 * <p><strong>Role:</strong> Adapter layer implementing {@code TransportPort} over the virtual-time scheduler.</p>
 * <p><strong>Concurrency:</strong> Single-threaded.</p>
 * <p><strong>Metrics:</strong> {@code transport.link.lost}.</p>
 */
package ca.gc.cra.courier.infrastructure.net;
