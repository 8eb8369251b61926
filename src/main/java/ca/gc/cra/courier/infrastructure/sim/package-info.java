/**
 * Virtual-time scheduler adapters.
 * <p><strong>Concurrency:</strong> Single-threaded; callbacks run on the driving thread.</p>
 */
package ca.gc.cra.courier.infrastructure.sim;
