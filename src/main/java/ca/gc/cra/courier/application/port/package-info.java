/**
 * <strong>Purpose:</strong> Ports defining the classify -> pace -> deliver contracts.
 * <p><strong>Pipeline role:</strong> Adapters in {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Runs are single-threaded; port implementations are confined to the simulation thread
 * unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.port;
