/**
 * <strong>Purpose:</strong> Delivery tracking and statistics aggregation.
 * <p><strong>Concurrency:</strong> Tracker instances are owned by a single run and confined to its thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.stats;
