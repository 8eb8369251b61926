/**
 * <strong>Purpose:</strong> Flow identity, per-flow aggregates, and statistics snapshots.
 * <p><strong>Pipeline role:</strong> Receiver side of delivery; fed by the delivery tracker.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.courier.domain.flow.FlowRecord} is confined to the
 * simulation thread; the other types are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.domain.flow;
