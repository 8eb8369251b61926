/**
 * <strong>Purpose:</strong> Network addressing primitives shared by the transport port and flow keys.
 * <p><strong>Concurrency:</strong> All types are immutable records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.domain.net;
