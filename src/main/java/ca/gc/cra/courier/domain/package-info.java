/**
 * Core domain model for COURIER classify -> pace -> deliver runs.
 * <p><strong>Role:</strong> Payloads, destinations, fragments, and flow statistics without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code binding.*}, {@code orchestrator.*}, and {@code tracker.*} metrics.</p>
 */
package ca.gc.cra.courier.domain;
