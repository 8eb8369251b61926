/**
 * Application layer of COURIER.
 * <p><strong>Role:</strong> Hosts the binding, pacing, and tracking logic plus the orchestrator that composes them with ports.</p>
 * <p><strong>Concurrency:</strong> Single-threaded, driven by a virtual-time scheduler.</p>
 * <p><strong>Metrics:</strong> Emits namespaces including {@code binding.*}, {@code pacer.*}, {@code orchestrator.*}, and {@code tracker.*}.</p>
 */
package ca.gc.cra.courier.application;
