/**
 * <strong>Purpose:</strong> Orchestration of payload delivery and run facades.
 * <p><strong>Pipeline role:</strong> Composes binding, pacing, and tracking with the scheduler and transport ports.
 * <p><strong>Concurrency:</strong> Single-threaded; everything runs inside scheduler callbacks.
 * <p><strong>Observability:</strong> Emits {@code orchestrator.*} metrics and tags logs with {@code payloadId}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.pipeline;
