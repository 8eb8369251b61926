/**
 * <strong>Purpose:</strong> Payload, fragment, and payload lifecycle types.
 * <p><strong>Pipeline role:</strong> Origin side of the classify -> pace -> deliver pipeline.
 * <p><strong>Concurrency:</strong> Immutable values; lifecycle state is held by the orchestrator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.domain.payload;
