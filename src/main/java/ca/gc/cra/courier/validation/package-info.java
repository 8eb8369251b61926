/**
 * <strong>Purpose:</strong> Input validation helpers and the configuration failure type.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.validation;
