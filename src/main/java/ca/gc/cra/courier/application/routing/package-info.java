/**
 * Classification-to-destination binding and its fallback policy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.routing;
