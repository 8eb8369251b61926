/**
 * Classification vocabulary: the closed set of destination classes and classifier results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.domain.classify;
