/**
 * Classification backends implementing {@code ClassifierPort}.
 */
package ca.gc.cra.courier.infrastructure.classify;
