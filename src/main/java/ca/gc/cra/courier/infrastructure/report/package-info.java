/**
 * Run report writers.
 */
package ca.gc.cra.courier.infrastructure.report;
