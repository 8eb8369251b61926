/**
 * Fragmentation and rate pacing of payloads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.application.pacing;
