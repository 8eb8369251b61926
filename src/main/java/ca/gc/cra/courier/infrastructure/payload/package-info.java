/**
 * Payload sources: synthetic patterned images and image directories.
 */
package ca.gc.cra.courier.infrastructure.payload;
