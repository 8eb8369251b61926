/**
 * Configuration records, YAML loading, and composition root wiring for COURIER CLIs.
 * <p><strong>Role:</strong> Bootstrap layer turning defaults, YAML, and {@code key=value} arguments into a validated
 * {@link ca.gc.cra.courier.config.SimulationConfig} and a runnable simulation.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Errors:</strong> Invalid values raise {@link ca.gc.cra.courier.validation.ConfigurationException}.</p>
 */
package ca.gc.cra.courier.config;
