/**
 * Collector configuration and composition root wiring.
 * <p><strong>Role:</strong> Bootstrap layer translating YAML server sections into run-mode options and adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Section names are validated and API keys redacted through
 * {@code ca.gc.cra.harvest.validation} utilities.</p>
 */
package ca.gc.cra.harvest.config;
