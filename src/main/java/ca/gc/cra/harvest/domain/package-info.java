/**
 * <strong>Purpose:</strong> Core domain model for the HARVEST log ingestion and dispatch agent.
 * <p><strong>Pipeline role:</strong> Domain layer; free of IO and framework dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable value objects.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.domain;
