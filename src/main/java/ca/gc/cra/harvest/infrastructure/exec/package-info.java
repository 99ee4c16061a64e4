/**
 * Executor factories with named, non-daemon threads for collection loops.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.exec;
