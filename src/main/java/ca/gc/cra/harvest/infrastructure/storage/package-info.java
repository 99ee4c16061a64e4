/**
 * Temp-file backed packaging stores for log batches.
 * <p><strong>Lifecycle:</strong> One file per batch, deleted when the batch is released.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.storage;
