/**
 * Upload adapters delivering packaged log batches to local directories or, through a routed port, an object store.
 * <p><strong>Failure model:</strong> Adapters never retry; failures surface as
 * {@link ca.gc.cra.harvest.application.port.UploadException} and the dispatcher replays the batch.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.upload;
