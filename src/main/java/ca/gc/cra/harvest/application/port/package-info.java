/**
 * <strong>Purpose:</strong> Ports defining the acquire -> reassemble -> dispatch contracts of the log pipeline.
 * <p><strong>Pipeline role:</strong> Domain layer; adapters in {@code ca.gc.cra.harvest.infrastructure} implement
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Failure model:</strong> Store, grant and upload failures are checked exceptions so the dispatcher
 * can map each to its retry policy.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.port;
