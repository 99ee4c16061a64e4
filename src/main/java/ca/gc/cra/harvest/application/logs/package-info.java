/**
 * <strong>Purpose:</strong> Log ingestion and dispatch: stitching, quiescence windowing, per-backend joining,
 * packaging and the dispatch state machine.
 * <p><strong>Pipeline role:</strong> Application layer between {@code LogLineSource} and the grant and upload ports.</p>
 * <p><strong>Concurrency:</strong> One {@link ca.gc.cra.harvest.application.logs.LogPipeline} invocation is
 * synchronous; stages are stateless.</p>
 * <p><strong>Failure model:</strong> Store, grant and upload failures replay the whole input; grant denial and
 * local-only modes drop the ready lines.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.logs;
