/**
 * <strong>Purpose:</strong> Long-running use cases that drive the log pipeline on a schedule.
 * <p><strong>Concurrency:</strong> One collection thread per server; ticks never overlap.</p>
 * <p><strong>Failure model:</strong> Tick failures are logged and the input is retained for the next tick.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.application.pipeline;
