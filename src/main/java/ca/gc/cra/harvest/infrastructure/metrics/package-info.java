/**
 * Metrics adapters binding {@link ca.gc.cra.harvest.application.port.MetricsPort} to OpenTelemetry or to nothing.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes {@code logs.dispatch.*}, {@code logs.batch.*} and {@code logs.backlog.size}.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported, never log content.</p>
 */
package ca.gc.cra.harvest.infrastructure.metrics;
