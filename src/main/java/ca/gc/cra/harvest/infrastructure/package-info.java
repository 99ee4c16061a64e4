/**
 * Infrastructure adapters binding HARVEST ports to the file system, clocks, executors and OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer implementing the acquire, store, grant and upload contracts.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees.</p>
 * <p><strong>Metrics:</strong> Metrics adapters publish the {@code logs.*} namespace.</p>
 * <p><strong>Security:</strong> Grant upload fields and API keys are never logged.</p>
 */
package ca.gc.cra.harvest.infrastructure;
