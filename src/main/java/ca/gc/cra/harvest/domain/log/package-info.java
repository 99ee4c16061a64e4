/**
 * Domain values describing database server log lines and the query samples extracted from them.
 * <p><strong>Role:</strong> Domain layer types passed between log pipeline stages and analyzer ports.</p>
 * <p><strong>Concurrency:</strong> Records are immutable and safe to share.</p>
 * <p><strong>Security:</strong> Line content and samples may carry statement text with literals; adapters
 * must avoid echoing full content into operator logs (see {@code ca.gc.cra.harvest.logging.Logs}).</p>
 */
package ca.gc.cra.harvest.domain.log;
