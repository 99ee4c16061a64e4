/**
 * <strong>Purpose:</strong> Logging utilities: startup verbosity and bounded previews of log content.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Security:</strong> Previews cap how much server log text reaches operator logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.logging;
