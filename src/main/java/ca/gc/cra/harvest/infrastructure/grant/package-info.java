/**
 * Grant sources: local grants for offline runs, file based grants and the control-plane document parser.
 * <p><strong>Failure model:</strong> Unreadable or malformed grants raise
 * {@link ca.gc.cra.harvest.application.port.GrantRequestException}, which the dispatcher retries.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.grant;
