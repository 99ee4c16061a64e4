/**
 * Control-plane grant values authorizing one log dispatch attempt.
 * <p><strong>Security:</strong> Object store fields contain signed upload credentials and must never be logged.</p>
 */
package ca.gc.cra.harvest.domain.grant;
