package ca.gc.cra.harvest.application.port;

/**
 * Checked exception thrown when a grant cannot be obtained from the control plane.
 * <p>A grant that was obtained but denies log collection is not an error and is reported through
 * {@link ca.gc.cra.harvest.domain.grant.Grant#valid()} instead.</p>
 *
 * @since 0.1.0
 */
public final class GrantRequestException extends Exception {
  public GrantRequestException(String msg) { super(msg); }

  public GrantRequestException(String msg, Throwable cause) { super(msg, cause); }
}
