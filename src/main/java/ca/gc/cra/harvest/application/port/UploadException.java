package ca.gc.cra.harvest.application.port;

/**
 * Checked exception thrown when a packaged log batch could not be delivered.
 *
 * @since 0.1.0
 */
public final class UploadException extends Exception {
  public UploadException(String msg) { super(msg); }

  public UploadException(String msg, Throwable cause) { super(msg, cause); }
}
