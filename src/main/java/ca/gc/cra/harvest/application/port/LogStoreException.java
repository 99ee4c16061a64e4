package ca.gc.cra.harvest.application.port;

/**
 * Checked exception thrown when the packaging store for a log batch cannot be allocated.
 *
 * @since 0.1.0
 */
public final class LogStoreException extends Exception {
  public LogStoreException(String msg) { super(msg); }

  public LogStoreException(String msg, Throwable cause) { super(msg, cause); }
}
