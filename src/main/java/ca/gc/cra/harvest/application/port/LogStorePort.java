package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.application.logs.LogFile;

/**
 * <strong>What:</strong> Port allocating the process-local byte store that backs one packaged log batch.
 * <p><strong>Why:</strong> Keeps temp file placement (and failure injection in tests) out of the pipeline.</p>
 * <p><strong>Role:</strong> Domain port called once per batch that has ready lines.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent allocation.</p>
 *
 * @since 0.1.0
 */
public interface LogStorePort {
  /**
   * Allocates an empty store owned exclusively by the caller.
   *
   * @return open log file; the caller must close it on every path
   * @throws LogStoreException if the store cannot be created
   */
  LogFile allocate() throws LogStoreException;
}
