package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.log.LogLine;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port delivering log lines newly observed from the database server's log output.
 * <p><strong>Why:</strong> Separates acquisition (log files, syslog, cloud log APIs) from reassembly and dispatch.</p>
 * <p><strong>Role:</strong> Domain port polled once per collection tick.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate {@link #poll()} from the collection thread
 * while acquisition threads append.</p>
 *
 * @since 0.1.0
 */
public interface LogLineSource {
  /**
   * Drains and returns every line observed since the previous call.
   *
   * @return newly observed lines in observation order, each stamped with its observation instant; never {@code null}
   * @throws IOException if the underlying source cannot be read
   */
  List<LogLine> poll() throws IOException;
}
