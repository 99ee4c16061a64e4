package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Packaged log artifact: a process-local temp byte store plus the lines that index into it.
 * <p><strong>Why:</strong> The backend receives one concatenated buffer per batch and locates each line through its
 * byte range.</p>
 * <p><strong>Role:</strong> Resource owned by exactly one {@link LogState}; released on every exit path.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the collection thread.</p>
 *
 * @implNote {@link #close()} closes the stream and deletes the backing file; it is idempotent and logs, rather
 * than throws, cleanup failures so that release never masks the batch outcome.
 * @since 0.1.0
 */
public final class LogFile implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LogFile.class);

  private final UUID uuid;
  private final Path path;
  private final OutputStream out;
  private final List<LogLine> lines = new ArrayList<>();
  private long size;
  private boolean closed;

  /**
   * Wraps an already created backing file.
   *
   * @param uuid artifact identifier
   * @param path backing file; deleted on {@link #close()}
   * @param out open stream writing to {@code path}
   */
  public LogFile(UUID uuid, Path path, OutputStream out) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.path = Objects.requireNonNull(path, "path");
    this.out = Objects.requireNonNull(out, "out");
  }

  public UUID uuid() {
    return uuid;
  }

  public Path path() {
    return path;
  }

  /**
   * Returns the number of bytes successfully appended so far.
   *
   * @return store size in bytes
   */
  public long size() {
    return size;
  }

  /**
   * Appends content to the store as UTF-8.
   *
   * @param content text to append
   * @return number of bytes written
   * @throws IOException if the store is closed or the write fails
   */
  public int append(String content) throws IOException {
    if (closed) {
      throw new IOException("log file " + uuid + " is closed");
    }
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    out.write(bytes);
    size += bytes.length;
    return bytes.length;
  }

  /**
   * Flushes and reads back the full store content.
   *
   * @return stored bytes
   * @throws IOException if the store cannot be flushed or read
   */
  public byte[] readContent() throws IOException {
    flush();
    return Files.readAllBytes(path);
  }

  /**
   * Flushes buffered bytes to the backing file.
   *
   * @throws IOException if flushing fails
   */
  public void flush() throws IOException {
    if (!closed) {
      out.flush();
    }
  }

  public void addLines(Collection<LogLine> outputLines) {
    lines.addAll(outputLines);
  }

  /**
   * Returns the output lines recorded for this artifact.
   *
   * @return immutable snapshot in insertion order
   */
  public List<LogLine> lines() {
    return List.copyOf(lines);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      out.close();
    } catch (IOException ex) {
      log.warn("Failed to close log file {} stream", uuid, ex);
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.warn("Failed to delete log file {} at {}", uuid, path, ex);
    }
  }
}
