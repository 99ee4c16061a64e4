package ca.gc.cra.harvest.infrastructure.storage;

import ca.gc.cra.harvest.application.logs.LogFile;
import ca.gc.cra.harvest.application.port.LogStoreException;
import ca.gc.cra.harvest.application.port.LogStorePort;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link LogStorePort} backed by one temporary file per batch.
 * <p>Files are named {@code harvest-<random>.log} in the configured directory, or the JVM temp directory when none
 * is configured. Each file is deleted when its {@link LogFile} closes.</p>
 *
 * @since 0.1.0
 */
public final class TempFileLogStoreAdapter implements LogStorePort {
  private static final int BUFFER_SIZE = 64 * 1024;

  private final Path directory;

  /** Allocates in the JVM temp directory. */
  public TempFileLogStoreAdapter() {
    this(null);
  }

  /**
   * Allocates in {@code directory}.
   *
   * @param directory target directory; {@code null} selects the JVM temp directory
   */
  public TempFileLogStoreAdapter(Path directory) {
    this.directory = directory;
  }

  @Override
  public LogFile allocate() throws LogStoreException {
    Path file;
    try {
      file = directory == null
          ? Files.createTempFile("harvest-", ".log")
          : Files.createTempFile(directory, "harvest-", ".log");
    } catch (IOException | SecurityException ex) {
      throw new LogStoreException("Failed to create temp log store in "
          + Objects.requireNonNullElse(directory, "java.io.tmpdir"), ex);
    }
    try {
      OutputStream out = new BufferedOutputStream(Files.newOutputStream(file), BUFFER_SIZE);
      return new LogFile(UUID.randomUUID(), file, out);
    } catch (IOException ex) {
      deleteQuietly(file, ex);
      throw new LogStoreException("Failed to open temp log store " + file, ex);
    }
  }

  private static void deleteQuietly(Path file, IOException primary) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }
}
