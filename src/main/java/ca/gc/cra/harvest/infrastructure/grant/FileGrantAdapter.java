package ca.gc.cra.harvest.infrastructure.grant;

import ca.gc.cra.harvest.application.port.GrantPort;
import ca.gc.cra.harvest.application.port.GrantRequestException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.grant.Grant;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link GrantPort} reading a grant document from a file on every request.
 * <p>Used where an external agent refreshes the grant on disk. The file is re-read per dispatch attempt so policy
 * changes take effect on the next batch.</p>
 *
 * @since 0.1.0
 */
public final class FileGrantAdapter implements GrantPort {
  private final Path grantFile;
  private final GrantDocumentParser parser;

  public FileGrantAdapter(Path grantFile) {
    this(grantFile, new GrantDocumentParser());
  }

  public FileGrantAdapter(Path grantFile, GrantDocumentParser parser) {
    this.grantFile = Objects.requireNonNull(grantFile, "grantFile");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  @Override
  public Grant fetchLogsGrant(ServerContext server, CollectionOpts opts) throws GrantRequestException {
    try (InputStream in = Files.newInputStream(grantFile)) {
      return parser.parse(in);
    } catch (IOException ex) {
      throw new GrantRequestException("Failed to read grant file " + grantFile, ex);
    }
  }
}
