package ca.gc.cra.harvest.testutil;

import ca.gc.cra.harvest.application.logs.LogFile;
import ca.gc.cra.harvest.application.logs.LogState;
import ca.gc.cra.harvest.application.port.LogUploadPort;
import ca.gc.cra.harvest.application.port.UploadException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.domain.grant.Grant;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Upload port recording what it was asked to deliver; the packaged bytes are read while the store is open. */
public final class RecordingUploadPort implements LogUploadPort {
  private final List<Upload> uploads = new ArrayList<>();
  private boolean fail;

  public static RecordingUploadPort failing() {
    RecordingUploadPort port = new RecordingUploadPort();
    port.fail = true;
    return port;
  }

  public void succeed() {
    fail = false;
  }

  public List<Upload> uploads() {
    return List.copyOf(uploads);
  }

  @Override
  public void upload(ServerContext server, Grant grant, LogState state) throws UploadException {
    if (fail) {
      throw new UploadException("object store rejected upload");
    }
    try {
      LogFile logFile = state.logFile().orElseThrow();
      uploads.add(new Upload(grant, logFile.lines(), logFile.readContent(), state.querySamples()));
    } catch (IOException ex) {
      throw new UploadException("could not read packaged content", ex);
    }
  }

  /** One recorded upload. */
  public record Upload(Grant grant, List<LogLine> lines, byte[] content, List<QuerySample> samples) {}
}
