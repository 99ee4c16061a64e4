package ca.gc.cra.harvest.infrastructure.upload;

import ca.gc.cra.harvest.application.logs.LogFile;
import ca.gc.cra.harvest.application.logs.LogState;
import ca.gc.cra.harvest.application.port.LogUploadPort;
import ca.gc.cra.harvest.application.port.UploadException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.domain.grant.Grant;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LogUploadPort} writing batches into the directory named by a local grant.
 * <p>Each batch produces {@code <uuid>.log} holding the packaged bytes and {@code <uuid>.json} describing the
 * server, the line byte ranges and the query samples. The manifest is written last so readers can treat its
 * presence as completion.</p>
 *
 * @since 0.1.0
 */
public final class LocalDirectoryUploadAdapter implements LogUploadPort {
  private static final Logger log = LoggerFactory.getLogger(LocalDirectoryUploadAdapter.class);
  private static final int MANIFEST_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public void upload(ServerContext server, Grant grant, LogState state) throws UploadException {
    Path directory = grant.localDirectory()
        .orElseThrow(() -> new UploadException("Grant does not name a local directory"));
    UUID batchId = state.logFile().map(LogFile::uuid).orElseGet(UUID::randomUUID);
    try {
      Files.createDirectories(directory);
      if (state.logFile().isPresent()) {
        LogFile logFile = state.logFile().get();
        logFile.flush();
        Files.copy(logFile.path(), directory.resolve(batchId + ".log"), StandardCopyOption.REPLACE_EXISTING);
      }
      Path manifest = directory.resolve(batchId + ".json");
      try (OutputStream out = Files.newOutputStream(manifest)) {
        writeManifest(out, server, batchId, state);
      }
      log.info("Wrote log batch {} to {}", batchId, directory);
    } catch (IOException ex) {
      throw new UploadException("Failed to write log batch " + batchId + " to " + directory, ex);
    }
  }

  private void writeManifest(OutputStream out, ServerContext server, UUID batchId, LogState state)
      throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("manifestVersion", MANIFEST_VERSION);
      gen.writeStringField("uuid", batchId.toString());
      gen.writeStringField("server", server.config().sectionName());
      gen.writeStringField("collectedAt", state.collectedAt().toString());
      gen.writeArrayFieldStart("lines");
      for (LogLine line : state.logFile().map(LogFile::lines).orElse(List.of())) {
        writeLine(gen, line);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("querySamples");
      for (QuerySample sample : state.querySamples()) {
        writeSample(gen, sample);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private static void writeLine(JsonGenerator gen, LogLine line) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("collectedAt", line.collectedAt().toString());
    gen.writeStringField("level", line.level().name());
    gen.writeNumberField("backendPid", line.backendPid());
    gen.writeNumberField("byteStart", line.byteStart());
    gen.writeNumberField("byteContentStart", line.byteContentStart());
    gen.writeNumberField("byteEnd", line.byteEnd());
    gen.writeStringField("classification", line.classification().name());
    if (!line.details().isEmpty()) {
      gen.writeObjectFieldStart("details");
      for (Map.Entry<String, String> detail : line.details().entrySet()) {
        gen.writeStringField(detail.getKey(), detail.getValue());
      }
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeSample(JsonGenerator gen, QuerySample sample) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("occurredAt", sample.occurredAt().toString());
    gen.writeStringField("username", sample.username());
    gen.writeStringField("database", sample.database());
    gen.writeStringField("query", sample.query());
    gen.writeNumberField("runtimeMs", sample.runtimeMs());
    gen.writeArrayFieldStart("parameters");
    for (String parameter : sample.parameters()) {
      gen.writeString(parameter);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }
}
