package ca.gc.cra.harvest.domain.grant;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Authorization and upload target issued by the control plane for one dispatch attempt.
 * <p><strong>Why:</strong> Server-side policy can change at any time, so each batch asks for a fresh grant and
 * never reuses one across batches.</p>
 * <p><strong>Role:</strong> Domain value returned by {@code GrantPort} and consumed by {@code LogUploadPort}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param valid {@code false} when the control plane declined log collection for this server
 * @param config control-plane configuration and feature switches
 * @param objectStoreUrl object store endpoint receiving uploads; empty when uploads target a local directory
 * @param objectStoreFields per-request form fields (credentials, policy, key) for the object store upload
 * @param localDir directory receiving uploads for offline and test runs; empty for object store uploads
 * @since 0.1.0
 */
public record Grant(
    boolean valid,
    GrantConfig config,
    String objectStoreUrl,
    Map<String, String> objectStoreFields,
    String localDir) {

  public Grant {
    config = Objects.requireNonNullElse(config, GrantConfig.empty());
    objectStoreUrl = Objects.requireNonNullElse(objectStoreUrl, "").trim();
    localDir = Objects.requireNonNullElse(localDir, "").trim();
    objectStoreFields = objectStoreFields == null || objectStoreFields.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(objectStoreFields));
  }

  /**
   * Creates a valid grant that targets a local directory instead of the object store.
   *
   * @param directory upload directory; must not be {@code null}
   * @return local grant with log collection enabled
   */
  public static Grant local(Path directory) {
    Objects.requireNonNull(directory, "directory");
    return new Grant(true, new GrantConfig("", "", GrantFeatures.logsOnly()), "", Map.of(), directory.toString());
  }

  /**
   * Creates a grant that denies log collection.
   *
   * @return invalid grant without upload target
   */
  public static Grant denied() {
    return new Grant(false, GrantConfig.empty(), "", Map.of(), "");
  }

  /**
   * Returns the local upload directory when this grant targets one.
   *
   * @return local directory, or empty for object store grants
   */
  public Optional<Path> localDirectory() {
    return localDir.isEmpty() ? Optional.empty() : Optional.of(Path.of(localDir));
  }

  /**
   * Reports whether the grant names an object store endpoint.
   *
   * @return {@code true} when {@link #objectStoreUrl()} is set
   */
  public boolean targetsObjectStore() {
    return !objectStoreUrl.isEmpty();
  }

  @Override
  public String toString() {
    // Upload fields carry signed credentials; only their names are printed.
    return "Grant{"
        + "valid=" + valid
        + ", serverId='" + config.serverId() + '\''
        + ", features=" + config.features()
        + ", objectStoreUrl='" + objectStoreUrl + '\''
        + ", objectStoreFields=" + objectStoreFields.keySet()
        + ", localDir='" + localDir + '\''
        + '}';
  }
}
