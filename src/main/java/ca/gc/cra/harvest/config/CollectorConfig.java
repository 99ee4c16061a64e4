package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated per-server settings for the log collection subsystem.
 * <p><strong>Why:</strong> Converts the flat key/value maps produced by {@link YamlConfigLoader} into typed values
 * so the composition root never parses strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * <p>Recognized keys (all optional except {@code sectionName}):</p>
 * <ul>
 *   <li>{@code apiBaseUrl}, {@code apiKey}</li>
 *   <li>{@code logs.enabled}, {@code logs.explain}, {@code logs.submit}, {@code logs.testRun}, {@code logs.debug}</li>
 *   <li>{@code logs.localDir}, {@code logs.tempDir}, {@code logs.grantFile}, {@code logs.pollInterval}</li>
 *   <li>{@code verbose}, {@code metricsExporter} ({@code otlp} or {@code none})</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class CollectorConfig {
  private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
  private static final String DEFAULT_METRICS_EXPORTER = "none";

  private final ServerConfig server;
  private final CollectionOpts opts;
  private final Duration pollInterval;
  private final Optional<Path> tempDir;
  private final Optional<Path> grantFile;
  private final boolean verbose;
  private final String metricsExporter;

  private CollectorConfig(
      ServerConfig server,
      CollectionOpts opts,
      Duration pollInterval,
      Optional<Path> tempDir,
      Optional<Path> grantFile,
      boolean verbose,
      String metricsExporter) {
    this.server = Objects.requireNonNull(server, "server");
    this.opts = Objects.requireNonNull(opts, "opts");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.tempDir = Objects.requireNonNull(tempDir, "tempDir");
    this.grantFile = Objects.requireNonNull(grantFile, "grantFile");
    this.verbose = verbose;
    this.metricsExporter = Objects.requireNonNull(metricsExporter, "metricsExporter");
  }

  /**
   * Loads all server sections of a YAML configuration file.
   *
   * @param path YAML file
   * @return one configuration per server section, in document order
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is missing, malformed, or holds invalid values
   */
  public static List<CollectorConfig> load(Path path) throws IOException {
    Map<String, Map<String, String>> sections = YamlConfigLoader.loadServers(path);
    if (sections.isEmpty()) {
      throw new IllegalArgumentException("Config file not found: " + path);
    }
    List<CollectorConfig> configs = new ArrayList<>(sections.size());
    for (Map<String, String> section : sections.values()) {
      configs.add(fromMap(section));
    }
    return List.copyOf(configs);
  }

  /**
   * Builds a configuration from flattened key/value settings.
   *
   * @param values flattened settings; must contain {@code sectionName}
   * @return validated configuration
   * @throws IllegalArgumentException if any value is invalid
   */
  public static CollectorConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String section = values.get(YamlConfigLoader.SECTION_KEY);
    if (section == null) {
      throw new IllegalArgumentException("sectionName is required");
    }
    ServerConfig server = new ServerConfig(section, values.get("apiBaseUrl"), values.get("apiKey"));

    Path localDir = optionalPath(values, "logs.localDir").orElse(Path.of("."));
    CollectionOpts opts = new CollectionOpts(
        bool(values, "logs.enabled", true),
        bool(values, "logs.explain", false),
        bool(values, "logs.submit", true),
        bool(values, "logs.testRun", false),
        bool(values, "logs.debug", false),
        localDir);

    Duration pollInterval = Optional.ofNullable(values.get("logs.pollInterval"))
        .filter(v -> !v.isBlank())
        .map(v -> parseDuration("logs.pollInterval", v))
        .orElse(DEFAULT_POLL_INTERVAL);

    String exporter = Optional.ofNullable(values.get("metricsExporter"))
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .filter(v -> !v.isEmpty())
        .orElse(DEFAULT_METRICS_EXPORTER);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    return new CollectorConfig(
        server,
        opts,
        pollInterval,
        optionalPath(values, "logs.tempDir"),
        optionalPath(values, "logs.grantFile"),
        bool(values, "verbose", false),
        exporter);
  }

  public ServerConfig server() {
    return server;
  }

  public CollectionOpts opts() {
    return opts;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Optional<Path> tempDir() {
    return tempDir;
  }

  /**
   * Returns a grant document consulted instead of the control plane, for offline installs and harnesses.
   *
   * @return grant document path when configured
   */
  public Optional<Path> grantFile() {
    return grantFile;
  }

  public boolean verbose() {
    return verbose;
  }

  public String metricsExporter() {
    return metricsExporter;
  }

  static Duration parseDuration(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw).toLowerCase(Locale.ROOT);
    try {
      Duration parsed;
      if (value.endsWith("ms")) {
        parsed = Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
      } else if (value.endsWith("s")) {
        parsed = Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
      } else if (value.endsWith("m")) {
        parsed = Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
      } else {
        parsed = Duration.ofMillis(Long.parseLong(value));
      }
      if (parsed.isZero() || parsed.isNegative()) {
        throw new IllegalArgumentException(key + " must be positive");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a duration such as 500ms, 1s or 2m", ex);
    }
  }

  private static boolean bool(Map<String, String> values, String key, boolean defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static Optional<Path> optionalPath(Map<String, String> values, String key) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(key, raw)));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path", ex);
    }
  }

  @Override
  public String toString() {
    return "CollectorConfig{server=" + server + ", opts=" + opts + ", pollInterval=" + pollInterval
        + ", tempDir=" + tempDir + ", grantFile=" + grantFile + ", verbose=" + verbose
        + ", metricsExporter=" + metricsExporter + '}';
  }
}
