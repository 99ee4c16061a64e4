package ca.gc.cra.harvest.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads collector configuration from YAML, producing one flat key/value map per monitored server.
 *
 * <p>Expected layout:</p>
 * <pre>
 * common:
 *   logs:
 *     pollInterval: 1s
 * servers:
 *   primary:
 *     apiKey: ...
 *     logs:
 *       debug: true
 * </pre>
 * <p>Each entry under {@code servers} is overlaid on {@code common}; nested keys are joined with dots and the
 * section name is exposed under {@link #SECTION_KEY}.</p>
 */
public final class YamlConfigLoader {
  /** Key under which the server section name is stored in every flattened map. */
  public static final String SECTION_KEY = "sectionName";

  private YamlConfigLoader() {}

  /**
   * Loads every server section from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return server section name to flattened settings, in document order; empty when the file is absent
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid or declares no servers
   */
  public static Map<String, Map<String, String>> loadServers(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Map.of();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(new Yaml().load(reader), path.toString());
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  static Map<String, Map<String, String>> parse(Object document, String origin) {
    if (document == null) {
      throw new IllegalArgumentException("Config " + origin + " is empty");
    }
    Map<String, Object> root = asMap(document, "root");

    Map<String, String> common = new LinkedHashMap<>();
    Object commonSection = root.get("common");
    if (commonSection != null) {
      flatten(asMap(commonSection, "common"), "", common);
    }

    Object serversSection = root.get("servers");
    if (serversSection == null) {
      throw new IllegalArgumentException("Config " + origin + " declares no servers");
    }
    Map<String, Map<String, String>> servers = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(serversSection, "servers").entrySet()) {
      String section = entry.getKey();
      Map<String, String> merged = new LinkedHashMap<>(common);
      if (entry.getValue() != null) {
        flatten(asMap(entry.getValue(), "servers." + section), "", merged);
      }
      merged.put(SECTION_KEY, section);
      servers.put(section, Collections.unmodifiableMap(merged));
    }
    if (servers.isEmpty()) {
      throw new IllegalArgumentException("Config " + origin + " declares no servers");
    }
    return Collections.unmodifiableMap(servers);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String composite = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    }
  }
}
