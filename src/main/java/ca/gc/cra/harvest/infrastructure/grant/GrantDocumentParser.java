package ca.gc.cra.harvest.infrastructure.grant;

import ca.gc.cra.harvest.application.port.GrantRequestException;
import ca.gc.cra.harvest.domain.grant.Grant;
import ca.gc.cra.harvest.domain.grant.GrantConfig;
import ca.gc.cra.harvest.domain.grant.GrantFeatures;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parses control-plane log grant documents.
 *
 * <pre>{@code
 * {
 *   "valid": true,
 *   "config": {"server_id": "...", "sentry_dsn": "...",
 *              "features": {"logs": true, "explain": false,
 *                           "statement_reset_frequency": 0, "statement_timeout_ms": 30000}},
 *   "s3_url": "https://...", "s3_fields": {"key": "...", "policy": "..."},
 *   "local_dir": ""
 * }
 * }</pre>
 *
 * <p>Field names match case-insensitively. Unknown fields are skipped. An absent {@code valid} field counts as
 * {@code true}; control planes that decline collection say so explicitly.</p>
 *
 * @since 0.1.0
 */
public final class GrantDocumentParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a grant document.
   *
   * @param json document text
   * @return parsed grant
   * @throws GrantRequestException if the document is not a well-formed grant
   */
  public Grant parse(String json) throws GrantRequestException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return read(parser);
    } catch (IOException | IllegalArgumentException ex) {
      throw new GrantRequestException("Malformed grant document: " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses a grant document from a stream; the stream is not closed.
   *
   * @param in document bytes, UTF-8
   * @return parsed grant
   * @throws GrantRequestException if the document is not a well-formed grant or cannot be read
   */
  public Grant parse(InputStream in) throws GrantRequestException {
    Objects.requireNonNull(in, "in");
    try (JsonParser parser = factory.createParser(in)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      return read(parser);
    } catch (IOException | IllegalArgumentException ex) {
      throw new GrantRequestException("Malformed grant document: " + ex.getMessage(), ex);
    }
  }

  private Grant read(JsonParser parser) throws IOException {
    expect(parser.nextToken(), JsonToken.START_OBJECT, "grant");
    boolean valid = true;
    GrantConfig config = GrantConfig.empty();
    String s3Url = "";
    Map<String, String> s3Fields = Map.of();
    String localDir = "";
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName().toLowerCase(Locale.ROOT);
      JsonToken value = parser.nextToken();
      switch (field) {
        case "valid" -> valid = readBoolean(parser, value, field);
        case "config" -> config = readConfig(parser, value);
        case "s3_url" -> s3Url = readString(parser, value, field);
        case "s3_fields" -> s3Fields = readStringMap(parser, value, field);
        case "local_dir" -> localDir = readString(parser, value, field);
        default -> parser.skipChildren();
      }
    }
    expect(parser.currentToken(), JsonToken.END_OBJECT, "grant");
    if (parser.nextToken() != null) {
      throw new IllegalArgumentException("trailing content after grant document");
    }
    return new Grant(valid, config, s3Url, s3Fields, localDir);
  }

  private GrantConfig readConfig(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return GrantConfig.empty();
    }
    expect(token, JsonToken.START_OBJECT, "config");
    String serverId = "";
    String sentryDsn = "";
    GrantFeatures features = GrantFeatures.none();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName().toLowerCase(Locale.ROOT);
      JsonToken value = parser.nextToken();
      switch (field) {
        case "server_id" -> serverId = readString(parser, value, field);
        case "sentry_dsn" -> sentryDsn = readString(parser, value, field);
        case "features" -> features = readFeatures(parser, value);
        default -> parser.skipChildren();
      }
    }
    return new GrantConfig(serverId, sentryDsn, features);
  }

  private GrantFeatures readFeatures(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return GrantFeatures.none();
    }
    expect(token, JsonToken.START_OBJECT, "features");
    boolean logs = false;
    boolean explain = false;
    int resetFrequency = 0;
    int timeoutMs = 0;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName().toLowerCase(Locale.ROOT);
      JsonToken value = parser.nextToken();
      switch (field) {
        case "logs" -> logs = readBoolean(parser, value, field);
        case "explain" -> explain = readBoolean(parser, value, field);
        case "statement_reset_frequency" -> resetFrequency = readInt(parser, value, field);
        case "statement_timeout_ms" -> timeoutMs = readInt(parser, value, field);
        default -> parser.skipChildren();
      }
    }
    return new GrantFeatures(logs, explain, resetFrequency, timeoutMs);
  }

  private static Map<String, String> readStringMap(JsonParser parser, JsonToken token, String field)
      throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return Map.of();
    }
    expect(token, JsonToken.START_OBJECT, field);
    Map<String, String> values = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.getCurrentName();
      values.put(key, readString(parser, parser.nextToken(), field + "." + key));
    }
    return values;
  }

  private static String readString(JsonParser parser, JsonToken token, String field) throws IOException {
    return switch (token) {
      case VALUE_STRING -> parser.getText();
      case VALUE_NULL -> "";
      default -> throw new IllegalArgumentException(field + " must be a string but was " + token);
    };
  }

  private static boolean readBoolean(JsonParser parser, JsonToken token, String field) {
    return switch (token) {
      case VALUE_TRUE -> true;
      case VALUE_FALSE, VALUE_NULL -> false;
      default -> throw new IllegalArgumentException(field + " must be a boolean but was " + token);
    };
  }

  private static int readInt(JsonParser parser, JsonToken token, String field) throws IOException {
    return switch (token) {
      case VALUE_NUMBER_INT -> parser.getIntValue();
      case VALUE_NULL -> 0;
      default -> throw new IllegalArgumentException(field + " must be an integer but was " + token);
    };
  }

  private static void expect(JsonToken actual, JsonToken expected, String context) {
    if (actual != expected) {
      throw new IllegalArgumentException("expected " + expected + " for " + context + " but found " + actual);
    }
  }
}
