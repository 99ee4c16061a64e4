package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.validation.Strings;
import java.util.Objects;

/**
 * Identity of one monitored database server.
 *
 * @param sectionName configuration section naming the server; matched against collector identify markers
 * @param apiBaseUrl control-plane base URL
 * @param apiKey control-plane API key; never printed by {@link #toString()}
 * @since 0.1.0
 */
public record ServerConfig(String sectionName, String apiBaseUrl, String apiKey) {
  private static final int MAX_API_KEY_LENGTH = 256;

  public ServerConfig {
    sectionName = Strings.sanitizeIdentifier("sectionName", sectionName);
    apiBaseUrl = Objects.requireNonNullElse(apiBaseUrl, "").trim();
    apiKey = apiKey == null || apiKey.isBlank()
        ? ""
        : Strings.requirePrintableAscii("apiKey", apiKey, MAX_API_KEY_LENGTH);
  }

  @Override
  public String toString() {
    return "ServerConfig{sectionName='" + sectionName + "', apiBaseUrl='" + apiBaseUrl
        + "', apiKey=" + (apiKey.isEmpty() ? "<unset>" : "[REDACTED]") + '}';
  }
}
