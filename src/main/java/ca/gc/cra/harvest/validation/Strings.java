package ca.gc.cra.harvest.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Checks applied to strings read from collector configuration.
 * <p><strong>Role:</strong> Used by {@code ServerConfig} and {@code CollectorConfig} before values reach MDC,
 * identify marker matching or control-plane adapters.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> Failures raise {@link IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern SECTION_NAME = Pattern.compile("[A-Za-z0-9._-]+");

  private Strings() {}

  /**
   * Trims {@code value} and rejects blank or control-character content.
   *
   * @param name configuration key used in messages; {@code null} reads as {@code "value"}
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String label = label(name);
    Objects.requireNonNull(value, label);
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a server section name. Section names are echoed in MDC and matched against identify markers.
   *
   * @param name configuration key used in messages
   * @param identifier raw section name
   * @return trimmed section name made of letters, digits, dot, underscore or hyphen
   * @throws IllegalArgumentException if other characters are present
   */
  public static String sanitizeIdentifier(String name, String identifier) {
    String trimmed = requireNonBlank(name, identifier);
    if (!SECTION_NAME.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return trimmed;
  }

  /**
   * Validates a credential such as an API key.
   *
   * @param name configuration key used in messages
   * @param value raw value
   * @param maxLength longest accepted value after trimming
   * @return trimmed value of printable ASCII ({@code 0x20-0x7E})
   * @throws IllegalArgumentException if the value is too long or holds other characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
