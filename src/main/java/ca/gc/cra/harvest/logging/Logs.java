package ca.gc.cra.harvest.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep database log content out of operator logs beyond a small preview.
 * <p><strong>Why:</strong> Server log lines can carry statement text and bound parameters; previews are capped by
 * UTF-8 byte length so multi-byte text is never split mid-character.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  /** Default preview budget for log content echoed in diagnostics. */
  public static final int DEFAULT_PREVIEW_BYTES = 120;

  private Logs() {}

  /**
   * Returns a preview of {@code value} limited to {@link #DEFAULT_PREVIEW_BYTES}.
   *
   * @param value text to preview
   * @return preview
   */
  public static String preview(String value) {
    return truncate(value, DEFAULT_PREVIEW_BYTES);
  }

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes and notes the original size.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} unchanged when it fits, otherwise the prefix followed by {@code "... (N bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = decoded.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (" + bytes.length + " bytes)";
  }
}
