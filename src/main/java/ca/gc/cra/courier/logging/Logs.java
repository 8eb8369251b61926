package ca.gc.cra.courier.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep operator logs short.
 * <p><strong>Why:</strong> File names and classifier scripts come from users and datagrams from the network; both
 * are bounded before they reach a log line.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Renders at most {@code maxBytes} leading bytes as lowercase hex.
   *
   * @param data bytes to render; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes rendered; must be positive
   * @return hex string, suffixed with {@code "..."} when bytes were omitted
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String hexPreview(byte[] data, int maxBytes) {
    if (data == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(data.length, maxBytes);
    StringBuilder sb = new StringBuilder(shown * 2 + 3);
    for (int i = 0; i < shown; i++) {
      sb.append(HEX[(data[i] >> 4) & 0x0F]).append(HEX[data[i] & 0x0F]);
    }
    if (shown < data.length) {
      sb.append("...");
    }
    return sb.toString();
  }
}
