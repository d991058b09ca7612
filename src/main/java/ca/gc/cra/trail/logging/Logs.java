package ca.gc.cra.trail.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Keeps event text in operator logs short.
 *
 * <p>Diffs, stack traces, and validation messages can be arbitrarily long; log lines carry a bounded UTF-8 prefix
 * instead. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes to keep; must be positive
   * @return the value itself when it fits, otherwise a prefix followed by {@code "... (truncated, X of Y bytes)"}
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
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      // IGNORE actions make this unreachable in practice; fall back to lossy decoding.
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }
}
