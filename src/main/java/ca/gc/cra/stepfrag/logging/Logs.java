package ca.gc.cra.stepfrag.logging;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Keeps file content that reaches a log line short and on one line.
 *
 * <p>Exchange file headers may carry binary noise from a damaged export; previews escape it.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_TEXT = "<null>";

  private Logs() {}

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes and appends {@code "... (truncated, kept of total)"}.
   *
   * @param value text to shorten, may be {@code null}
   * @param maxBytes positive byte budget
   * @return the value itself when it fits, otherwise the shortened text
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_TEXT;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive (was " + maxBytes + ")");
    }
    byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    if (utf8.length <= maxBytes) {
      return value;
    }
    return decodePrefix(utf8, maxBytes) + "... (truncated, " + maxBytes + " of " + utf8.length + ")";
  }

  /**
   * Escapes CR and LF, replaces other control characters with {@code '.'} and then applies {@link #truncate}.
   */
  public static String preview(String value, int maxBytes) {
    if (value == null) {
      return NULL_TEXT;
    }
    StringBuilder escaped = new StringBuilder(value.length() + 8);
    value.chars().forEach(c -> {
      switch (c) {
        case '\n' -> escaped.append("\\n");
        case '\r' -> escaped.append("\\r");
        default -> escaped.append(Character.isISOControl(c) ? '.' : (char) c);
      }
    });
    return truncate(escaped.toString(), maxBytes);
  }

  // a cut inside a multi-byte sequence drops the partial character
  private static String decodePrefix(byte[] utf8, int length) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(utf8, 0, length))
          .toString();
    } catch (CharacterCodingException ex) {
      throw new IllegalStateException("UTF-8 decoder rejected input despite IGNORE actions", ex);
    }
  }
}
