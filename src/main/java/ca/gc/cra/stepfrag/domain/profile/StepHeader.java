package ca.gc.cra.stepfrag.domain.profile;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Pure inspections of the leading bytes of an ISO-10303-21 file.
 * <p><strong>Why:</strong> Header checks run on a bounded prefix so profiling cost does not depend on file size.</p>
 * <p><strong>Role:</strong> Domain helpers used by the file profiler.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class StepHeader {
  /** Literal every well-formed exchange file starts with. */
  public static final String MAGIC = "ISO-10303-21;";
  /** Number of leading bytes inspected by the profiler. */
  public static final int PREFIX_BYTES = 1024;

  private static final byte[] MAGIC_BYTES = MAGIC.getBytes(StandardCharsets.US_ASCII);
  private static final Pattern FILE_SCHEMA =
      Pattern.compile("FILE_SCHEMA\\s*\\(\\s*\\('([^']+)'\\)", Pattern.CASE_INSENSITIVE);
  private static final char REPLACEMENT = '\uFFFD';

  private StepHeader() {}

  /**
   * Tests whether the prefix starts with {@link #MAGIC}.
   *
   * @param prefix leading bytes of the file; may be shorter than the magic
   * @return {@code true} when the first 13 bytes match exactly
   */
  public static boolean hasMagic(byte[] prefix) {
    if (prefix == null || prefix.length < MAGIC_BYTES.length) {
      return false;
    }
    return Arrays.equals(prefix, 0, MAGIC_BYTES.length, MAGIC_BYTES, 0, MAGIC_BYTES.length);
  }

  /**
   * Decodes the prefix as UTF-8, substituting U+FFFD for malformed sequences.
   *
   * <p>A full {@link #PREFIX_BYTES} window may end inside a multi-byte character; that unfinished tail is dropped
   * rather than replaced. A shorter prefix holds the whole file, so an unfinished tail there is malformed.</p>
   *
   * @param prefix raw bytes
   * @return decoded text
   */
  public static String decode(byte[] prefix) {
    if (prefix == null || prefix.length == 0) {
      return "";
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    boolean wholeFile = prefix.length < PREFIX_BYTES;
    CharBuffer out = CharBuffer.allocate(prefix.length);
    CoderResult result = decoder.decode(ByteBuffer.wrap(prefix), out, wholeFile);
    if (result.isOverflow()) {
      // one byte never decodes to more than one char
      throw new IllegalStateException("UTF-8 decode overflowed a " + prefix.length + " char buffer");
    }
    if (wholeFile) {
      decoder.flush(out);
    }
    return out.flip().toString();
  }

  /**
   * Extracts the first schema identifier declared by {@code FILE_SCHEMA(('...'))}.
   *
   * @param text decoded header text
   * @return schema identifier, or empty when no declaration is present
   */
  public static Optional<String> schemaId(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = FILE_SCHEMA.matcher(text);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  /**
   * Reports a NUL or replacement character in the decoded prefix.
   *
   * @param text decoded header text
   * @return {@code true} when the text suggests binary content or a non-UTF-8 encoding
   */
  public static boolean hasEncodingAnomaly(String text) {
    if (text == null) {
      return false;
    }
    return text.indexOf('\0') >= 0 || text.indexOf(REPLACEMENT) >= 0;
  }

  /**
   * Estimates conversion RAM as three times the file size, rounded up to whole MiB.
   *
   * @param sizeBytes file size in bytes
   * @return estimated RAM in megabytes
   */
  public static long estimateRamMB(long sizeBytes) {
    if (sizeBytes <= 0) {
      return 0;
    }
    long scaled = Math.multiplyExact(sizeBytes, 3L);
    return (scaled + SizeTier.MIB - 1) / SizeTier.MIB;
  }
}
