package ca.gc.cra.stepfrag.infrastructure.parser;

import ca.gc.cra.stepfrag.application.port.ArtifactParser;
import ca.gc.cra.stepfrag.application.port.ChunkSource;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Built-in {@link ArtifactParser} that packs an exchange file into a compressed fragments
 * artifact.
 * <p><strong>Why:</strong> Makes the {@code convert} command runnable end to end without an external parser library,
 * while exercising the same two-pass pull pattern real parsers use.</p>
 * <p><strong>Role:</strong> Infrastructure adapter selected by the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pass 1: read sequential chunks from offset 0 until a short read, counting bytes and entity instance lines
 *   ({@code #<id>=}).</li>
 *   <li>Signal {@link ChunkSource#markFinished()}.</li>
 *   <li>Pass 2: restart at offset 0 and deflate the content behind a fixed header.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; one source per call.</p>
 * <p><strong>Performance:</strong> Reads the source twice; the artifact is buffered in memory.</p>
 *
 * <p>Artifact layout (big-endian):</p>
 * <pre>
 *   4 bytes  magic "SFRG"
 *   1 byte   format version
 *   8 bytes  source byte count
 *   8 bytes  entity instance count
 *   ...      raw DEFLATE stream of the source bytes
 * </pre>
 *
 * @since 0.1.0
 */
public final class DeflateFragmentParser implements ArtifactParser {
  private static final Logger log = LoggerFactory.getLogger(DeflateFragmentParser.class);

  /** Leading bytes of every artifact. */
  public static final byte[] MAGIC = "SFRG".getBytes(StandardCharsets.US_ASCII);
  public static final int FORMAT_VERSION = 1;
  /** Size of the fixed header preceding the DEFLATE stream. */
  public static final int HEADER_BYTES = MAGIC.length + 1 + Long.BYTES + Long.BYTES;

  private final ParserSettings settings;

  public DeflateFragmentParser(ParserSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public byte[] process(ChunkSource source) throws IOException {
    Objects.requireNonNull(source, "source");
    EntityCounter counter = new EntityCounter();
    long sourceBytes = scan(source, counter);
    source.markFinished();
    log.debug("Scan pass complete: {} bytes, {} entity instances", sourceBytes, counter.count());

    ByteArrayOutputStream buffer = new ByteArrayOutputStream(estimateCapacity(sourceBytes));
    DataOutputStream header = new DataOutputStream(buffer);
    header.write(MAGIC);
    header.writeByte(FORMAT_VERSION);
    header.writeLong(sourceBytes);
    header.writeLong(counter.count());
    header.flush();

    Deflater deflater = new Deflater(settings.compressionLevel(), true);
    try (DeflaterOutputStream out = new DeflaterOutputStream(buffer, deflater, settings.chunkBytes())) {
      long copied = copy(source, out);
      if (copied != sourceBytes) {
        throw new IOException(
            "Source changed during conversion: scanned " + sourceBytes + " bytes but encoded " + copied);
      }
    } finally {
      deflater.end();
    }
    return buffer.toByteArray();
  }

  private long scan(ChunkSource source, EntityCounter counter) throws IOException {
    long offset = 0;
    int size = settings.chunkBytes();
    while (true) {
      byte[] chunk = source.read(offset, size);
      counter.accept(chunk);
      offset += chunk.length;
      if (chunk.length < size) {
        return offset;
      }
    }
  }

  private long copy(ChunkSource source, OutputStream out) throws IOException {
    long offset = 0;
    int size = settings.chunkBytes();
    while (true) {
      byte[] chunk = source.read(offset, size);
      out.write(chunk);
      offset += chunk.length;
      if (chunk.length < size) {
        return offset;
      }
    }
  }

  private static int estimateCapacity(long sourceBytes) {
    long guess = HEADER_BYTES + sourceBytes / 4;
    return (int) Math.min(Math.max(guess, 256L), Integer.MAX_VALUE - 8L);
  }

  /**
   * Counts lines of the form {@code #<digits> =} across chunk boundaries, ignoring leading whitespace.
   */
  static final class EntityCounter {
    private static final int LINE_START = 0;
    private static final int HASH = 1;
    private static final int DIGITS = 2;
    private static final int SKIP = 3;

    private int state = LINE_START;
    private long count;

    void accept(byte[] chunk) {
      for (byte b : chunk) {
        step((char) (b & 0xFF));
      }
    }

    private void step(char c) {
      if (c == '\n' || c == '\r') {
        state = LINE_START;
        return;
      }
      switch (state) {
        case LINE_START -> {
          if (c == '#') {
            state = HASH;
          } else if (c != ' ' && c != '\t') {
            state = SKIP;
          }
        }
        case HASH -> state = Character.isDigit(c) ? DIGITS : SKIP;
        case DIGITS -> {
          if (c == '=') {
            count++;
            state = SKIP;
          } else if (!Character.isDigit(c) && c != ' ' && c != '\t') {
            state = SKIP;
          }
        }
        default -> {
          // rest of line
        }
      }
    }

    long count() {
      return count;
    }
  }
}
