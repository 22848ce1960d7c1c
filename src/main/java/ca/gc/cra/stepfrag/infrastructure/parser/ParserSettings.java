package ca.gc.cra.stepfrag.infrastructure.parser;

import ca.gc.cra.stepfrag.validation.Numbers;
import java.util.zip.Deflater;

/**
 * Tuning for {@link DeflateFragmentParser}, passed explicitly at construction.
 *
 * @param chunkBytes bytes requested per read; between 1 and 64 MiB
 * @param compressionLevel DEFLATE level between {@link Deflater#NO_COMPRESSION} and {@link Deflater#BEST_COMPRESSION}
 * @since 0.1.0
 */
public record ParserSettings(int chunkBytes, int compressionLevel) {
  /** Upper bound on {@link #chunkBytes()}. */
  public static final int MAX_CHUNK_BYTES = 64 * 1024 * 1024;
  public static final int DEFAULT_CHUNK_BYTES = 64 * 1024;
  public static final int DEFAULT_COMPRESSION_LEVEL = 6;

  public ParserSettings {
    Numbers.requireRange("chunkBytes", chunkBytes, 1, MAX_CHUNK_BYTES);
    Numbers.requireRange(
        "compressionLevel", compressionLevel, Deflater.NO_COMPRESSION, Deflater.BEST_COMPRESSION);
  }

  public static ParserSettings defaults() {
    return new ParserSettings(DEFAULT_CHUNK_BYTES, DEFAULT_COMPRESSION_LEVEL);
  }
}
