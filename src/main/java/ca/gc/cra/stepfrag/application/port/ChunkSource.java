package ca.gc.cra.stepfrag.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Domain port that serves arbitrary-offset byte reads to an artifact parser.
 * <p><strong>Why:</strong> Lets parsers pull exactly the bytes they need without materialising the whole source file.</p>
 * <p><strong>Role:</strong> Implemented by {@code ChunkedReaderAdapter}; consumed by {@link ArtifactParser}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return at most {@code size} bytes starting at {@code offset}.</li>
 *   <li>Track when the consumer's sequential pass is over.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are single-threaded and non-reentrant.</p>
 * <p><strong>Performance:</strong> One bounded read per call; no read-ahead, no retries.</p>
 * <p><strong>Observability:</strong> Implementations count requests and bytes served.</p>
 *
 * @since 0.1.0
 */
public interface ChunkSource {
  /**
   * Reads up to {@code size} bytes at {@code offset}.
   *
   * @param offset absolute byte offset; must be non-negative
   * @param size maximum number of bytes; must be non-negative
   * @return the bytes actually read; length {@code 0..size}, empty at or past end of file
   * @throws IOException if the underlying read fails
   * @throws IllegalArgumentException if {@code offset} or {@code size} is negative
   */
  byte[] read(long offset, int size) throws IOException;

  /**
   * Signals that the consumer has finished its sequential pass.
   *
   * <p>Idempotent; a no-op once the source already considers the stream finished.</p>
   */
  void markFinished();

  /**
   * Indicates whether the consumer's sequential pass is over.
   *
   * @return {@code true} once finished, by explicit signal or backward seek
   */
  boolean isFinished();
}
