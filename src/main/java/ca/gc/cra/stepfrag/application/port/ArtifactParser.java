package ca.gc.cra.stepfrag.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Domain port for the library that turns an exchange file into a fragments artifact.
 * <p><strong>Why:</strong> Keeps the conversion orchestrator independent of a particular parser implementation.</p>
 * <p><strong>Role:</strong> Implemented by {@code DeflateFragmentParser} and by external parser bindings.</p>
 * <p><strong>Thread-safety:</strong> One {@link #process(ChunkSource)} call per source; implementations may be reused
 * sequentially.</p>
 * <p><strong>Performance:</strong> The whole artifact is returned in memory.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ArtifactParser {
  /**
   * Pulls the source through {@code source} and produces the complete artifact.
   *
   * @param source chunk source positioned over the input file
   * @return serialized artifact bytes
   * @throws IOException if reading or encoding fails
   */
  byte[] process(ChunkSource source) throws IOException;
}
