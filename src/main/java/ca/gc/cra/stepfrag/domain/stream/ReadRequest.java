package ca.gc.cra.stepfrag.domain.stream;

/**
 * Validated pull request issued by a parser against a chunk source.
 *
 * @param offset absolute byte offset; must be non-negative
 * @param size maximum number of bytes wanted; must be non-negative
 * @since 0.1.0
 */
public record ReadRequest(long offset, int size) {
  public ReadRequest {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
    }
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0 (was " + size + ")");
    }
  }
}
