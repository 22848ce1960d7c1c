package ca.gc.cra.stepfrag.domain.stream;

/**
 * <strong>What:</strong> Mutable completion tracker for one pull-based read session.
 * <p><strong>Why:</strong> Parsers that pull bytes at arbitrary offsets rarely announce the end of their
 * sequential pass; a backward seek is the observable signal that the pass is over.</p>
 * <p><strong>Role:</strong> Owned by exactly one chunk reader; never shared.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the reader's bound thread.</p>
 *
 * <p>Invariants: {@code finished} flips from {@code false} to {@code true} at most once, and
 * {@link #lastOffset()} stops changing once it has.</p>
 *
 * @since 0.1.0
 */
public final class StreamState {
  private long lastOffset = -1L;
  private boolean finished;

  /**
   * Records a requested offset and applies the wraparound rule.
   *
   * @param offset requested read offset
   * @return {@code true} if this call flipped the state to finished
   */
  public boolean observe(long offset) {
    if (finished) {
      return false;
    }
    if (offset < lastOffset) {
      finished = true;
      return true;
    }
    lastOffset = offset;
    return false;
  }

  /**
   * Marks the session finished on an explicit consumer signal.
   *
   * @return {@code true} if this call flipped the state; {@code false} when already finished
   */
  public boolean finish() {
    if (finished) {
      return false;
    }
    finished = true;
    return true;
  }

  public boolean isFinished() {
    return finished;
  }

  /** Offset of the last request observed while unfinished; {@code -1} before the first request. */
  public long lastOffset() {
    return lastOffset;
  }

  @Override
  public String toString() {
    return "StreamState{lastOffset=" + lastOffset + ", finished=" + finished + '}';
  }
}
