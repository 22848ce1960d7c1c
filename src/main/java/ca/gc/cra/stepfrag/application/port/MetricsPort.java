package ca.gc.cra.stepfrag.application.port;

/**
 * Counters and observations recorded by profiling and conversion.
 *
 * <p>Keys are dotted names such as {@code convert.success}, {@code convert.input.bytes} or {@code profile.files}.
 * Implementations must accept concurrent calls and must not block.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /** Adds one to the counter named {@code key}. */
  void increment(String key);

  /**
   * Records {@code value} (milliseconds or bytes, depending on the key) in the histogram named {@code key}.
   */
  void observe(String key, long value);

  /** Discards every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
