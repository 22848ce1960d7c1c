package ca.gc.cra.stepfrag.application.port;

/**
 * <strong>What:</strong> Domain port supplying monotonic time to conversion flows.
 * <p><strong>Why:</strong> Conversion durations must not be skewed by wall-clock adjustments, and tests need a
 * deterministic source.</p>
 * <p><strong>Role:</strong> Domain port consumed by the conversion orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds.
   *
   * @return nanoseconds from an arbitrary origin; only differences are meaningful
   */
  long nanoTime();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
