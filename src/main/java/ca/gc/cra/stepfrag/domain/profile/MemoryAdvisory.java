package ca.gc.cra.stepfrag.domain.profile;

import java.util.List;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Memory recommendation derived from an exchange file's size.
 * <p><strong>Why:</strong> Conversion materialises the artifact in memory; operators need a heap hint before large runs.</p>
 * <p><strong>Role:</strong> Domain enumeration carried by {@link FileProfile}; thresholds are independent of {@link SizeTier}.</p>
 * <p><strong>Thread-safety:</strong> Immutable constants.</p>
 * <p><strong>Observability:</strong> Recommendations are logged at WARN during preflight and printed by the profile report.</p>
 *
 * @since 0.1.0
 */
public enum MemoryAdvisory {
  /** No recommendation. */
  NONE(0, List.of()),
  /** Above 50 MiB. */
  MONITOR(4096, List.of("Increase JVM heap: -Xmx4g", "Monitor memory usage during conversion")),
  /** Above 200 MiB. */
  STREAMING(
      8192,
      List.of(
          "Increase JVM heap: -Xmx8g",
          "Use streaming conversion",
          "Consider preprocessing the file to reduce its size"));

  /** Exclusive lower bound of {@link #MONITOR}. */
  public static final long MONITOR_THRESHOLD_BYTES = 50L * SizeTier.MIB;
  /** Exclusive lower bound of {@link #STREAMING}. */
  public static final long STREAMING_THRESHOLD_BYTES = 200L * SizeTier.MIB;

  private final long heapMB;
  private final List<String> recommendations;

  MemoryAdvisory(long heapMB, List<String> recommendations) {
    this.heapMB = heapMB;
    this.recommendations = recommendations;
  }

  /**
   * Recommended maximum heap in megabytes.
   *
   * @return heap size, or empty for {@link #NONE}
   */
  public OptionalLong recommendedHeapMB() {
    return heapMB == 0 ? OptionalLong.empty() : OptionalLong.of(heapMB);
  }

  /**
   * Operator recommendations in display order.
   *
   * @return immutable list; empty for {@link #NONE}
   */
  public List<String> recommendations() {
    return recommendations;
  }

  /**
   * Selects the advisory for a file size.
   *
   * @param sizeBytes file size in bytes
   * @return advisory for the size
   */
  public static MemoryAdvisory of(long sizeBytes) {
    if (sizeBytes > STREAMING_THRESHOLD_BYTES) {
      return STREAMING;
    }
    if (sizeBytes > MONITOR_THRESHOLD_BYTES) {
      return MONITOR;
    }
    return NONE;
  }
}
