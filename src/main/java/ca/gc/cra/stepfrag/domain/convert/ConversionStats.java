package ca.gc.cra.stepfrag.domain.convert;

import java.util.Locale;

/**
 * <strong>What:</strong> Timing and compression figures for one successful conversion.
 * <p><strong>Why:</strong> Callers compare input and artifact sizes and track conversion time across runs.</p>
 * <p><strong>Role:</strong> Attached to successful {@link ConversionResult}s and serialized on the result line.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Performance:</strong> Formatted views allocate a new string per call.</p>
 *
 * @param inputBytes size of the source file
 * @param outputBytes size of the written artifact
 * @param elapsedNanos monotonic duration from start of the conversion to the end of the write
 * @since 0.1.0
 */
public record ConversionStats(long inputBytes, long outputBytes, long elapsedNanos) {
  private static final double MIB = 1024d * 1024d;
  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  public ConversionStats {
    if (inputBytes < 0 || outputBytes < 0) {
      throw new IllegalArgumentException("byte counts must be >= 0");
    }
    if (elapsedNanos < 0) {
      throw new IllegalArgumentException("elapsedNanos must be >= 0");
    }
  }

  /** Input size in MiB with two decimals, for example {@code "0.95"}. */
  public String inputSizeMB() {
    return String.format(Locale.ROOT, "%.2f", inputBytes / MIB);
  }

  /** Artifact size in MiB with two decimals. */
  public String outputSizeMB() {
    return String.format(Locale.ROOT, "%.2f", outputBytes / MIB);
  }

  /**
   * Size reduction as {@code (1 - out/in) * 100} with one decimal and a trailing percent sign.
   *
   * @return ratio such as {@code "90.0%"}; {@code "0.0%"} for an empty input; negative when the artifact is larger
   */
  public String compressionRatio() {
    if (inputBytes == 0) {
      return "0.0%";
    }
    double ratio = (1d - (double) outputBytes / (double) inputBytes) * 100d;
    return String.format(Locale.ROOT, "%.1f%%", ratio);
  }

  /** Elapsed time in seconds with two decimals. */
  public String conversionTimeSeconds() {
    return String.format(Locale.ROOT, "%.2f", elapsedNanos / NANOS_PER_SECOND);
  }
}
