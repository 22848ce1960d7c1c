package ca.gc.cra.stepfrag.domain.convert;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Terminal outcome of converting one exchange file.
 * <p><strong>Why:</strong> Conversion failures are reported as values so one bad file never takes down the caller.</p>
 * <p><strong>Role:</strong> Returned by the conversion orchestrator and serialized on the CLI result line.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Statistics are present exactly when {@code success} is {@code true}; an error description is
 * present exactly when it is {@code false}.</p>
 *
 * @param success whether the artifact was written
 * @param message human-readable summary
 * @param stats conversion statistics on success
 * @param error failure cause on failure
 * @since 0.1.0
 */
public record ConversionResult(
    boolean success, String message, Optional<ConversionStats> stats, Optional<String> error) {

  public ConversionResult {
    Objects.requireNonNull(message, "message");
    stats = stats == null ? Optional.empty() : stats;
    error = error == null ? Optional.empty() : error;
    if (success && (stats.isEmpty() || error.isPresent())) {
      throw new IllegalArgumentException("successful result requires stats and no error");
    }
    if (!success && (error.isEmpty() || stats.isPresent())) {
      throw new IllegalArgumentException("failed result requires an error and no stats");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param message summary line
   * @param stats conversion statistics
   * @return successful result
   */
  public static ConversionResult success(String message, ConversionStats stats) {
    return new ConversionResult(
        true, message, Optional.of(Objects.requireNonNull(stats, "stats")), Optional.empty());
  }

  /**
   * Creates a failed result.
   *
   * @param message summary line
   * @param error failure cause
   * @return failed result
   */
  public static ConversionResult failure(String message, String error) {
    return new ConversionResult(
        false, message, Optional.empty(), Optional.of(Objects.requireNonNull(error, "error")));
  }
}
