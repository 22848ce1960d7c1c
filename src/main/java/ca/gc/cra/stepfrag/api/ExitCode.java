package ca.gc.cra.stepfrag.api;

/**
 * <strong>What:</strong> Exit statuses returned by STEPFRAG command-line tools.
 * <p><strong>Why:</strong> Calling processes branch on the status alone; every failure maps to {@code 1} and the
 * result line or log output carries the detail.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** The conversion or profile ran and reported a failure. */
  FAILURE(1),
  /** Command-line arguments or configuration were invalid. */
  INVALID_ARGS(1),
  /** The input could not be read. */
  IO_ERROR(1);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
