package ca.gc.cra.stepfrag.domain.profile;

/**
 * <strong>What:</strong> Coarse size classification of an exchange file.
 * <p><strong>Why:</strong> Lets operators judge whether a conversion fits the available memory before starting it.</p>
 * <p><strong>Role:</strong> Domain enumeration carried by {@link FileProfile}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Performance:</strong> Classification is two comparisons.</p>
 * <p><strong>Observability:</strong> Tier names appear in preflight logs and the profile report.</p>
 *
 * @since 0.1.0
 */
public enum SizeTier {
  /** Below 100 MiB; conversion is expected to fit default settings. */
  SMALL("File size is manageable"),
  /** From 100 MiB up to (excluding) 500 MiB. */
  WARNING("Large file; conversion may need increased memory"),
  /** 500 MiB and above. */
  CRITICAL("Very large file; conversion may exhaust available memory");

  /** Bytes in one mebibyte. */
  public static final long MIB = 1024L * 1024L;
  /** Inclusive lower bound of {@link #WARNING}. */
  public static final long WARNING_THRESHOLD_BYTES = 100L * MIB;
  /** Inclusive lower bound of {@link #CRITICAL}. */
  public static final long CRITICAL_THRESHOLD_BYTES = 500L * MIB;

  private final String description;

  SizeTier(String description) {
    this.description = description;
  }

  /**
   * Returns the operator-facing description of this tier.
   *
   * @return short human-readable sentence
   */
  public String description() {
    return description;
  }

  /**
   * Classifies a file size.
   *
   * @param sizeBytes file size in bytes; must be non-negative
   * @return tier for the size
   * @throws IllegalArgumentException if {@code sizeBytes} is negative
   */
  public static SizeTier of(long sizeBytes) {
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be >= 0");
    }
    if (sizeBytes >= CRITICAL_THRESHOLD_BYTES) {
      return CRITICAL;
    }
    if (sizeBytes >= WARNING_THRESHOLD_BYTES) {
      return WARNING;
    }
    return SMALL;
  }
}
