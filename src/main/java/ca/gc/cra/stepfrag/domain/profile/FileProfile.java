package ca.gc.cra.stepfrag.domain.profile;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Immutable snapshot of an exchange file's size and header diagnostics.
 * <p><strong>Why:</strong> Gives operators a cheap go/no-go signal before a memory-heavy conversion.</p>
 * <p><strong>Role:</strong> Domain value produced by the file profiler and rendered by the profile report.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 * <p><strong>Observability:</strong> Fields feed preflight log lines.</p>
 *
 * @param path inspected file
 * @param sizeBytes file size at inspection time
 * @param modifiedAt last-modified time at inspection time
 * @param sizeTier tier derived from {@code sizeBytes}
 * @param headerValid whether the file starts with {@link StepHeader#MAGIC}
 * @param schemaId schema declared in the header, if found in the prefix
 * @param encodingAnomaly whether the prefix contains NUL or undecodable bytes
 * @param estimatedRamMB estimated conversion RAM in megabytes
 * @param memoryAdvisory heap recommendation derived from {@code sizeBytes}
 * @since 0.1.0
 */
public record FileProfile(
    Path path,
    long sizeBytes,
    Instant modifiedAt,
    SizeTier sizeTier,
    boolean headerValid,
    Optional<String> schemaId,
    boolean encodingAnomaly,
    long estimatedRamMB,
    MemoryAdvisory memoryAdvisory) {

  public FileProfile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(modifiedAt, "modifiedAt");
    Objects.requireNonNull(sizeTier, "sizeTier");
    Objects.requireNonNull(memoryAdvisory, "memoryAdvisory");
    schemaId = schemaId == null ? Optional.empty() : schemaId;
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be >= 0");
    }
  }

  /**
   * Recommended heap for converting this file.
   *
   * @return heap in megabytes, or empty when no recommendation applies
   */
  public OptionalLong recommendedHeapMB() {
    return memoryAdvisory.recommendedHeapMB();
  }

  /**
   * Size in mebibytes for display.
   *
   * @return size divided by 1 MiB
   */
  public double sizeMiB() {
    return sizeBytes / (double) SizeTier.MIB;
  }
}
