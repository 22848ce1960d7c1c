package ca.gc.cra.stepfrag.infrastructure.report;

import ca.gc.cra.stepfrag.domain.profile.FileProfile;
import ca.gc.cra.stepfrag.domain.profile.SizeTier;
import ca.gc.cra.stepfrag.domain.profile.StepHeader;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Renders a {@link FileProfile} as the human-readable preflight report printed by {@code stepfrag profile}.
 *
 * @since 0.1.0
 */
public final class ProfileReportFormatter {
  private final LongSupplier maxHeapBytes;

  public ProfileReportFormatter() {
    this(() -> Runtime.getRuntime().maxMemory());
  }

  /**
   * Creates a formatter with an explicit heap-limit source.
   *
   * @param maxHeapBytes supplies the current JVM max heap in bytes
   */
  public ProfileReportFormatter(LongSupplier maxHeapBytes) {
    this.maxHeapBytes = Objects.requireNonNull(maxHeapBytes, "maxHeapBytes");
  }

  /**
   * Formats the report.
   *
   * @param profile profile to render
   * @return report lines without line terminators
   */
  public List<String> format(FileProfile profile) {
    Objects.requireNonNull(profile, "profile");
    List<String> lines = new ArrayList<>();
    lines.add("File: " + profile.path());
    lines.add(String.format(Locale.ROOT, "Size: %.2f MB (%d bytes)", profile.sizeMiB(), profile.sizeBytes()));
    lines.add("Modified: " + DateTimeFormatter.ISO_INSTANT.format(profile.modifiedAt()));
    lines.add("Size tier: " + profile.sizeTier() + " - " + profile.sizeTier().description());
    lines.add("Header: " + (profile.headerValid()
        ? "valid (" + StepHeader.MAGIC + ")"
        : "INVALID (expected " + StepHeader.MAGIC + ")"));
    lines.add("Schema: " + profile.schemaId().orElse("not found in first " + StepHeader.PREFIX_BYTES + " bytes"));
    lines.add("Encoding: " + (profile.encodingAnomaly()
        ? "possible binary content or non-UTF-8 encoding"
        : "ok"));

    List<String> recommendations = profile.memoryAdvisory().recommendations();
    if (recommendations.isEmpty()) {
      lines.add("Recommendations: none");
    } else {
      lines.add("Recommendations:");
      for (String recommendation : recommendations) {
        lines.add("  - " + recommendation);
      }
    }

    long maxHeapMB = maxHeapBytes.getAsLong() / SizeTier.MIB;
    lines.add("Estimated RAM: " + profile.estimatedRamMB() + " MB");
    lines.add("Current max heap: " + maxHeapMB + " MB");
    if (profile.estimatedRamMB() > maxHeapMB) {
      lines.add("Warning: estimated RAM exceeds the current max heap");
    }
    return lines;
  }
}
