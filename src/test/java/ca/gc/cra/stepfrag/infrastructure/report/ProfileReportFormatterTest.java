package ca.gc.cra.stepfrag.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stepfrag.domain.profile.FileProfile;
import ca.gc.cra.stepfrag.domain.profile.MemoryAdvisory;
import ca.gc.cra.stepfrag.domain.profile.SizeTier;
import ca.gc.cra.stepfrag.domain.profile.StepHeader;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ProfileReportFormatterTest {

  @Test
  void smallValidFileReport() {
    FileProfile profile = profile(2L * SizeTier.MIB, true, Optional.of("IFC2X3"), false);

    List<String> lines = new ProfileReportFormatter(() -> 1_024L * SizeTier.MIB).format(profile);

    assertEquals("File: " + Path.of("models", "house.ifc"), lines.get(0));
    assertEquals("Size: 2.00 MB (2097152 bytes)", lines.get(1));
    assertEquals("Modified: 2024-03-01T12:00:00Z", lines.get(2));
    assertTrue(lines.contains("Size tier: SMALL - File size is manageable"));
    assertTrue(lines.contains("Header: valid (ISO-10303-21;)"));
    assertTrue(lines.contains("Schema: IFC2X3"));
    assertTrue(lines.contains("Encoding: ok"));
    assertTrue(lines.contains("Recommendations: none"));
    assertTrue(lines.contains("Estimated RAM: 6 MB"));
    assertTrue(lines.contains("Current max heap: 1024 MB"));
    assertFalse(lines.stream().anyMatch(line -> line.startsWith("Warning")));
  }

  @Test
  void largeFileWarnsWhenHeapTooSmall() {
    FileProfile profile = profile(300L * SizeTier.MIB, false, Optional.empty(), true);

    List<String> lines = new ProfileReportFormatter(() -> 512L * SizeTier.MIB).format(profile);

    assertTrue(lines.contains("Size tier: WARNING - Large file; conversion may need increased memory"));
    assertTrue(lines.contains("Header: INVALID (expected ISO-10303-21;)"));
    assertTrue(lines.contains("Schema: not found in first 1024 bytes"));
    assertTrue(lines.contains("Encoding: possible binary content or non-UTF-8 encoding"));
    assertTrue(lines.contains("  - Use streaming conversion"));
    assertTrue(lines.contains("Estimated RAM: 900 MB"));
    assertEquals("Warning: estimated RAM exceeds the current max heap", lines.get(lines.size() - 1));
  }

  private static FileProfile profile(long size, boolean header, Optional<String> schema, boolean anomaly) {
    return new FileProfile(
        Path.of("models", "house.ifc"),
        size,
        Instant.parse("2024-03-01T12:00:00Z"),
        SizeTier.of(size),
        header,
        schema,
        anomaly,
        StepHeader.estimateRamMB(size),
        MemoryAdvisory.of(size));
  }
}
