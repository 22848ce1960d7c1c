package ca.gc.cra.stepfrag.domain.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MemoryAdvisoryTest {

  @Test
  void smallFilesNeedNoAdvice() {
    MemoryAdvisory advisory = MemoryAdvisory.of(50L * SizeTier.MIB);

    assertEquals(MemoryAdvisory.NONE, advisory);
    assertTrue(advisory.recommendations().isEmpty());
    assertFalse(advisory.recommendedHeapMB().isPresent());
  }

  @Test
  void advisoryAppliesBeforeSizeTierEscalates() {
    long size = 60L * SizeTier.MIB;

    assertEquals(SizeTier.SMALL, SizeTier.of(size));
    assertEquals(MemoryAdvisory.MONITOR, MemoryAdvisory.of(size));
    assertEquals(4096L, MemoryAdvisory.of(size).recommendedHeapMB().getAsLong());
    assertTrue(MemoryAdvisory.MONITOR.recommendations().contains("Increase JVM heap: -Xmx4g"));
  }

  @Test
  void streamingAboveTwoHundredMiB() {
    assertEquals(MemoryAdvisory.MONITOR, MemoryAdvisory.of(200L * SizeTier.MIB));
    assertEquals(MemoryAdvisory.STREAMING, MemoryAdvisory.of(200L * SizeTier.MIB + 1));
    assertEquals(8192L, MemoryAdvisory.STREAMING.recommendedHeapMB().getAsLong());
    assertEquals(3, MemoryAdvisory.STREAMING.recommendations().size());
  }
}
