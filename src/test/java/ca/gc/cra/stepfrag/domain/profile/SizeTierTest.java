package ca.gc.cra.stepfrag.domain.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SizeTierTest {

  @Test
  void smallBelowWarningThreshold() {
    assertEquals(SizeTier.SMALL, SizeTier.of(0));
    assertEquals(SizeTier.SMALL, SizeTier.of(100L * SizeTier.MIB - 1));
  }

  @Test
  void warningStartsAtOneHundredMiB() {
    assertEquals(SizeTier.WARNING, SizeTier.of(100L * SizeTier.MIB));
    assertEquals(SizeTier.WARNING, SizeTier.of(500L * SizeTier.MIB - 1));
  }

  @Test
  void criticalStartsAtFiveHundredMiB() {
    assertEquals(SizeTier.CRITICAL, SizeTier.of(500L * SizeTier.MIB));
    assertEquals(SizeTier.CRITICAL, SizeTier.of(4L * 1024 * SizeTier.MIB));
  }

  @Test
  void negativeSizeRejected() {
    assertThrows(IllegalArgumentException.class, () -> SizeTier.of(-1));
  }
}
