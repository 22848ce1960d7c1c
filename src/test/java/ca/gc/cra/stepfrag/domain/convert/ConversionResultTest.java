package ca.gc.cra.stepfrag.domain.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConversionResultTest {

  @Test
  void successCarriesStatsOnly() {
    ConversionResult result = ConversionResult.success("ok", new ConversionStats(10, 5, 1));

    assertTrue(result.success());
    assertTrue(result.stats().isPresent());
    assertFalse(result.error().isPresent());
  }

  @Test
  void failureCarriesErrorOnly() {
    ConversionResult result = ConversionResult.failure("Failed to convert a.ifc: boom", "boom");

    assertFalse(result.success());
    assertEquals(Optional.of("boom"), result.error());
    assertFalse(result.stats().isPresent());
  }

  @Test
  void inconsistentCombinationsRejected() {
    ConversionStats stats = new ConversionStats(1, 1, 1);
    assertThrows(IllegalArgumentException.class,
        () -> new ConversionResult(true, "x", Optional.empty(), Optional.empty()));
    assertThrows(IllegalArgumentException.class,
        () -> new ConversionResult(true, "x", Optional.of(stats), Optional.of("e")));
    assertThrows(IllegalArgumentException.class,
        () -> new ConversionResult(false, "x", Optional.of(stats), Optional.of("e")));
    assertThrows(IllegalArgumentException.class,
        () -> new ConversionResult(false, "x", Optional.empty(), Optional.empty()));
  }
}
