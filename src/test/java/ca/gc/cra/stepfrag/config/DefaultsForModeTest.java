package ca.gc.cra.stepfrag.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void convertDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("convert");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("65536", defaults.get("chunkBytes"));
    assertEquals("6", defaults.get("compressionLevel"));
    assertEquals(".frag", defaults.get("fragmentExtension"));
    assertEquals("false", defaults.get("preflight"));
  }

  @Test
  void profileCarriesOnlyCommonDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("PROFILE");

    assertEquals("false", defaults.get("verbose"));
    assertFalse(defaults.containsKey("chunkBytes"));
  }

  @Test
  void unknownModeRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
