package ca.gc.cra.stepfrag.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationTest {
  @TempDir Path tempDir;

  @Test
  void numbersEnforceRange() {
    assertEquals(5, Numbers.parseIntInRange("level", " 5 ", 0, 9));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("level", "10", 0, 9));
    assertTrue(ex.getMessage().contains("level must be between 0 and 9 (was 10)"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("level", "x", 0, 9));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("level", "", 0, 9));
  }

  @Test
  void extensionsMustStartWithDot() {
    assertEquals(".frag", Strings.requireExtension("ext", " .frag "));
    assertEquals(".frag.gz", Strings.requireExtension("ext", ".frag.gz"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("ext", "frag"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("ext", "./frag"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("ext", ".fr\tag"));
  }

  @Test
  void printableAsciiEnforced() {
    assertEquals("env=dev", Strings.requirePrintableAscii("attrs", "env=dev", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=dév", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x".repeat(17), 16));
  }

  @Test
  void pathsParsedAndRewritten() {
    assertEquals(Path.of("a", "c.ifc"), Paths.parse("in", "a/b/../c.ifc"));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("in", "   "));
    assertEquals(Path.of("dir", "model.frag"), Paths.withExtension(Path.of("dir", "model.ifc"), ".frag"));
    assertEquals(Path.of("README.frag"), Paths.withExtension(Path.of("README"), ".frag"));
    assertEquals(Path.of(".hidden.frag"), Paths.withExtension(Path.of(".hidden"), ".frag"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir));
  }
}
