package ca.gc.cra.stepfrag.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stepfrag.infrastructure.parser.ParserSettings;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConvertConfigTest {
  @TempDir Path tempDir;

  @Test
  void defaultOutputReplacesExtensionBesideInput() {
    ConvertConfig config = ConvertConfig.fromMap(Map.of("in", "models/tower.ifc"));

    assertEquals(Path.of("models", "tower.frag"), config.resolveOutput());
    assertEquals(ParserSettings.defaults(), config.parserSettings());
    assertFalse(config.preflight());
  }

  @Test
  void customExtensionAndExplicitOutput() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("convert"));
    options.put("in", "models/tower.step");
    options.put("fragmentExtension", ".frag.bin");

    assertEquals(Path.of("models", "tower.frag.bin"), ConvertConfig.fromMap(options).resolveOutput());

    options.put("out", "build/out.frag");
    options.put("chunkBytes", "1024");
    options.put("compressionLevel", "0");
    options.put("preflight", "TRUE");
    ConvertConfig config = ConvertConfig.fromMap(options);

    assertEquals(Path.of("build", "out.frag"), config.resolveOutput());
    assertEquals(new ParserSettings(1024, 0), config.parserSettings());
    assertTrue(config.preflight());
  }

  @Test
  void invalidValuesRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(Map.of("in", "a.ifc", "compressionLevel", "11")));
    assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(Map.of("in", "a.ifc", "chunkBytes", "lots")));
    assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(Map.of("in", "a.ifc", "fragmentExtension", "frag")));
    assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(Map.of("in", "a.ifc", "out", tempDir.toString())));
  }

  @Test
  void profileConfigAcceptsLongAlias() {
    assertEquals(Path.of("x.ifc"), ProfileConfig.fromMap(Map.of("input", "x.ifc")).input());
    assertThrows(IllegalArgumentException.class, () -> ProfileConfig.fromMap(Map.of("in", " ")));
  }
}
