package ca.gc.cra.stepfrag.domain.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StepHeaderTest {
  private static final String HEADER = "ISO-10303-21;\nHEADER;\n"
      + "FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');\n"
      + "FILE_SCHEMA(('IFC4'));\nENDSEC;\n";

  @Test
  void magicMustBeAtStart() {
    assertTrue(StepHeader.hasMagic(HEADER.getBytes(StandardCharsets.US_ASCII)));
    assertFalse(StepHeader.hasMagic((" " + HEADER).getBytes(StandardCharsets.US_ASCII)));
    assertFalse(StepHeader.hasMagic("ISO-10303".getBytes(StandardCharsets.US_ASCII)));
    assertFalse(StepHeader.hasMagic(null));
  }

  @Test
  void anySingleByteMutationInvalidatesMagic() {
    byte[] prefix = HEADER.getBytes(StandardCharsets.US_ASCII);
    for (int i = 0; i < StepHeader.MAGIC.length(); i++) {
      byte[] mutated = prefix.clone();
      mutated[i] ^= 0x01;
      assertFalse(StepHeader.hasMagic(mutated), "mutation at byte " + i);
    }
  }

  @Test
  void schemaIdExtracted() {
    assertEquals(Optional.of("IFC4"), StepHeader.schemaId(HEADER));
    assertEquals(Optional.of("IFC2X3"), StepHeader.schemaId("file_schema ( ('IFC2X3'));"));
    assertEquals(Optional.empty(), StepHeader.schemaId("HEADER;ENDSEC;"));
  }

  @Test
  void nulAndMalformedBytesFlagged() {
    assertFalse(StepHeader.hasEncodingAnomaly(StepHeader.decode(HEADER.getBytes(StandardCharsets.UTF_8))));

    byte[] withNul = {'I', 'S', 'O', 0, 'x'};
    assertTrue(StepHeader.hasEncodingAnomaly(StepHeader.decode(withNul)));

    byte[] malformed = {'I', 'S', 'O', (byte) 0xC3, (byte) 0x28};
    assertTrue(StepHeader.hasEncodingAnomaly(StepHeader.decode(malformed)));
  }

  @Test
  void multiByteUtf8IsNotAnAnomaly() {
    byte[] text = "FILE_NAME('Café.ifc');".getBytes(StandardCharsets.UTF_8);
    assertFalse(StepHeader.hasEncodingAnomaly(StepHeader.decode(text)));
  }

  @Test
  void unfinishedCharacterOnlyToleratedAtWindowEdge() {
    byte[] window = new byte[StepHeader.PREFIX_BYTES];
    Arrays.fill(window, (byte) 'a');
    window[window.length - 1] = (byte) 0xC3;
    String decoded = StepHeader.decode(window);
    assertEquals(StepHeader.PREFIX_BYTES - 1, decoded.length());
    assertFalse(StepHeader.hasEncodingAnomaly(decoded));

    byte[] shortFile = {'I', 'S', 'O', (byte) 0xC3};
    assertTrue(StepHeader.hasEncodingAnomaly(StepHeader.decode(shortFile)));
  }

  @Test
  void ramEstimateIsThreeTimesSizeRoundedUp() {
    assertEquals(0L, StepHeader.estimateRamMB(0));
    assertEquals(1L, StepHeader.estimateRamMB(1));
    assertEquals(30L, StepHeader.estimateRamMB(10L * SizeTier.MIB));
    assertEquals(300L, StepHeader.estimateRamMB(100L * SizeTier.MIB));
  }
}
