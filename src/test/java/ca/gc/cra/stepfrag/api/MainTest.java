package ca.gc.cra.stepfrag.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: stepfrag <convert|profile>"));
  }

  @Test
  void unknownCommandRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"assemble"}));
  }

  @Test
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("convert"));
    assertTrue(buffer.toString().contains("profile"));
  }

  @Test
  void helpAfterCommandIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"convert", "--help"}));
    assertTrue(buffer.toString().contains("STEPFRAG convert"));
  }
}
