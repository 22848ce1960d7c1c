package ca.gc.cra.stepfrag.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stepfrag.infrastructure.report.ResultLineFormatter;
import ca.gc.cra.stepfrag.infrastructure.report.ResultLineFormatter.ReportedResult;
import ca.gc.cra.stepfrag.testutil.StepFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ConvertCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ConvertCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
  }

  @Test
  void successfulConversionEndsWithResultLine() throws IOException {
    Path input = StepFixtures.writeSmallIfc(tempDir, "wall.ifc");

    ExitCode code = ConvertCli.run(new String[] {"in=" + input, "compressionLevel=9"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(0, code.code());
    List<String> lines = stdoutLines();
    assertTrue(lines.get(lines.size() - 1).startsWith(ResultLineFormatter.MARKER));
    ReportedResult result = new ResultLineFormatter().extract(lines).orElseThrow();
    assertTrue(result.success());
    assertEquals("Successfully converted wall.ifc to fragments", result.message());
    assertTrue(Files.isRegularFile(tempDir.resolve("wall.frag")));
  }

  @Test
  void preflightAndExplicitOutput() throws IOException {
    Path input = StepFixtures.writeSmallIfc(tempDir, "slab.ifc");
    Path output = tempDir.resolve("out/slab.bin");

    ExitCode code = ConvertCli.run(new String[] {"in=" + input, "out=" + output, "--preflight"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.isRegularFile(output));
  }

  @Test
  void missingInputFileReportsFailureLine() {
    Path input = tempDir.resolve("absent.ifc");

    ExitCode code = ConvertCli.run(new String[] {"in=" + input});

    assertEquals(ExitCode.FAILURE, code);
    assertEquals(1, code.code());
    ReportedResult result = new ResultLineFormatter().extract(stdoutLines()).orElseThrow();
    assertFalse(result.success());
    assertEquals("Input file not found: " + input, result.error().orElseThrow());
  }

  @Test
  void missingInArgumentPrintsUsage() {
    ExitCode code = ConvertCli.run(new String[] {"compressionLevel=3"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertEquals(1, code.code());
    String out = buffer.toString();
    assertTrue(out.contains("usage: convert"));
    assertFalse(out.contains(ResultLineFormatter.MARKER));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
        && e.getFormattedMessage().contains("in is required for convert")));
  }

  @Test
  void yamlConfigSuppliesInput() throws IOException {
    Path input = StepFixtures.writeSmallIfc(tempDir, "roof.ifc");
    Path yaml = Files.writeString(tempDir.resolve("stepfrag.yaml"),
        "convert:\n  input: " + input.toString().replace("\\", "/") + "\n  fragmentExtension: .frg\n");

    ExitCode code = ConvertCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.isRegularFile(tempDir.resolve("roof.frg")));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = ConvertCli.run(new String[] {"config=" + tempDir.resolve("nope.yaml"), "in=x.ifc"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: convert"));
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, ConvertCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("compressionLevel=0..9"));
  }

  private List<String> stdoutLines() {
    return buffer.toString().lines().toList();
  }
}
