package ca.gc.cra.stepfrag.application.convert;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stepfrag.testutil.CountingChannel;
import ca.gc.cra.stepfrag.testutil.StepFixtures;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ChunkedReaderAdapterTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Path file;
  private byte[] content;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(ChunkedReaderAdapter.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    file = StepFixtures.writeBytes(tempDir, "data.ifc", 1_000);
    content = Files.readAllBytes(file);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void readsRequestedRange() throws IOException {
    try (ChunkedReaderAdapter adapter = open()) {
      byte[] chunk = adapter.read(100, 50);

      assertArrayEquals(Arrays.copyOfRange(content, 100, 150), chunk);
      assertEquals(1L, adapter.requestCount());
      assertEquals(50L, adapter.bytesServed());
    }
  }

  @Test
  void backwardOffsetMarksCompletionOnce() throws IOException {
    try (ChunkedReaderAdapter adapter = open()) {
      adapter.read(0, 100);
      adapter.read(100, 100);
      adapter.read(400, 100);
      assertFalse(adapter.isFinished());

      byte[] reread = adapter.read(50, 10);

      assertTrue(adapter.isFinished());
      assertEquals(400L, adapter.lastOffset());
      assertArrayEquals(Arrays.copyOfRange(content, 50, 60), reread);

      adapter.read(0, 10);
      adapter.markFinished();
      assertEquals(1L, completionLogs());
    }
  }

  @Test
  void explicitFinishBeforeAnyBackwardRead() throws IOException {
    try (ChunkedReaderAdapter adapter = open()) {
      adapter.read(0, 100);
      adapter.markFinished();
      assertTrue(adapter.isFinished());

      adapter.read(0, 100);
      assertEquals(1L, completionLogs());
    }
  }

  @Test
  void shortReadAtEndIsTrimmed() throws IOException {
    try (ChunkedReaderAdapter adapter = open()) {
      assertEquals(100, adapter.read(900, 500).length);
      assertEquals(0, adapter.read(1_000, 500).length);
      assertEquals(0, adapter.read(5_000, 500).length);
      assertEquals(0, adapter.read(10, 0).length);
    }
  }

  @Test
  void negativeArgumentsRejected() throws IOException {
    try (ChunkedReaderAdapter adapter = open()) {
      assertThrows(IllegalArgumentException.class, () -> adapter.read(-1, 10));
      assertThrows(IllegalArgumentException.class, () -> adapter.read(0, -10));
    }
  }

  @Test
  void useFromSecondThreadRejected() throws Exception {
    try (ChunkedReaderAdapter adapter = open()) {
      adapter.read(0, 10);
      AtomicReference<Throwable> failure = new AtomicReference<>();

      Thread other = new Thread(() -> {
        try {
          adapter.read(10, 10);
        } catch (Throwable t) {
          failure.set(t);
        }
      });
      other.start();
      other.join();

      assertInstanceOf(IllegalStateException.class, failure.get());
    }
  }

  @Test
  void closeIsIdempotentAndBlocksReads() throws IOException {
    CountingChannel channel = new CountingChannel(Files.newByteChannel(file), false);
    ChunkedReaderAdapter adapter = new ChunkedReaderAdapter(channel, "data.ifc");

    adapter.close();
    adapter.close();

    assertEquals(1, channel.closeCalls());
    assertThrows(ClosedChannelException.class, () -> adapter.read(0, 10));
  }

  private ChunkedReaderAdapter open() throws IOException {
    return new ChunkedReaderAdapter(Files.newByteChannel(file), "data.ifc");
  }

  private long completionLogs() {
    return appender.list.stream()
        .filter(e -> e.getFormattedMessage().startsWith("File reading completed for data.ifc"))
        .count();
  }
}
