package ca.gc.cra.stepfrag.application.convert;

import ca.gc.cra.stepfrag.application.port.ArtifactParser;
import ca.gc.cra.stepfrag.application.port.ChannelOpener;
import ca.gc.cra.stepfrag.application.port.ClockPort;
import ca.gc.cra.stepfrag.application.port.MetricsPort;
import ca.gc.cra.stepfrag.domain.convert.ConversionResult;
import ca.gc.cra.stepfrag.domain.convert.ConversionStats;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one exchange file through a chunk reader and an artifact parser and writes the result.
 * <p><strong>Why:</strong> Callers need a single call that either produces a fragments file with statistics or
 * reports a failure as a value, with the input handle released on every path.</p>
 * <p><strong>Role:</strong> Application use case invoked by the {@code convert} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the input through {@link ChannelOpener} and wrap it in a {@link ChunkedReaderAdapter}.</li>
 *   <li>Hand the adapter to the {@link ArtifactParser} and write the returned artifact in one blocking write to a
 *   sibling {@code .part} file that is then moved over {@code output}, so a failed write leaves no truncated
 *   artifact behind.</li>
 *   <li>Compute {@link ConversionStats} and translate every read, parse or write failure into a failed
 *   {@link ConversionResult}.</li>
 *   <li>Close the input handle exactly once after it was opened.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #convert(Path, Path)} call owns its adapter; concurrent calls are
 * independent as long as the parser is.</p>
 * <p><strong>Performance:</strong> The artifact is held in memory between parse and write.</p>
 * <p><strong>Observability:</strong> Tags log lines with MDC {@code convert.in}; emits {@code convert.attempts},
 * {@code convert.success}, {@code convert.failure}, {@code convert.duration.millis}, {@code convert.input.bytes},
 * {@code convert.output.bytes} and {@code convert.reader.requests}.</p>
 *
 * @since 0.1.0
 */
public final class ConversionOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(ConversionOrchestrator.class);
  static final String MDC_INPUT = "convert.in";

  private final ArtifactParser parser;
  private final ChannelOpener opener;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates an orchestrator with explicit collaborators.
   *
   * @param parser artifact parser; must not be {@code null}
   * @param opener input handle factory; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock monotonic clock; must not be {@code null}
   */
  public ConversionOrchestrator(
      ArtifactParser parser, ChannelOpener opener, MetricsPort metrics, ClockPort clock) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.opener = Objects.requireNonNull(opener, "opener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates an orchestrator that opens files with {@link ChannelOpener#FILE_CHANNEL} and times with the system clock.
   *
   * @param parser artifact parser; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ConversionOrchestrator(ArtifactParser parser, MetricsPort metrics) {
    this(parser, ChannelOpener.FILE_CHANNEL, metrics, ClockPort.SYSTEM);
  }

  /**
   * Converts {@code input} into an artifact written to {@code output}.
   *
   * @param input exchange file to convert; must not be {@code null}
   * @param output artifact destination; missing parent directories are created
   * @return terminal result; never {@code null} and never thrown
   */
  public ConversionResult convert(Path input, Path output) {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    long start = clock.nanoTime();
    String name = displayName(input);
    metrics.increment("convert.attempts");
    MDC.put(MDC_INPUT, input.toString());
    ChunkedReaderAdapter adapter = null;
    try {
      log.info("Starting conversion of {}", name);
      if (!Files.exists(input)) {
        return fail(name, "Input file not found: " + input, start, null);
      }
      long inputBytes = Files.size(input);
      log.info("Input size {} bytes", inputBytes);

      SeekableByteChannel channel = opener.open(input);
      adapter = new ChunkedReaderAdapter(channel, name);
      byte[] artifact = parser.process(adapter);
      if (artifact == null) {
        throw new IOException("Parser returned no artifact");
      }
      log.info("Parser produced {} bytes after {} read requests", artifact.length, adapter.requestCount());

      writeArtifact(output, artifact);
      log.info("Wrote fragments file {}", output);

      long elapsed = clock.nanoTime() - start;
      ConversionStats stats = new ConversionStats(inputBytes, artifact.length, Math.max(0L, elapsed));
      metrics.increment("convert.success");
      metrics.observe("convert.duration.millis", TimeUnit.NANOSECONDS.toMillis(stats.elapsedNanos()));
      metrics.observe("convert.input.bytes", inputBytes);
      metrics.observe("convert.output.bytes", artifact.length);
      log.info("Converted {}: {} MB -> {} MB ({} reduction) in {} s",
          name, stats.inputSizeMB(), stats.outputSizeMB(), stats.compressionRatio(), stats.conversionTimeSeconds());
      return ConversionResult.success("Successfully converted " + name + " to fragments", stats);
    } catch (Exception | OutOfMemoryError ex) {
      return fail(name, describe(ex), start, ex);
    } finally {
      if (adapter != null) {
        metrics.observe("convert.reader.requests", adapter.requestCount());
        closeQuietly(adapter, name);
      }
      MDC.remove(MDC_INPUT);
    }
  }

  private ConversionResult fail(String name, String cause, long start, Throwable ex) {
    metrics.increment("convert.failure");
    metrics.observe("convert.duration.millis", TimeUnit.NANOSECONDS.toMillis(Math.max(0L, clock.nanoTime() - start)));
    String message = "Failed to convert " + name + ": " + cause;
    if (ex == null) {
      log.error(message);
    } else {
      log.error(message, ex);
    }
    return ConversionResult.failure(message, cause);
  }

  private static void closeQuietly(ChunkedReaderAdapter adapter, String name) {
    try {
      adapter.close();
    } catch (IOException ex) {
      log.warn("Could not close file handle for {}: {}", name, ex.getMessage(), ex);
    }
  }

  // the artifact only appears at its final path once fully written
  private static void writeArtifact(Path output, byte[] artifact) throws IOException {
    Path target = output.toAbsolutePath();
    Path parent = target.getParent();
    if (parent == null) {
      throw new IOException("Output path has no parent directory: " + output);
    }
    Files.createDirectories(parent);
    // .<name>.part beside the target, created with default permissions
    Path partial = parent.resolve("." + target.getFileName() + ".part");
    try {
      Files.write(partial, artifact);
      moveIntoPlace(partial, target);
    } catch (IOException | RuntimeException ex) {
      discardPartial(partial, ex);
      throw ex;
    }
  }

  private static void moveIntoPlace(Path partial, Path target) throws IOException {
    try {
      Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", target);
      Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void discardPartial(Path partial, Exception cause) {
    try {
      Files.deleteIfExists(partial);
    } catch (IOException ex) {
      cause.addSuppressed(ex);
      log.warn("Could not remove partial artifact {}: {}", partial, ex.getMessage());
    }
  }

  private static String describe(Throwable ex) {
    if (ex instanceof FileSystemException fs) {
      // the bare message is only the path
      return fs.getClass().getSimpleName() + ": " + fs.getMessage();
    }
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.toString() : message;
  }

  private static String displayName(Path input) {
    Path fileName = input.getFileName();
    return fileName == null ? input.toString() : fileName.toString();
  }
}
