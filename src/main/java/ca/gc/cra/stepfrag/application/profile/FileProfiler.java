package ca.gc.cra.stepfrag.application.profile;

import ca.gc.cra.stepfrag.application.port.MetricsPort;
import ca.gc.cra.stepfrag.domain.profile.FileProfile;
import ca.gc.cra.stepfrag.domain.profile.MemoryAdvisory;
import ca.gc.cra.stepfrag.domain.profile.SizeTier;
import ca.gc.cra.stepfrag.domain.profile.StepHeader;
import ca.gc.cra.stepfrag.logging.Logs;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Inspects an exchange file's size and header without loading it.
 * <p><strong>Why:</strong> Operators need a cheap go/no-go signal and a heap recommendation before launching a
 * memory-heavy conversion.</p>
 * <p><strong>Role:</strong> Application service used by the {@code profile} command and by {@code convert --preflight}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read file attributes once and the first {@value StepHeader#PREFIX_BYTES} bytes once.</li>
 *   <li>Derive the size tier, memory advisory, header validity, schema and encoding flags.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Memory use is bounded by the prefix buffer regardless of file size.</p>
 * <p><strong>Observability:</strong> Increments {@code profile.files}; logs a DEBUG header preview and WARN lines for
 * memory advisories.</p>
 *
 * @since 0.1.0
 */
public final class FileProfiler {
  private static final Logger log = LoggerFactory.getLogger(FileProfiler.class);
  private static final int PREVIEW_BYTES = 120;

  private final MetricsPort metrics;

  public FileProfiler() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a profiler reporting to the supplied metrics port.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public FileProfiler(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Profiles a file.
   *
   * @param path file to inspect; must not be {@code null}
   * @return profile snapshot
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws IOException if attributes or the prefix cannot be read
   */
  public FileProfile profile(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
    if (attributes.isDirectory()) {
      throw new IOException("Not a regular file: " + path);
    }
    long size = attributes.size();
    byte[] prefix = readPrefix(path);

    String text = StepHeader.decode(prefix);
    boolean headerValid = StepHeader.hasMagic(prefix);
    Optional<String> schemaId = StepHeader.schemaId(text);
    boolean anomaly = StepHeader.hasEncodingAnomaly(text);
    SizeTier tier = SizeTier.of(size);
    MemoryAdvisory advisory = MemoryAdvisory.of(size);

    FileProfile profile = new FileProfile(
        path,
        size,
        attributes.lastModifiedTime().toInstant(),
        tier,
        headerValid,
        schemaId,
        anomaly,
        StepHeader.estimateRamMB(size),
        advisory);

    metrics.increment("profile.files");
    if (log.isDebugEnabled()) {
      log.debug("Header preview for {}: {}", path, Logs.preview(text, PREVIEW_BYTES));
    }
    log.info("Profiled {}: {} bytes, tier={}, headerValid={}, schema={}",
        path, size, tier, headerValid, schemaId.orElse("<none>"));
    logAdvisories(profile);
    return profile;
  }

  private static byte[] readPrefix(Path path) throws IOException {
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      ByteBuffer buffer = ByteBuffer.allocate(StepHeader.PREFIX_BYTES);
      int read = channel.read(buffer, 0L);
      if (read <= 0) {
        return new byte[0];
      }
      return Arrays.copyOf(buffer.array(), read);
    }
  }

  private static void logAdvisories(FileProfile profile) {
    if (!profile.headerValid()) {
      log.warn("{} does not start with {}; the parser may reject it", profile.path(), StepHeader.MAGIC);
    }
    if (profile.encodingAnomaly()) {
      log.warn("{} header contains NUL or undecodable bytes; file may be binary or not UTF-8", profile.path());
    }
    if (profile.sizeTier() != SizeTier.SMALL) {
      log.warn("{}: {}", profile.path(), profile.sizeTier().description());
    }
    for (String recommendation : profile.memoryAdvisory().recommendations()) {
      log.warn("{}: {}", profile.path(), recommendation);
    }
  }
}
