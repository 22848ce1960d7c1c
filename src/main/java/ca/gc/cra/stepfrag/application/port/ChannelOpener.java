package ca.gc.cra.stepfrag.application.port;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Opens the read handle used for one conversion.
 *
 * @implNote Tests substitute instrumented channels to observe close counts and inject failures.
 * @since 0.1.0
 */
@FunctionalInterface
public interface ChannelOpener {
  /**
   * Opens {@code path} for reading.
   *
   * @param path file to open
   * @return open channel; the caller owns and closes it
   * @throws IOException if the file cannot be opened
   */
  SeekableByteChannel open(Path path) throws IOException;

  /** Default opener backed by {@link FileChannel#open(Path, java.nio.file.OpenOption...)}. */
  ChannelOpener FILE_CHANNEL = path -> FileChannel.open(path, StandardOpenOption.READ);
}
