package ca.gc.cra.stepfrag.application.convert;

import ca.gc.cra.stepfrag.application.port.ChunkSource;
import ca.gc.cra.stepfrag.domain.stream.ReadRequest;
import ca.gc.cra.stepfrag.domain.stream.StreamState;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serves a parser's arbitrary-offset pull requests from one open file handle.
 * <p><strong>Why:</strong> Large exchange files must never be loaded whole; the parser asks for exactly the bytes it
 * needs and the adapter answers with one bounded read per request.</p>
 * <p><strong>Role:</strong> {@link ChunkSource} implementation created by the conversion orchestrator, one per
 * conversion.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Position the channel at the requested offset and perform a single read.</li>
 *   <li>Infer completion from the first backward seek, or accept an explicit {@link #markFinished()}.</li>
 *   <li>Count requests and bytes served.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded and non-reentrant. The adapter binds to the first thread that
 * reads from it and rejects reads from any other thread.</p>
 * <p><strong>Performance:</strong> Allocates one buffer of the requested size per call; short reads are trimmed, not
 * padded, and never retried.</p>
 * <p><strong>Observability:</strong> Logs each request at TRACE and the completion transition once at INFO.</p>
 *
 * @implNote The adapter owns the channel it wraps and releases it in {@link #close()}; the orchestrator guarantees
 * close is called exactly once.
 * @since 0.1.0
 */
public final class ChunkedReaderAdapter implements ChunkSource, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChunkedReaderAdapter.class);
  private static final byte[] EMPTY = new byte[0];

  private final SeekableByteChannel channel;
  private final String label;
  private final StreamState state = new StreamState();
  private Thread owner;
  private boolean closed;
  private long requestCount;
  private long bytesServed;

  /**
   * Wraps an open channel.
   *
   * @param channel readable, seekable channel; ownership passes to the adapter
   * @param label name used in log lines, typically the input file name
   */
  public ChunkedReaderAdapter(SeekableByteChannel channel, String label) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.label = label == null ? "<unnamed>" : label;
  }

  @Override
  public byte[] read(long offset, int size) throws IOException {
    ReadRequest request = new ReadRequest(offset, size);
    checkOwner();
    if (closed) {
      throw new ClosedChannelException();
    }
    requestCount++;
    if (state.observe(request.offset())) {
      log.info("File reading completed for {} ({} requests, {} bytes served)", label, requestCount, bytesServed);
    }
    if (request.size() == 0) {
      return EMPTY;
    }
    ByteBuffer buffer = ByteBuffer.allocate(request.size());
    channel.position(request.offset());
    int read = channel.read(buffer);
    if (log.isTraceEnabled()) {
      log.trace("Read request offset={} size={} returned {}", request.offset(), request.size(), read);
    }
    if (read <= 0) {
      return EMPTY;
    }
    bytesServed += read;
    return read == request.size() ? buffer.array() : Arrays.copyOf(buffer.array(), read);
  }

  @Override
  public void markFinished() {
    if (state.finish()) {
      log.info("File reading completed for {} ({} requests, {} bytes served)", label, requestCount, bytesServed);
    }
  }

  @Override
  public boolean isFinished() {
    return state.isFinished();
  }

  /** Number of read requests served so far. */
  public long requestCount() {
    return requestCount;
  }

  /** Total bytes returned to the consumer so far. */
  public long bytesServed() {
    return bytesServed;
  }

  /** Offset of the last request observed before completion; {@code -1} before the first request. */
  public long lastOffset() {
    return state.lastOffset();
  }

  /**
   * Closes the underlying channel. Subsequent reads fail with {@link ClosedChannelException}.
   *
   * @throws IOException if the channel fails to close
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    channel.close();
  }

  private void checkOwner() {
    Thread current = Thread.currentThread();
    if (owner == null) {
      owner = current;
    } else if (owner != current) {
      throw new IllegalStateException(
          "ChunkedReaderAdapter for " + label + " is bound to thread " + owner.getName()
              + " and cannot be used from " + current.getName());
    }
  }
}
