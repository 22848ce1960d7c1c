package ca.gc.cra.stepfrag.testutil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.concurrent.atomic.AtomicInteger;

/** Delegating channel that counts close calls and can fail on close. */
public final class CountingChannel implements SeekableByteChannel {
  private final SeekableByteChannel delegate;
  private final boolean failOnClose;
  private final AtomicInteger closeCalls = new AtomicInteger();

  public CountingChannel(SeekableByteChannel delegate, boolean failOnClose) {
    this.delegate = delegate;
    this.failOnClose = failOnClose;
  }

  public int closeCalls() {
    return closeCalls.get();
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    return delegate.read(dst);
  }

  @Override
  public int write(ByteBuffer src) throws IOException {
    return delegate.write(src);
  }

  @Override
  public long position() throws IOException {
    return delegate.position();
  }

  @Override
  public SeekableByteChannel position(long newPosition) throws IOException {
    delegate.position(newPosition);
    return this;
  }

  @Override
  public long size() throws IOException {
    return delegate.size();
  }

  @Override
  public SeekableByteChannel truncate(long size) throws IOException {
    delegate.truncate(size);
    return this;
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void close() throws IOException {
    closeCalls.incrementAndGet();
    delegate.close();
    if (failOnClose) {
      throw new IOException("simulated close failure");
    }
  }
}
