package io.intellixity.tabula.ingest.copy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Buffered line sink for one bulk-copy relation.\n
 *
 * <p>{@link #write} never blocks: it appends to an in-memory buffer and returns {@code false} once the
 * buffer passed its high-water mark. The producer must then call {@link #awaitDrain()}, which hands
 * the buffer to the server and blocks until that is done. Subclasses implement the hand-off.</p>
 */
public abstract class BufferedCopyLineStream implements AutoCloseable {
  private final int highWaterMark;
  private final ByteArrayOutputStream buffer;
  private long linesWritten;
  private boolean finished;

  protected BufferedCopyLineStream(int highWaterMark) {
    if (highWaterMark <= 0) throw new IllegalArgumentException("highWaterMark must be > 0");
    this.highWaterMark = highWaterMark;
    this.buffer = new ByteArrayOutputStream(Math.min(highWaterMark, 1 << 20) + 256);
  }

  /** Buffer one encoded line; false means the caller must {@link #awaitDrain()} before writing more. */
  public final boolean write(String line) {
    if (finished) throw new IllegalStateException("Copy stream already finished");
    byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
    buffer.write(bytes, 0, bytes.length);
    linesWritten++;
    return buffer.size() < highWaterMark;
  }

  /** Flush buffered lines to the server; returns once they were accepted. */
  public final void awaitDrain() {
    if (buffer.size() == 0) return;
    byte[] chunk = buffer.toByteArray();
    buffer.reset();
    flushChunk(chunk, chunk.length);
  }

  /** Drain the remainder and complete the copy; returns the row count the server reported. */
  public final long finish() {
    if (finished) throw new IllegalStateException("Copy stream already finished");
    awaitDrain();
    finished = true;
    return completeCopy();
  }

  public final long linesWritten() {
    return linesWritten;
  }

  public final int bufferedBytes() {
    return buffer.size();
  }

  /** Abort an unfinished copy. Finished streams ignore this. */
  @Override
  public final void close() {
    if (!finished) {
      finished = true;
      buffer.reset();
      abortCopy();
    }
  }

  protected abstract void flushChunk(byte[] chunk, int length);

  protected abstract long completeCopy();

  protected abstract void abortCopy();
}
