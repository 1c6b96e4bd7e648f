package io.intellixity.tabula.ingest.copy;

/**
 * One connection and one transaction with relaxed commit durability.\n
 *
 * A session runs at most one copy at a time; the previous stream must be finished before
 * {@link #openCopy} is called again.\n
 */
public interface CopySession extends AutoCloseable {
  /** Start a copy whose stream asks for a drain once {@code highWaterMark} bytes are buffered. */
  BufferedCopyLineStream openCopy(String copySql, int highWaterMark);

  void commit();

  void rollback();

  /** Releases the connection; never throws. */
  @Override
  void close();
}
