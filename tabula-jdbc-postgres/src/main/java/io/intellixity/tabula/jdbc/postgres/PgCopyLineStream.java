package io.intellixity.tabula.jdbc.postgres;

import io.intellixity.tabula.ingest.copy.BufferedCopyLineStream;
import io.intellixity.tabula.jdbc.SqlErrors;
import org.postgresql.copy.CopyIn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;

/** Feeds buffered CSV lines into a running {@code COPY ... FROM STDIN}. */
final class PgCopyLineStream extends BufferedCopyLineStream {
  private static final Logger log = LoggerFactory.getLogger(PgCopyLineStream.class);

  private final CopyIn copy;
  private final String label;

  PgCopyLineStream(CopyIn copy, int highWaterMark, String label) {
    super(highWaterMark);
    this.copy = Objects.requireNonNull(copy, "copy");
    this.label = label;
  }

  @Override
  protected void flushChunk(byte[] chunk, int length) {
    try {
      copy.writeToCopy(chunk, 0, length);
    } catch (SQLException e) {
      throw SqlErrors.translate("copy.write " + label, e);
    }
  }

  @Override
  protected long completeCopy() {
    try {
      long n = copy.endCopy();
      if (log.isDebugEnabled()) log.debug("tabula.copy done target={} rows={}", label, n);
      return n;
    } catch (SQLException e) {
      throw SqlErrors.translate("copy.end " + label, e);
    }
  }

  @Override
  protected void abortCopy() {
    if (!copy.isActive()) return;
    try {
      copy.cancelCopy();
    } catch (SQLException e) {
      log.warn("tabula.copy cancel failed target={}", label, e);
    }
  }
}
