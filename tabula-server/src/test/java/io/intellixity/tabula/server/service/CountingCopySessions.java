package io.intellixity.tabula.server.service;

import io.intellixity.tabula.ingest.copy.BufferedCopyLineStream;
import io.intellixity.tabula.ingest.copy.CopySession;
import io.intellixity.tabula.ingest.copy.CopySessionFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/** Copy sessions that only count the committed row lines. */
final class CountingCopySessions implements CopySessionFactory {
  final AtomicInteger begun = new AtomicInteger();
  final AtomicInteger committedRowLines = new AtomicInteger();

  @Override
  public CopySession begin() {
    begun.incrementAndGet();
    return new CopySession() {
      private int rowLines;

      @Override
      public BufferedCopyLineStream openCopy(String copySql, int highWaterMark) {
        boolean rows = copySql.contains("data_row");
        return new BufferedCopyLineStream(highWaterMark) {
          @Override
          protected void flushChunk(byte[] chunk, int length) {
            if (!rows) return;
            String text = new String(chunk, 0, length, StandardCharsets.UTF_8);
            for (int i = 0; i < text.length(); i++) {
              if (text.charAt(i) == '\n') rowLines++;
            }
          }

          @Override
          protected long completeCopy() {
            return linesWritten();
          }

          @Override
          protected void abortCopy() {}
        };
      }

      @Override public void commit() { committedRowLines.addAndGet(rowLines); }
      @Override public void rollback() { rowLines = 0; }
      @Override public void close() {}
    };
  }
}
