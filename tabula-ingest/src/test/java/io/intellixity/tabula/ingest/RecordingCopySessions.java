package io.intellixity.tabula.ingest;

import io.intellixity.tabula.ingest.copy.BufferedCopyLineStream;
import io.intellixity.tabula.ingest.copy.CopySession;
import io.intellixity.tabula.ingest.copy.CopySessionFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

/** Capturing copy sessions: committed lines are kept per relation, rolled-back ones are discarded. */
final class RecordingCopySessions implements CopySessionFactory {
  final List<String> committedRowLines = Collections.synchronizedList(new ArrayList<>());
  final List<String> committedCellLines = Collections.synchronizedList(new ArrayList<>());
  final AtomicInteger begun = new AtomicInteger();
  final AtomicInteger commits = new AtomicInteger();
  final AtomicInteger rollbacks = new AtomicInteger();
  final AtomicInteger closes = new AtomicInteger();
  final AtomicInteger drains = new AtomicInteger();
  final AtomicInteger open = new AtomicInteger();
  final AtomicInteger maxOpen = new AtomicInteger();
  final List<Integer> committedRowsPerSession = Collections.synchronizedList(new ArrayList<>());

  /** Sessions whose ordinal (1-based) matches fail when the row copy completes. */
  volatile IntPredicate failSession = n -> false;
  volatile long holdMillis;

  @Override
  public CopySession begin() {
    int ordinal = begun.incrementAndGet();
    maxOpen.accumulateAndGet(open.incrementAndGet(), Math::max);
    return new Session(ordinal);
  }

  final class Session implements CopySession {
    private final int ordinal;
    private final List<String> rowLines = new ArrayList<>();
    private final List<String> cellLines = new ArrayList<>();
    private boolean copying;

    Session(int ordinal) {
      this.ordinal = ordinal;
    }

    @Override
    public BufferedCopyLineStream openCopy(String copySql, int highWaterMark) {
      if (copying) throw new IllegalStateException("copy already in progress");
      copying = true;
      List<String> sink = copySql.contains("data_row") ? rowLines : cellLines;
      boolean rows = sink == rowLines;
      return new BufferedCopyLineStream(highWaterMark) {
        @Override
        protected void flushChunk(byte[] chunk, int length) {
          drains.incrementAndGet();
          String text = new String(chunk, 0, length, StandardCharsets.UTF_8);
          for (String line : text.split("\n")) sink.add(line);
        }

        @Override
        protected long completeCopy() {
          copying = false;
          if (rows && failSession.test(ordinal)) throw new IllegalStateException("copy failed in session " + ordinal);
          return sink.size();
        }

        @Override
        protected void abortCopy() {
          copying = false;
        }
      };
    }

    @Override
    public void commit() {
      if (holdMillis > 0) {
        try {
          Thread.sleep(holdMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      committedRowLines.addAll(rowLines);
      committedCellLines.addAll(cellLines);
      committedRowsPerSession.add(rowLines.size());
      commits.incrementAndGet();
    }

    @Override
    public void rollback() {
      rowLines.clear();
      cellLines.clear();
      rollbacks.incrementAndGet();
    }

    @Override
    public void close() {
      closes.incrementAndGet();
      open.decrementAndGet();
    }
  }
}
