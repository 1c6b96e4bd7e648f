package io.intellixity.tabula.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tabula.ingest.copy.BufferedCopyLineStream;
import io.intellixity.tabula.ingest.copy.CopyLineEncoder;
import io.intellixity.tabula.ingest.copy.CopySession;
import io.intellixity.tabula.ingest.copy.CopySessionFactory;
import io.intellixity.tabula.ingest.copy.CopyTargets;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.patch.TabulaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes one batch of synthetic rows and their cells in a single copy transaction.\n
 *
 * <p>The row relation is streamed first, then the cell relation; cell values are regenerated from
 * the batch seed. Any failure rolls the whole batch back and propagates.</p>
 */
public final class StreamingRowWriter {
  private static final Logger log = LoggerFactory.getLogger(StreamingRowWriter.class);

  private final CopySessionFactory sessions;
  private final int copyBufferBytes;
  private final ObjectMapper json;

  public StreamingRowWriter(CopySessionFactory sessions, int copyBufferBytes) {
    this(sessions, copyBufferBytes, TabulaJson.mapper());
  }

  public StreamingRowWriter(CopySessionFactory sessions, int copyBufferBytes, ObjectMapper json) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    if (copyBufferBytes <= 0) throw new IllegalArgumentException("copyBufferBytes must be > 0");
    this.copyBufferBytes = copyBufferBytes;
    this.json = Objects.requireNonNull(json, "json");
  }

  /** Returns the number of rows committed (always {@code size}). */
  public int writeBatch(String tableId, List<Column> columns, int size, long seed) {
    Objects.requireNonNull(tableId, "tableId");
    Objects.requireNonNull(columns, "columns");
    if (size <= 0) return 0;

    SyntheticRows rows = new SyntheticRows(columns, seed, size);
    long t0 = System.nanoTime();
    CopySession session = sessions.begin();
    try {
      long rowCount = copyRows(session, tableId, rows);
      long cellCount = columns.isEmpty() ? 0 : copyCells(session, rows);
      session.commit();
      if (log.isDebugEnabled()) {
        log.debug("tabula.ingest.writer tableId={} rows={} cells={} durationMs={}",
            tableId, rowCount, cellCount, (System.nanoTime() - t0) / 1_000_000);
      }
      return size;
    } catch (RuntimeException | Error e) {
      try {
        session.rollback();
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      throw e;
    } finally {
      session.close();
    }
  }

  private long copyRows(CopySession session, String tableId, SyntheticRows rows) {
    List<Column> columns = rows.columns();
    try (BufferedCopyLineStream out = session.openCopy(CopyTargets.ROWS, copyBufferBytes)) {
      for (SyntheticRows.Generated g : rows) {
        Map<String, Object> cache = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) cache.put(columns.get(i).id(), g.values().get(i));
        emit(out, CopyLineEncoder.line(g.rowId(), tableId, toJson(cache), g.search()));
      }
      return out.finish();
    }
  }

  private long copyCells(CopySession session, SyntheticRows rows) {
    List<Column> columns = rows.columns();
    try (BufferedCopyLineStream out = session.openCopy(CopyTargets.CELLS, copyBufferBytes)) {
      for (SyntheticRows.Generated g : rows) {
        for (int i = 0; i < columns.size(); i++) {
          Column c = columns.get(i);
          Object v = g.values().get(i);
          boolean text = c.type() == ColumnType.TEXT;
          emit(out, CopyLineEncoder.line(g.cellIds().get(i), g.rowId(), c.id(), text ? v : null, text ? null : v));
        }
      }
      return out.finish();
    }
  }

  private static void emit(BufferedCopyLineStream out, String line) {
    if (!out.write(line)) out.awaitDrain();
  }

  private String toJson(Map<String, Object> cache) {
    try {
      return json.writeValueAsString(cache);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot encode row cache", e);
    }
  }
}
