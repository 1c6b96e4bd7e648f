package io.intellixity.tabula.ingest;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.store.TableStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class BulkIngestionPipelineTest {
  private static final Instant NOW = Instant.parse("2025-01-29T00:00:00Z");

  private static final class Tables implements TableStore {
    final AtomicInteger calls = new AtomicInteger();
    final List<Column> columns = List.of(
        new Column("c1", "t1", "Name", ColumnType.TEXT, NOW),
        new Column("c2", "t1", "Email", ColumnType.TEXT, NOW),
        new Column("c3", "t1", "Age", ColumnType.NUMBER, NOW));

    @Override public Optional<TableRef> findTable(String tableId) {
      calls.incrementAndGet();
      return "t1".equals(tableId) ? Optional.of(new TableRef("t1", "u1", "People", NOW)) : Optional.empty();
    }
    @Override public List<Column> listColumns(String tableId) {
      calls.incrementAndGet();
      return columns;
    }
    @Override public List<TableRef> listTablesByOwner(String ownerId) { throw new UnsupportedOperationException(); }
    @Override public TableRef createTable(String ownerId, String name) { throw new UnsupportedOperationException(); }
    @Override public void renameTable(String tableId, String name) { throw new UnsupportedOperationException(); }
    @Override public void deleteTable(String tableId) { throw new UnsupportedOperationException(); }
    @Override public Optional<Column> findColumn(String columnId) { throw new UnsupportedOperationException(); }
    @Override public Column addColumn(String tableId, String name, ColumnType type) { throw new UnsupportedOperationException(); }
    @Override public void deleteColumn(String columnId) { throw new UnsupportedOperationException(); }
  }

  private final Tables tables = new Tables();
  private final RecordingCopySessions sessions = new RecordingCopySessions();
  private final AtomicLong seed = new AtomicLong();

  private BulkIngestionPipeline pipeline(int batchSize, int maxConcurrency) {
    return new BulkIngestionPipeline(tables, new StreamingRowWriter(sessions, 64 * 1024),
        new IngestOptions(batchSize, maxConcurrency, 64 * 1024), seed::incrementAndGet);
  }

  @Test
  void splitsIntoBatches_withBoundedConcurrency() {
    sessions.holdMillis = 20;
    List<Integer> committedBatchSizes = Collections.synchronizedList(new ArrayList<>());

    IngestionResult r = pipeline(35_000, 2).ingest("t1", 70_001, new IngestionListener() {
      @Override public void onBatchCommitted(BatchPlanner.Batch batch, int rowsCommitted, int totalRows) {
        committedBatchSizes.add(batch.size());
        assertEquals(70_001, totalRows);
      }
    });

    assertTrue(r.success());
    assertEquals(70_001, r.rowsAdded());
    assertEquals(3, sessions.commits.get());
    assertTrue(sessions.maxOpen.get() <= 2);
    List<Integer> sizes = new ArrayList<>(committedBatchSizes);
    Collections.sort(sizes);
    assertEquals(List.of(1, 35_000, 35_000), sizes);
    assertEquals(70_001, sessions.committedRowLines.size());
    assertEquals(70_001 * 3, sessions.committedCellLines.size());
  }

  @Test
  void zeroCount_succeedsWithoutTouchingStorage() {
    IngestionResult r = pipeline(100, 2).ingest("t1", 0);

    assertTrue(r.success());
    assertEquals(0, r.rowsAdded());
    assertEquals(0, tables.calls.get());
    assertEquals(0, sessions.begun.get());
  }

  @Test
  void countOutOfRange_isValidationError() {
    assertThrows(ValidationException.class, () -> pipeline(100, 2).ingest("t1", 100_001));
    assertThrows(ValidationException.class, () -> pipeline(100, 2).ingest("t1", -1));
    assertEquals(0, sessions.begun.get());
  }

  @Test
  void unknownTable_isNotFound() {
    assertThrows(NotFoundException.class, () -> pipeline(100, 2).ingest("nope", 5));
  }

  @Test
  void failedBatch_keepsCommittedSiblingsAndStopsClaiming() {
    sessions.failSession = n -> n == 2;

    BulkIngestionException e = assertThrows(BulkIngestionException.class, () -> pipeline(100, 1).ingest("t1", 500));

    assertEquals(100, e.rowsCommitted());
    assertEquals(1, e.failedBatches().size());
    assertEquals(2, sessions.begun.get(), "no batch is claimed after a failure");
    assertEquals(1, sessions.rollbacks.get());
    assertEquals(100, sessions.committedRowLines.size());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void repeatedIngestion_neverReusesRowIds() {
    BulkIngestionPipeline p = pipeline(250, 2);
    p.ingest("t1", 1_000);
    p.ingest("t1", 1_000);

    Set<String> ids = new HashSet<>();
    for (String line : sessions.committedRowLines) {
      assertTrue(ids.add(CsvLines.parse(line).get(0)));
    }
    assertEquals(2_000, ids.size());
  }

  @Test
  void interruptedCaller_waitsForInFlightBatchesBeforeReporting() throws Exception {
    sessions.holdMillis = 50;

    Thread.currentThread().interrupt();
    BulkIngestionException e = assertThrows(BulkIngestionException.class, () -> pipeline(100, 2).ingest("t1", 1_000));
    assertTrue(Thread.interrupted(), "interrupt flag is restored");

    int reported = e.rowsCommitted();
    assertEquals(sessions.commits.get() * 100, reported);
    Thread.sleep(200);
    assertEquals(reported, sessions.committedRowLines.size(), "nothing commits after the report");
    assertTrue(reported < 1_000);
    assertInstanceOf(InterruptedException.class, e.getCause());
  }
}
