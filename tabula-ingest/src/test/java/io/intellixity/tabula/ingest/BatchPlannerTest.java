package io.intellixity.tabula.ingest;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BatchPlannerTest {
  @Test
  void splitsIntoFixedBatchesWithRemainder() {
    BatchPlanner.Plan p = BatchPlanner.plan(70_001, 35_000, 2);

    assertEquals(List.of(35_000, 35_000, 1), p.batches().stream().map(BatchPlanner.Batch::size).toList());
    assertEquals(List.of(0, 1, 2), p.batches().stream().map(BatchPlanner.Batch::index).toList());
    assertEquals(2, p.workers());
    assertEquals(70_001, p.totalRows());
  }

  @Test
  void workersNeverExceedBatchCount() {
    BatchPlanner.Plan p = BatchPlanner.plan(10, 35_000, 4);

    assertEquals(1, p.batches().size());
    assertEquals(1, p.workers());
  }

  @Test
  void zeroCount_hasNoBatches() {
    BatchPlanner.Plan p = BatchPlanner.plan(0, 100, 3);

    assertTrue(p.batches().isEmpty());
    assertEquals(0, p.workers());
  }

  @Test
  void exactMultiple_hasNoRemainderBatch() {
    assertEquals(4, BatchPlanner.plan(400, 100, 2).batches().size());
  }

  @Test
  void rejectsNonPositiveSizing() {
    assertThrows(IllegalArgumentException.class, () -> BatchPlanner.plan(10, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> BatchPlanner.plan(10, 5, 0));
    assertThrows(IllegalArgumentException.class, () -> BatchPlanner.plan(-1, 5, 1));
  }
}
