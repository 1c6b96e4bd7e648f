package io.intellixity.tabula.ingest;

import io.intellixity.tabula.error.TabulaException;

import java.util.List;

/**
 * One or more batches failed. Committed batches stay; {@link #rowsCommitted()} tells how many rows
 * were durably added before the pipeline stopped claiming new batches.\n
 */
public final class BulkIngestionException extends TabulaException {
  private final int rowsCommitted;
  private final List<Integer> failedBatches;

  public BulkIngestionException(String tableId, int rowsCommitted, List<Integer> failedBatches, Throwable cause) {
    super("Bulk ingestion into table " + tableId + " failed after " + rowsCommitted
        + " rows; failed batches=" + failedBatches, cause);
    this.rowsCommitted = rowsCommitted;
    this.failedBatches = List.copyOf(failedBatches);
  }

  public int rowsCommitted() { return rowsCommitted; }
  public List<Integer> failedBatches() { return failedBatches; }

  /** Re-running the remaining count is safe: row ids are fresh on every call. */
  @Override public boolean retryable() { return false; }
}
