package io.intellixity.tabula.ingest;

/** Progress callbacks; invoked from worker threads. */
public interface IngestionListener {
  IngestionListener NONE = new IngestionListener() {};

  default void onBatchCommitted(BatchPlanner.Batch batch, int rowsCommitted, int totalRows) {}

  default void onBatchFailed(BatchPlanner.Batch batch, Throwable cause) {}
}
