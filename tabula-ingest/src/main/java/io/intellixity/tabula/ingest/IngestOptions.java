package io.intellixity.tabula.ingest;

/**
 * Tuning for bulk ingestion.\n
 *
 * @param batchSize rows per batch transaction
 * @param maxConcurrency upper bound on parallel batch workers (each holds one connection)
 * @param copyBufferBytes high-water mark of each copy stream buffer
 */
public record IngestOptions(int batchSize, int maxConcurrency, int copyBufferBytes) {
  public static final int MAX_ROWS_PER_REQUEST = 100_000;

  public IngestOptions {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (maxConcurrency <= 0) throw new IllegalArgumentException("maxConcurrency must be > 0");
    if (copyBufferBytes <= 0) throw new IllegalArgumentException("copyBufferBytes must be > 0");
  }

  public static IngestOptions defaults() {
    return new IngestOptions(35_000, 2, 1 << 20);
  }
}
