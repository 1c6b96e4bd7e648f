package io.intellixity.tabula.ingest;

public record IngestionResult(boolean success, int rowsAdded) {
  public static IngestionResult added(int rows) {
    return new IngestionResult(true, rows);
  }
}
