package io.intellixity.tabula.ingest;

import java.util.ArrayList;
import java.util.List;

/** Splits a row count into fixed-size batches and bounds the worker count. */
public final class BatchPlanner {
  private BatchPlanner() {}

  public record Batch(int index, int size) {}

  public record Plan(List<Batch> batches, int workers) {
    public Plan {
      batches = List.copyOf(batches);
    }

    public int totalRows() {
      int n = 0;
      for (Batch b : batches) n += b.size();
      return n;
    }
  }

  public static Plan plan(int count, int batchSize, int maxConcurrency) {
    if (count < 0) throw new IllegalArgumentException("count must be >= 0");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (maxConcurrency <= 0) throw new IllegalArgumentException("maxConcurrency must be > 0");

    List<Batch> out = new ArrayList<>((count + batchSize - 1) / batchSize);
    int index = 0;
    for (int start = 0; start < count; start += batchSize) {
      out.add(new Batch(index++, Math.min(batchSize, count - start)));
    }
    return new Plan(out, Math.min(maxConcurrency, out.size()));
  }
}
