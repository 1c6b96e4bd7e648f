package io.intellixity.tabula.ingest;

import io.intellixity.tabula.model.Column;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.SplittableRandom;
import java.util.UUID;

/**
 * Deterministic stream of synthetic rows for one batch.\n
 *
 * Every iteration restarts from the same seed and yields the same ids and values, so the row and
 * cell relations can be copied one after the other without holding the batch in memory.\n
 */
final class SyntheticRows implements Iterable<SyntheticRows.Generated> {
  private final List<Column> columns;
  private final List<SyntheticValues.Kind> kinds;
  private final long seed;
  private final int count;

  record Generated(String rowId, List<Object> values, List<String> cellIds) {
    /** Non-null values joined by single spaces, lower-cased. */
    String search() {
      StringBuilder sb = new StringBuilder();
      for (Object v : values) {
        if (v == null) continue;
        if (sb.length() > 0) sb.append(' ');
        sb.append(v);
      }
      return sb.toString().toLowerCase(Locale.ROOT);
    }
  }

  SyntheticRows(List<Column> columns, long seed, int count) {
    this.columns = List.copyOf(columns);
    this.seed = seed;
    this.count = count;
    List<SyntheticValues.Kind> k = new ArrayList<>(columns.size());
    for (Column c : columns) k.add(SyntheticValues.kindOf(c));
    this.kinds = List.copyOf(k);
  }

  List<Column> columns() {
    return columns;
  }

  int count() {
    return count;
  }

  @Override
  public Iterator<Generated> iterator() {
    SplittableRandom rnd = new SplittableRandom(seed);
    return new Iterator<>() {
      private int produced;

      @Override
      public boolean hasNext() {
        return produced < count;
      }

      @Override
      public Generated next() {
        if (!hasNext()) throw new NoSuchElementException();
        produced++;
        String rowId = uuid(rnd);
        List<Object> values = new ArrayList<>(kinds.size());
        List<String> cellIds = new ArrayList<>(kinds.size());
        for (SyntheticValues.Kind kind : kinds) {
          values.add(SyntheticValues.next(kind, rnd));
          cellIds.add(uuid(rnd));
        }
        return new Generated(rowId, values, cellIds);
      }
    };
  }

  /** Random (version 4) UUID drawn from the seeded stream. */
  static String uuid(SplittableRandom rnd) {
    long msb = (rnd.nextLong() & ~0xF000L) | 0x4000L;
    long lsb = (rnd.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(msb, lsb).toString();
  }
}
