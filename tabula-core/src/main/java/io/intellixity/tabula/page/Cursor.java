package io.intellixity.tabula.page;

import io.intellixity.tabula.model.Row;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/** Keyset position: the {@code (createdAt, id)} pair of the last row served. */
public record Cursor(long createdAtMicros, String id) implements Comparable<Cursor> {
  public Cursor {
    Objects.requireNonNull(id, "id");
  }

  public static Cursor of(Row row) {
    return new Cursor(toMicros(row.createdAt()), row.id());
  }

  public Instant createdAt() {
    return Instant.EPOCH.plus(createdAtMicros, ChronoUnit.MICROS);
  }

  public static long toMicros(Instant t) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, t);
  }

  @Override
  public int compareTo(Cursor o) {
    int c = Long.compare(createdAtMicros, o.createdAtMicros);
    return (c != 0) ? c : id.compareTo(o.id);
  }
}
