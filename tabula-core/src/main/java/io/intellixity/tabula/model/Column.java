package io.intellixity.tabula.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record Column(String id, String tableId, String name, ColumnType type, Instant createdAt) {
  public Column {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  /** Lower-cased name used by the value heuristics and duplicate-name checks. */
  public String normalizedName() {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
