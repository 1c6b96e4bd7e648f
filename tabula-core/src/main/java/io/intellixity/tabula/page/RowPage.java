package io.intellixity.tabula.page;

import io.intellixity.tabula.model.Row;

import java.util.List;

/** {@code nextCursor} is null exactly when {@code hasMore} is false. */
public record RowPage(List<Row> rows, String nextCursor, boolean hasMore, long totalCount) {
  public RowPage {
    rows = List.copyOf(rows == null ? List.of() : rows);
  }
}
