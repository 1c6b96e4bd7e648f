package io.intellixity.tabula.store;

import io.intellixity.tabula.model.Cell;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.page.Cursor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public interface RowStore {
  /**
   * Keyset range read.\n
   *
   * Returns at most {@code limit} rows of the table ordered by {@code (createdAt, id)} ascending,
   * restricted to rows strictly after {@code after} when it is non-null.
   */
  List<Row> rangeAfter(String tableId, Cursor after, int limit, RowFilter filter);

  long count(String tableId, RowFilter filter);

  /** Rows strictly after {@code after}; equals {@link #count} when {@code after} is null. */
  long countAfter(String tableId, Cursor after, RowFilter filter);

  Optional<Row> findRow(String rowId);

  /**
   * Insert a row together with its cells; either all of it is stored or none of it.\n
   * The cells' row ids are placeholders and are re-keyed to the new row.
   */
  Row addRow(String tableId, List<Cell> cells, Map<String, Object> cache, String search);

  void deleteRow(String rowId);

  List<Cell> listCells(String rowId);

  /**
   * Insert or replace the cell for {@code (rowId, columnId)} and fold its value into the row's cache.\n
   *
   * The row is locked while the cache is merged, so concurrent edits to other columns of the same row
   * are all kept. {@code searchOf} derives the search text from the merged cache.
   *
   * @return the row as written
   */
  Row writeCell(Cell cell, Function<Map<String, Object>, String> searchOf);
}
