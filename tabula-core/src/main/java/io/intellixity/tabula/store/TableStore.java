package io.intellixity.tabula.store;

import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;

import java.util.List;
import java.util.Optional;

/** Table and column metadata. Implementations do not check ownership; see the governance module. */
public interface TableStore {
  Optional<TableRef> findTable(String tableId);

  List<TableRef> listTablesByOwner(String ownerId);

  TableRef createTable(String ownerId, String name);

  void renameTable(String tableId, String name);

  /** Removes the table with its columns, rows, cells and views. */
  void deleteTable(String tableId);

  /** Columns in creation order. */
  List<Column> listColumns(String tableId);

  Optional<Column> findColumn(String columnId);

  Column addColumn(String tableId, String name, ColumnType type);

  /** Removes the column and its cells. Row caches keep the stale key until the row is rewritten. */
  void deleteColumn(String columnId);
}
