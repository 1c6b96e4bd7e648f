package io.intellixity.tabula.governance;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.governance.internal.LruTtlCache;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.store.RowStore;
import io.intellixity.tabula.store.TableStore;
import io.intellixity.tabula.store.ViewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Ownership guard over the store ports.\n
 *
 * Every lookup resolves the owning table and compares its owner with the user bound by
 * {@link Governance}. Missing and foreign entities both surface as {@link NotFoundException}.
 * Table metadata is cached by table id; owners never change so only deletion invalidates.\n
 */
public final class GovernedTableAccess {
  private static final Logger log = LoggerFactory.getLogger(GovernedTableAccess.class);

  private final TableStore tables;
  private final ViewStore views;
  private final RowStore rows;
  private final LruTtlCache<String, TableRef> tableCache;

  public GovernedTableAccess(TableStore tables, ViewStore views, RowStore rows, LruTtlCache<String, TableRef> tableCache) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.views = Objects.requireNonNull(views, "views");
    this.rows = Objects.requireNonNull(rows, "rows");
    this.tableCache = Objects.requireNonNull(tableCache, "tableCache");
  }

  public String currentUser() {
    return Governance.currentOrThrow().userId();
  }

  public List<TableRef> ownedTables() {
    return tables.listTablesByOwner(currentUser());
  }

  public TableRef requireOwnedTable(String tableId) {
    Objects.requireNonNull(tableId, "tableId");
    String user = currentUser();
    TableRef t = tableCache.getOrLoad(tableId, () -> tables.findTable(tableId).orElse(null));
    if (t == null || !t.ownerId().equals(user)) {
      if (t != null && log.isDebugEnabled()) {
        log.debug("tabula.governance denied kind=table id={} user={}", tableId, user);
      }
      throw new NotFoundException("table", tableId);
    }
    return t;
  }

  public ViewRecord requireOwnedView(String viewId) {
    ViewRecord v = views.find(viewId).orElseThrow(() -> new NotFoundException("view", viewId));
    ownedOr(v.tableId(), "view", viewId);
    return v;
  }

  public Row requireOwnedRow(String rowId) {
    Row r = rows.findRow(rowId).orElseThrow(() -> new NotFoundException("row", rowId));
    ownedOr(r.tableId(), "row", rowId);
    return r;
  }

  public Column requireOwnedColumn(String columnId) {
    Column c = tables.findColumn(columnId).orElseThrow(() -> new NotFoundException("column", columnId));
    ownedOr(c.tableId(), "column", columnId);
    return c;
  }

  /** Drop cached metadata after the table was deleted. */
  public void forget(String tableId) {
    tableCache.invalidate(tableId);
  }

  private void ownedOr(String tableId, String kind, String id) {
    try {
      requireOwnedTable(tableId);
    } catch (NotFoundException e) {
      throw new NotFoundException(kind, id);
    }
  }
}
