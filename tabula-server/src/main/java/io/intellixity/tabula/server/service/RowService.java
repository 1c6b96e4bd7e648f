package io.intellixity.tabula.server.service;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.governance.GovernedTableAccess;
import io.intellixity.tabula.model.Cell;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.page.PaginationEngine;
import io.intellixity.tabula.page.RowPage;
import io.intellixity.tabula.store.RowFilter;
import io.intellixity.tabula.store.RowStore;
import io.intellixity.tabula.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Row reads and single-row edits.\n
 *
 * Every write keeps the row's cache and search text in step with its cells.\n
 */
@Service
public final class RowService {
  private static final Logger log = LoggerFactory.getLogger(RowService.class);
  // Cells are coerced before the row exists and re-keyed once it has an id.
  private static final String UNSAVED_ROW = "";

  private final GovernedTableAccess access;
  private final TableStore tables;
  private final RowStore rows;
  private final PaginationEngine pages;

  public RowService(GovernedTableAccess access, TableStore tables, RowStore rows, PaginationEngine pages) {
    this.access = access;
    this.tables = tables;
    this.rows = rows;
    this.pages = pages;
  }

  /**
   * One page of rows. With {@code viewId} the view's search and filters narrow the rows; a non-null
   * {@code search} replaces the view's search text.
   */
  public RowPage getRows(String tableId, String cursor, Integer limit, String viewId, String search) {
    access.requireOwnedTable(tableId);
    return pages.getPage(tableId, cursor, limit, filterFor(tableId, viewId, search));
  }

  public long rowCount(String tableId, String viewId, String search) {
    access.requireOwnedTable(tableId);
    return pages.count(tableId, filterFor(tableId, viewId, search));
  }

  /** Add a row; {@code values} maps column id to a raw value coerced by the column's type. */
  public Row addRow(String tableId, Map<String, Object> values) {
    access.requireOwnedTable(tableId);
    List<Column> columns = tables.listColumns(tableId);
    Map<String, Column> byId = new HashMap<>();
    for (Column c : columns) byId.put(c.id(), c);

    List<Cell> cells = new ArrayList<>();
    Map<String, Object> cache = new LinkedHashMap<>();
    if (values != null) {
      for (Map.Entry<String, Object> e : values.entrySet()) {
        Column c = byId.get(e.getKey());
        if (c == null) throw new NotFoundException("column", e.getKey());
        Cell cell = Cell.of(null, UNSAVED_ROW, c, e.getValue());
        cells.add(cell);
        cache.put(c.id(), cell.value());
      }
    }
    Row row = rows.addRow(tableId, cells, cache, searchText(columns, cache));
    log.debug("tabula.row added id={} tableId={} cells={}", row.id(), tableId, cells.size());
    return row;
  }

  public void deleteRow(String rowId) {
    Row r = access.requireOwnedRow(rowId);
    rows.deleteRow(rowId);
    log.debug("tabula.row deleted id={} tableId={}", rowId, r.tableId());
  }

  /** Upsert one cell; the store merges it into the row's current cache and search text. */
  public Row updateCell(String rowId, String columnId, Object value) {
    Row row = access.requireOwnedRow(rowId);
    Column column = access.requireOwnedColumn(columnId);
    if (!column.tableId().equals(row.tableId())) throw new NotFoundException("column", columnId);

    List<Column> columns = tables.listColumns(row.tableId());
    Row written = rows.writeCell(Cell.of(null, rowId, column, value), cache -> searchText(columns, cache));
    log.debug("tabula.cell written rowId={} columnId={}", rowId, columnId);
    return written;
  }

  private RowFilter filterFor(String tableId, String viewId, String search) {
    RowFilter base = RowFilter.none();
    if (viewId != null && !viewId.isBlank()) {
      ViewRecord v = access.requireOwnedView(viewId);
      if (!v.tableId().equals(tableId)) throw new NotFoundException("view", viewId);
      base = RowFilter.of(v.config());
    }
    return (search == null) ? base : new RowFilter(search, base.filters());
  }

  /** Non-empty values in column order, space separated and lower-cased. */
  static String searchText(List<Column> columns, Map<String, Object> cache) {
    StringBuilder sb = new StringBuilder();
    for (Column c : columns) {
      String v = display(cache.get(c.id()));
      if (v.isEmpty()) continue;
      if (sb.length() > 0) sb.append(' ');
      sb.append(v);
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }

  /** Whole numbers print without a fraction ({@code 36}, not {@code 36.0}). */
  static String display(Object v) {
    if (v == null) return "";
    if (v instanceof Double d && !d.isInfinite() && d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString(d.longValue());
    }
    return String.valueOf(v);
  }
}
