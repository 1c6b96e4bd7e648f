package io.intellixity.tabula.jdbc.store;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.jdbc.Bind;
import io.intellixity.tabula.jdbc.JdbcExecutor;
import io.intellixity.tabula.jdbc.NamedSql;
import io.intellixity.tabula.jdbc.SqlStatement;
import io.intellixity.tabula.jdbc.render.KeysetPredicate;
import io.intellixity.tabula.jdbc.render.RenderCtx;
import io.intellixity.tabula.jdbc.render.RowFilterSqlRenderer;
import io.intellixity.tabula.model.Cell;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.page.Cursor;
import io.intellixity.tabula.store.RowFilter;
import io.intellixity.tabula.store.RowStore;
import io.intellixity.tabula.store.TableStore;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Row and cell access.\n
 *
 * Range reads are keyset-only: {@code ORDER BY created_at, id} with a strict tuple predicate, never
 * OFFSET. The {@code (table_id, created_at, id)} index serves both the predicate and the order.\n
 *
 * Row writes that touch cells run in one transaction; cell edits hold the row lock while the cache
 * is merged.\n
 */
public final class JdbcRowStore implements RowStore {
  private static final List<String> KEYSET = List.of("r.created_at", "r.id");

  private final JdbcExecutor jdbc;
  private final TableStore tables;
  private final RowFilterSqlRenderer filters = new RowFilterSqlRenderer("r");

  public JdbcRowStore(JdbcExecutor jdbc, TableStore tables) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public List<Row> rangeAfter(String tableId, Cursor after, int limit, RowFilter filter) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    Map<String, Bind> params = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(JdbcRows.ROW_COLS).append(" FROM data_row r");
    appendWhere(sql, params, tableId, after, filter);
    sql.append(" ORDER BY r.created_at, r.id LIMIT :limit");
    params.put("limit", Bind.integer(limit));
    return jdbc.query("row.range", NamedSql.query(sql.toString(), params), JdbcRows::row);
  }

  @Override
  public long count(String tableId, RowFilter filter) {
    return countAfter(tableId, null, filter);
  }

  @Override
  public long countAfter(String tableId, Cursor after, RowFilter filter) {
    Map<String, Bind> params = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder("SELECT COUNT(1) FROM data_row r");
    appendWhere(sql, params, tableId, after, filter);
    return jdbc.queryLong(after == null ? "row.count" : "row.count_after", NamedSql.query(sql.toString(), params));
  }

  private void appendWhere(StringBuilder sql, Map<String, Bind> params, String tableId, Cursor after, RowFilter filter) {
    sql.append(" WHERE r.table_id = :tableId");
    params.put("tableId", Bind.text(tableId));

    RenderCtx ctx = new RenderCtx("p");
    RowFilter f = (filter == null) ? RowFilter.none() : filter;
    String predicate = filters.render(f, f.filters().isEmpty() ? Map.of() : columnTypes(tableId), ctx);
    if (!predicate.isEmpty()) sql.append(" AND ").append(predicate);
    if (after != null) {
      sql.append(" AND ").append(KeysetPredicate.after(KEYSET,
          List.of(Bind.timestamp(after.createdAt()), Bind.text(after.id())), ctx));
    }
    params.putAll(ctx.params());
  }

  private Map<String, ColumnType> columnTypes(String tableId) {
    Map<String, ColumnType> out = new HashMap<>();
    for (Column c : tables.listColumns(tableId)) out.put(c.id(), c.type());
    return out;
  }

  @Override
  public Optional<Row> findRow(String rowId) {
    return jdbc.queryOne("row.find", NamedSql.query(
        "SELECT " + JdbcRows.ROW_COLS + " FROM data_row r WHERE r.id = :id", Map.of("id", Bind.text(rowId))), JdbcRows::row);
  }

  @Override
  public Row addRow(String tableId, List<Cell> cells, Map<String, Object> cache, String search) {
    return jdbc.inTx(() -> {
      SqlStatement ss = NamedSql.query(
          "INSERT INTO data_row AS r (id, table_id, cache, search) VALUES (:id, :tableId, CAST(:cache AS jsonb), :search)"
              + " RETURNING " + JdbcRows.ROW_COLS,
          Map.of("id", Bind.text(UUID.randomUUID().toString()), "tableId", Bind.text(tableId),
              "cache", Bind.json(JdbcRows.json(cache == null ? Map.of() : cache)),
              "search", Bind.text(search == null ? "" : search)));
      Row row = jdbc.queryOne("row.add", ss, JdbcRows::row).orElseThrow();
      if (cells != null) {
        for (Cell c : cells) {
          upsert(new Cell(null, row.id(), c.columnId(), c.text(), c.number(), null, null));
        }
      }
      return row;
    });
  }

  @Override
  public void deleteRow(String rowId) {
    jdbc.update("row.delete", NamedSql.update("DELETE FROM data_row WHERE id = :id", Map.of("id", Bind.text(rowId))));
  }

  @Override
  public List<Cell> listCells(String rowId) {
    return jdbc.query("cell.list", NamedSql.query(
        "SELECT " + JdbcRows.CELL_COLS + " FROM data_cell WHERE row_id = :rowId", Map.of("rowId", Bind.text(rowId))),
        JdbcRows::cell);
  }

  @Override
  public Row writeCell(Cell cell, Function<Map<String, Object>, String> searchOf) {
    Objects.requireNonNull(searchOf, "searchOf");
    return jdbc.inTx(() -> {
      Row locked = jdbc.queryOne("row.lock", NamedSql.query(
              "SELECT " + JdbcRows.ROW_COLS + " FROM data_row r WHERE r.id = :id FOR UPDATE",
              Map.of("id", Bind.text(cell.rowId()))), JdbcRows::row)
          .orElseThrow(() -> new NotFoundException("row", cell.rowId()));
      Cell stored = upsert(cell);

      Map<String, Object> cache = new LinkedHashMap<>(locked.cache());
      cache.put(stored.columnId(), stored.value());
      String search = searchOf.apply(cache);
      jdbc.update("row.cache", NamedSql.update(
          "UPDATE data_row SET cache = CAST(:cache AS jsonb), search = :search, updated_at = clock_timestamp() WHERE id = :id",
          Map.of("id", Bind.text(locked.id()), "cache", Bind.json(JdbcRows.json(cache)), "search", Bind.text(search))));
      return new Row(locked.id(), locked.tableId(), cache, search, locked.createdAt());
    });
  }

  private Cell upsert(Cell cell) {
    SqlStatement ss = NamedSql.query(
        "INSERT INTO data_cell (id, row_id, column_id, v_text, v_number) VALUES (:id, :rowId, :columnId, :text, :number)"
            + " ON CONFLICT (row_id, column_id) DO UPDATE SET v_text = EXCLUDED.v_text, v_number = EXCLUDED.v_number,"
            + " updated_at = clock_timestamp()"
            + " RETURNING " + JdbcRows.CELL_COLS,
        Map.of("id", Bind.text(cell.id() == null ? UUID.randomUUID().toString() : cell.id()),
            "rowId", Bind.text(cell.rowId()), "columnId", Bind.text(cell.columnId()),
            "text", Bind.text(cell.text()), "number", Bind.number(cell.number())));
    return jdbc.queryOne("cell.upsert", ss, JdbcRows::cell).orElseThrow();
  }
}
