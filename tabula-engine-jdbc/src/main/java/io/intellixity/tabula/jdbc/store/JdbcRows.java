package io.intellixity.tabula.jdbc.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.tabula.model.Cell;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.TabulaJson;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/** ResultSet mappers and JSON column codecs shared by the JDBC stores. */
final class JdbcRows {
  private static final TypeReference<LinkedHashMap<String, Object>> CACHE = new TypeReference<>() {};

  private JdbcRows() {}

  static final String TABLE_COLS = "id, owner_id, name, created_at";
  static final String COLUMN_COLS = "id, table_id, name, type, created_at";
  static final String ROW_COLS = "r.id, r.table_id, r.cache, r.search, r.created_at";
  static final String CELL_COLS = "id, row_id, column_id, v_text, v_number, created_at, updated_at";
  static final String VIEW_COLS = "id, table_id, name, filters, sort, columns, search, version, created_at, updated_at";

  static Instant instant(ResultSet rs, String col) throws SQLException {
    OffsetDateTime t = rs.getObject(col, OffsetDateTime.class);
    return (t == null) ? null : t.toInstant();
  }

  static TableRef table(ResultSet rs) throws SQLException {
    return new TableRef(rs.getString("id"), rs.getString("owner_id"), rs.getString("name"), instant(rs, "created_at"));
  }

  static Column column(ResultSet rs) throws SQLException {
    return new Column(rs.getString("id"), rs.getString("table_id"), rs.getString("name"),
        ColumnType.valueOf(rs.getString("type")), instant(rs, "created_at"));
  }

  static Row row(ResultSet rs) throws SQLException {
    return new Row(rs.getString("id"), rs.getString("table_id"), readCache(rs.getString("cache")),
        rs.getString("search"), instant(rs, "created_at"));
  }

  static Cell cell(ResultSet rs) throws SQLException {
    double n = rs.getDouble("v_number");
    Double number = rs.wasNull() ? null : n;
    return new Cell(rs.getString("id"), rs.getString("row_id"), rs.getString("column_id"),
        rs.getString("v_text"), number, instant(rs, "created_at"), instant(rs, "updated_at"));
  }

  static ViewRecord view(ResultSet rs) throws SQLException {
    ViewConfig cfg = new ViewConfig(
        TabulaJson.readFilters(tree(rs.getString("filters"))),
        TabulaJson.readSort(tree(rs.getString("sort"))),
        TabulaJson.readColumns(tree(rs.getString("columns"))),
        rs.getString("search"));
    return new ViewRecord(rs.getString("id"), rs.getString("table_id"), rs.getString("name"), cfg,
        rs.getInt("version"), instant(rs, "created_at"), instant(rs, "updated_at"));
  }

  static String json(Object value) {
    try {
      return TabulaJson.mapper().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot encode JSON column", e);
    }
  }

  static Map<String, Object> readCache(String json) {
    if (json == null || json.isBlank()) return Map.of();
    try {
      return TabulaJson.mapper().readValue(json, CACHE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt row cache", e);
    }
  }

  private static JsonNode tree(String json) {
    if (json == null) return null;
    try {
      return TabulaJson.mapper().readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt view configuration", e);
    }
  }
}
