package io.intellixity.tabula.jdbc.store;

import io.intellixity.tabula.jdbc.Bind;
import io.intellixity.tabula.jdbc.JdbcExecutor;
import io.intellixity.tabula.jdbc.NamedSql;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.store.TableStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class JdbcTableStore implements TableStore {
  private final JdbcExecutor jdbc;

  public JdbcTableStore(JdbcExecutor jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public Optional<TableRef> findTable(String tableId) {
    return jdbc.queryOne("table.find", NamedSql.query(
        "SELECT " + JdbcRows.TABLE_COLS + " FROM data_table WHERE id = :id",
        Map.of("id", Bind.text(tableId))), JdbcRows::table);
  }

  @Override
  public List<TableRef> listTablesByOwner(String ownerId) {
    return jdbc.query("table.list", NamedSql.query(
        "SELECT " + JdbcRows.TABLE_COLS + " FROM data_table WHERE owner_id = :owner ORDER BY created_at, id",
        Map.of("owner", Bind.text(ownerId))), JdbcRows::table);
  }

  @Override
  public TableRef createTable(String ownerId, String name) {
    return jdbc.queryOne("table.create", NamedSql.query(
        "INSERT INTO data_table (id, owner_id, name) VALUES (:id, :owner, :name) RETURNING " + JdbcRows.TABLE_COLS,
        Map.of("id", Bind.text(UUID.randomUUID().toString()), "owner", Bind.text(ownerId), "name", Bind.text(name))),
        JdbcRows::table).orElseThrow();
  }

  @Override
  public void renameTable(String tableId, String name) {
    jdbc.update("table.rename", NamedSql.update("UPDATE data_table SET name = :name WHERE id = :id",
        Map.of("id", Bind.text(tableId), "name", Bind.text(name))));
  }

  @Override
  public void deleteTable(String tableId) {
    jdbc.update("table.delete", NamedSql.update("DELETE FROM data_table WHERE id = :id", Map.of("id", Bind.text(tableId))));
  }

  @Override
  public List<Column> listColumns(String tableId) {
    return jdbc.query("column.list", NamedSql.query(
        "SELECT " + JdbcRows.COLUMN_COLS + " FROM data_column WHERE table_id = :tableId ORDER BY created_at, id",
        Map.of("tableId", Bind.text(tableId))), JdbcRows::column);
  }

  @Override
  public Optional<Column> findColumn(String columnId) {
    return jdbc.queryOne("column.find", NamedSql.query(
        "SELECT " + JdbcRows.COLUMN_COLS + " FROM data_column WHERE id = :id",
        Map.of("id", Bind.text(columnId))), JdbcRows::column);
  }

  @Override
  public Column addColumn(String tableId, String name, ColumnType type) {
    return jdbc.queryOne("column.add", NamedSql.query(
        "INSERT INTO data_column (id, table_id, name, type) VALUES (:id, :tableId, :name, :type) RETURNING " + JdbcRows.COLUMN_COLS,
        Map.of("id", Bind.text(UUID.randomUUID().toString()), "tableId", Bind.text(tableId),
            "name", Bind.text(name), "type", Bind.text(type.name()))),
        JdbcRows::column).orElseThrow();
  }

  @Override
  public void deleteColumn(String columnId) {
    jdbc.update("column.delete", NamedSql.update("DELETE FROM data_column WHERE id = :id", Map.of("id", Bind.text(columnId))));
  }
}
