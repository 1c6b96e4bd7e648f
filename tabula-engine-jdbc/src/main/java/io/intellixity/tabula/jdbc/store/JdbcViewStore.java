package io.intellixity.tabula.jdbc.store;

import io.intellixity.tabula.jdbc.Bind;
import io.intellixity.tabula.jdbc.JdbcExecutor;
import io.intellixity.tabula.jdbc.NamedSql;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.store.ViewStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * View records with a version-checked update.\n
 *
 * The compare-and-set is a single {@code UPDATE ... WHERE id = ? AND version = ? RETURNING}, so the
 * database serializes concurrent writers and exactly one of them advances the version.\n
 */
public final class JdbcViewStore implements ViewStore {
  private final JdbcExecutor jdbc;

  public JdbcViewStore(JdbcExecutor jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public List<ViewRecord> listByTable(String tableId) {
    return jdbc.query("view.list", NamedSql.query(
        "SELECT " + JdbcRows.VIEW_COLS + " FROM table_view WHERE table_id = :tableId ORDER BY created_at, id",
        Map.of("tableId", Bind.text(tableId))), JdbcRows::view);
  }

  @Override
  public Optional<ViewRecord> find(String viewId) {
    return jdbc.queryOne("view.find", NamedSql.query(
        "SELECT " + JdbcRows.VIEW_COLS + " FROM table_view WHERE id = :id", Map.of("id", Bind.text(viewId))), JdbcRows::view);
  }

  @Override
  public ViewRecord create(String tableId, String name, ViewConfig config) {
    Map<String, Bind> params = configParams(config);
    params.put("id", Bind.text(UUID.randomUUID().toString()));
    params.put("tableId", Bind.text(tableId));
    params.put("name", Bind.text(name));
    params.put("version", Bind.integer(ViewRecord.INITIAL_VERSION));
    return jdbc.queryOne("view.create", NamedSql.query(
        "INSERT INTO table_view (id, table_id, name, filters, sort, columns, search, version)"
            + " VALUES (:id, :tableId, :name, CAST(:filters AS jsonb), CAST(:sort AS jsonb), CAST(:columns AS jsonb), :search, :version)"
            + " RETURNING " + JdbcRows.VIEW_COLS, params), JdbcRows::view).orElseThrow();
  }

  @Override
  public Optional<ViewRecord> compareAndSet(String viewId, int expectedVersion, ViewConfig config) {
    Map<String, Bind> params = configParams(config);
    params.put("id", Bind.text(viewId));
    params.put("expected", Bind.integer(expectedVersion));
    return jdbc.queryOne("view.cas", NamedSql.query(
        "UPDATE table_view SET filters = CAST(:filters AS jsonb), sort = CAST(:sort AS jsonb),"
            + " columns = CAST(:columns AS jsonb), search = :search,"
            + " version = version + 1, updated_at = clock_timestamp()"
            + " WHERE id = :id AND version = :expected"
            + " RETURNING " + JdbcRows.VIEW_COLS, params), JdbcRows::view);
  }

  @Override
  public boolean delete(String viewId) {
    return jdbc.update("view.delete", NamedSql.update("DELETE FROM table_view WHERE id = :id",
        Map.of("id", Bind.text(viewId)))) > 0;
  }

  private static Map<String, Bind> configParams(ViewConfig config) {
    ViewConfig c = (config == null) ? ViewConfig.empty() : config;
    Map<String, Bind> params = new LinkedHashMap<>();
    params.put("filters", Bind.json(JdbcRows.json(c.filters())));
    params.put("sort", Bind.json(JdbcRows.json(c.sort())));
    params.put("columns", Bind.json(JdbcRows.json(c.columns())));
    params.put("search", Bind.text(c.search()));
    return params;
  }
}
