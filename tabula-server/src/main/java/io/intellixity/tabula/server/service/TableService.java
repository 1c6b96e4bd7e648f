package io.intellixity.tabula.server.service;

import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.governance.GovernedTableAccess;
import io.intellixity.tabula.ingest.BulkIngestionPipeline;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.store.TableStore;
import io.intellixity.tabula.store.ViewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public final class TableService {
  private static final Logger log = LoggerFactory.getLogger(TableService.class);
  static final int MAX_NAME_LENGTH = 100;
  static final int SAMPLE_ROWS = 10;

  private final GovernedTableAccess access;
  private final TableStore tables;
  private final ViewStore views;
  private final BulkIngestionPipeline pipeline;

  public TableService(GovernedTableAccess access, TableStore tables, ViewStore views, BulkIngestionPipeline pipeline) {
    this.access = access;
    this.tables = tables;
    this.views = views;
    this.pipeline = pipeline;
  }

  public List<TableRef> listTables() {
    return access.ownedTables();
  }

  public TableRef getTable(String tableId) {
    return access.requireOwnedTable(tableId);
  }

  /**
   * Create a table with the Name, Email and Age columns and its default view.\n
   * With {@code withSampleData} the table also receives a few synthetic rows.
   */
  public TableRef createTable(String name, boolean withSampleData) {
    String n = validName("Table", name);
    TableRef t = tables.createTable(access.currentUser(), n);
    List<Column> columns = new ArrayList<>();
    columns.add(tables.addColumn(t.id(), "Name", ColumnType.TEXT));
    columns.add(tables.addColumn(t.id(), "Email", ColumnType.TEXT));
    columns.add(tables.addColumn(t.id(), "Age", ColumnType.NUMBER));
    views.create(t.id(), ViewRecord.DEFAULT_VIEW_NAME, ViewConfig.allVisible(columns));
    log.info("tabula.table created id={} owner={} sample={}", t.id(), t.ownerId(), withSampleData);

    if (withSampleData) pipeline.ingest(t.id(), SAMPLE_ROWS);
    return t;
  }

  public TableRef renameTable(String tableId, String name) {
    String n = validName("Table", name);
    TableRef t = access.requireOwnedTable(tableId);
    tables.renameTable(tableId, n);
    access.forget(tableId);
    return new TableRef(t.id(), t.ownerId(), n, t.createdAt());
  }

  public void deleteTable(String tableId) {
    access.requireOwnedTable(tableId);
    if (access.ownedTables().size() <= 1) {
      throw new ValidationException("Cannot delete the last table");
    }
    tables.deleteTable(tableId);
    access.forget(tableId);
    log.info("tabula.table deleted id={}", tableId);
  }

  public List<Column> listColumns(String tableId) {
    access.requireOwnedTable(tableId);
    return tables.listColumns(tableId);
  }

  /** Existing rows are not rewritten; they read the new column as empty. */
  public Column addColumn(String tableId, String name, ColumnType type) {
    String n = validName("Column", name);
    if (type == null) throw new ValidationException("Column type is required");
    access.requireOwnedTable(tableId);
    String key = n.toLowerCase(Locale.ROOT);
    for (Column c : tables.listColumns(tableId)) {
      if (c.normalizedName().equals(key)) {
        throw new ValidationException("A column named '" + n + "' already exists");
      }
    }
    Column c = tables.addColumn(tableId, n, type);
    log.info("tabula.column added id={} tableId={} type={}", c.id(), tableId, type);
    return c;
  }

  public void deleteColumn(String columnId) {
    Column c = access.requireOwnedColumn(columnId);
    tables.deleteColumn(columnId);
    log.info("tabula.column deleted id={} tableId={}", columnId, c.tableId());
  }

  static String validName(String what, String name) {
    String n = (name == null) ? "" : name.trim();
    if (n.isEmpty() || n.length() > MAX_NAME_LENGTH) {
      throw new ValidationException(what + " name must be 1 to " + MAX_NAME_LENGTH + " characters");
    }
    return n;
  }
}
