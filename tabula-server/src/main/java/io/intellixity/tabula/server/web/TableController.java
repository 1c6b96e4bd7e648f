package io.intellixity.tabula.server.web;

import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.server.service.TableService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public final class TableController {
  private final TableService tables;

  public TableController(TableService tables) {
    this.tables = tables;
  }

  public record CreateTableRequest(String name, Boolean withSampleData) {}

  public record RenameTableRequest(String name) {}

  public record AddColumnRequest(String name, ColumnType type) {}

  @GetMapping("/tables")
  public List<TableRef> list() {
    return tables.listTables();
  }

  @PostMapping("/tables")
  public ResponseEntity<TableRef> create(@RequestBody CreateTableRequest req) {
    boolean sample = req.withSampleData == null || req.withSampleData;
    return ResponseEntity.status(HttpStatus.CREATED).body(tables.createTable(req.name, sample));
  }

  @GetMapping("/tables/{id}")
  public TableRef get(@PathVariable("id") String id) {
    return tables.getTable(id);
  }

  @PatchMapping("/tables/{id}")
  public TableRef rename(@PathVariable("id") String id, @RequestBody RenameTableRequest req) {
    return tables.renameTable(id, req.name);
  }

  @DeleteMapping("/tables/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    tables.deleteTable(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/tables/{id}/columns")
  public List<Column> columns(@PathVariable("id") String id) {
    return tables.listColumns(id);
  }

  @PostMapping("/tables/{id}/columns")
  public ResponseEntity<Column> addColumn(@PathVariable("id") String id, @RequestBody AddColumnRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(tables.addColumn(id, req.name, req.type));
  }

  @DeleteMapping("/columns/{id}")
  public ResponseEntity<Void> deleteColumn(@PathVariable("id") String id) {
    tables.deleteColumn(id);
    return ResponseEntity.noContent().build();
  }
}
