package io.intellixity.tabula.server.web;

import io.intellixity.tabula.ingest.IngestionResult;
import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.page.RowPage;
import io.intellixity.tabula.server.service.RowIngestionService;
import io.intellixity.tabula.server.service.RowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public final class RowController {
  private final RowService rows;
  private final RowIngestionService ingestion;

  public RowController(RowService rows, RowIngestionService ingestion) {
    this.rows = rows;
    this.ingestion = ingestion;
  }

  public record AddRowRequest(Map<String, Object> values) {}

  public record BulkRowsRequest(int count) {}

  public record UpdateCellRequest(String rowId, String columnId, Object value) {}

  @GetMapping("/tables/{id}/rows")
  public RowPage page(@PathVariable("id") String tableId,
                      @RequestParam(name = "cursor", required = false) String cursor,
                      @RequestParam(name = "limit", required = false) Integer limit,
                      @RequestParam(name = "viewId", required = false) String viewId,
                      @RequestParam(name = "search", required = false) String search) {
    return rows.getRows(tableId, cursor, limit, viewId, search);
  }

  @GetMapping("/tables/{id}/rows/count")
  public long count(@PathVariable("id") String tableId,
                    @RequestParam(name = "viewId", required = false) String viewId,
                    @RequestParam(name = "search", required = false) String search) {
    return rows.rowCount(tableId, viewId, search);
  }

  @PostMapping("/tables/{id}/rows")
  public ResponseEntity<Row> add(@PathVariable("id") String tableId, @RequestBody(required = false) AddRowRequest req) {
    Row r = rows.addRow(tableId, req == null ? null : req.values);
    return ResponseEntity.status(HttpStatus.CREATED).body(r);
  }

  @PostMapping("/tables/{id}/rows/bulk")
  public IngestionResult bulk(@PathVariable("id") String tableId, @RequestBody BulkRowsRequest req) {
    return ingestion.ingestRows(tableId, req.count);
  }

  @PutMapping("/cells")
  public Row updateCell(@RequestBody UpdateCellRequest req) {
    return rows.updateCell(req.rowId, req.columnId, req.value);
  }

  @DeleteMapping("/rows/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String rowId) {
    rows.deleteRow(rowId);
    return ResponseEntity.noContent().build();
  }
}
