package io.intellixity.tabula.server.web;

import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.server.service.ViewPatchResult;
import io.intellixity.tabula.server.service.ViewService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public final class ViewController {
  private final ViewService views;

  public ViewController(ViewService views) {
    this.views = views;
  }

  public record CreateViewRequest(String name) {}

  public record ApplyPatchesRequest(int version, List<Patch> patches) {}

  @GetMapping("/tables/{id}/views")
  public List<ViewRecord> list(@PathVariable("id") String tableId) {
    views.ensureDefaultView(tableId);
    return views.listViews(tableId);
  }

  @PostMapping("/tables/{id}/views")
  public ResponseEntity<ViewRecord> create(@PathVariable("id") String tableId, @RequestBody CreateViewRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(views.createView(tableId, req.name));
  }

  @PostMapping("/views/{id}/patches")
  public ViewPatchResult applyPatches(@PathVariable("id") String viewId, @RequestBody ApplyPatchesRequest req) {
    return views.applyViewPatches(viewId, req.version, req.patches);
  }

  @DeleteMapping("/views/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String viewId) {
    views.deleteView(viewId);
    return ResponseEntity.noContent().build();
  }
}
