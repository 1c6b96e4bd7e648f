package io.intellixity.tabula.sync;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory view server. Versions are checked like the real compare-and-set; forced conflicts
 * simulate another writer advancing the version first.
 */
final class FakeViewSyncClient implements ViewSyncClient {
  record Apply(String viewId, int version, List<Patch> patches) {}

  final List<Apply> applies = new ArrayList<>();
  final Map<String, ViewRecord> views = new LinkedHashMap<>();
  final Deque<Runnable> held = new ArrayDeque<>();
  CompletableFuture<ViewRecord> pendingCreate;
  int listCalls;
  int forcedConflicts;
  RuntimeException failNextApply;
  boolean hold;

  ViewRecord addView(String id, String name, int version) {
    ViewRecord r = new ViewRecord(id, "t1", name, ViewConfig.empty(), version, Instant.EPOCH, Instant.EPOCH);
    views.put(id, r);
    return r;
  }

  int serverVersion(String id) {
    return views.get(id).version();
  }

  void bump(String id) {
    ViewRecord r = views.get(id);
    views.put(id, new ViewRecord(r.id(), r.tableId(), r.name(), r.config(), r.version() + 1, r.createdAt(), Instant.EPOCH));
  }

  void releaseNext() {
    held.removeFirst().run();
  }

  @Override
  public CompletableFuture<AppliedPatches> applyPatches(String viewId, int version, List<Patch> patches) {
    applies.add(new Apply(viewId, version, List.copyOf(patches)));
    if (failNextApply != null) {
      RuntimeException e = failNextApply;
      failNextApply = null;
      return CompletableFuture.failedFuture(e);
    }
    if (!views.containsKey(viewId)) return CompletableFuture.failedFuture(new NotFoundException("view", viewId));
    if (forcedConflicts > 0) {
      forcedConflicts--;
      bump(viewId);
      return CompletableFuture.failedFuture(new VersionConflictException(viewId, version, serverVersion(viewId)));
    }
    if (version != serverVersion(viewId)) {
      return CompletableFuture.failedFuture(new VersionConflictException(viewId, version, serverVersion(viewId)));
    }
    bump(viewId);
    AppliedPatches result = new AppliedPatches(viewId, serverVersion(viewId), ViewConfig.empty());
    if (!hold) return CompletableFuture.completedFuture(result);
    CompletableFuture<AppliedPatches> f = new CompletableFuture<>();
    held.addLast(() -> f.complete(result));
    return f;
  }

  @Override
  public CompletableFuture<List<ViewRecord>> listViews(String tableId) {
    listCalls++;
    return CompletableFuture.completedFuture(List.copyOf(views.values()));
  }

  @Override
  public CompletableFuture<ViewRecord> createView(String tableId, String name) {
    pendingCreate = new CompletableFuture<>();
    return pendingCreate;
  }

  @Override
  public CompletableFuture<Void> deleteView(String viewId) {
    ViewRecord r = views.get(viewId);
    if (r == null) return CompletableFuture.failedFuture(new NotFoundException("view", viewId));
    if (r.isDefault()) return CompletableFuture.failedFuture(new ValidationException("Cannot delete the default view"));
    views.remove(viewId);
    return CompletableFuture.completedFuture(null);
  }
}
