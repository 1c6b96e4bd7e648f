package io.intellixity.tabula.server.service;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.governance.GovernedTableAccess;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.patch.ViewConfigPatcher;
import io.intellixity.tabula.store.TableStore;
import io.intellixity.tabula.store.ViewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Named views of a table and their version-checked configuration updates.\n
 *
 * A patch batch is applied to the stored configuration only when the caller's version still matches;
 * the write and the version bump happen in one compare-and-set statement.\n
 */
@Service
public final class ViewService {
  private static final Logger log = LoggerFactory.getLogger(ViewService.class);
  static final int MAX_NAME_LENGTH = 100;

  private final GovernedTableAccess access;
  private final TableStore tables;
  private final ViewStore views;

  public ViewService(GovernedTableAccess access, TableStore tables, ViewStore views) {
    this.access = access;
    this.tables = tables;
    this.views = views;
  }

  public List<ViewRecord> listViews(String tableId) {
    access.requireOwnedTable(tableId);
    return views.listByTable(tableId);
  }

  public ViewRecord createView(String tableId, String name) {
    String n = validName(name);
    access.requireOwnedTable(tableId);
    ViewRecord v = views.create(tableId, n, ViewConfig.allVisible(tables.listColumns(tableId)));
    log.info("tabula.view created id={} tableId={}", v.id(), tableId);
    return v;
  }

  /** The table's "Grid view", created with every column visible when missing. */
  public ViewRecord ensureDefaultView(String tableId) {
    access.requireOwnedTable(tableId);
    Optional<ViewRecord> existing = views.listByTable(tableId).stream().filter(ViewRecord::isDefault).findFirst();
    if (existing.isPresent()) return existing.get();
    ViewRecord v = views.create(tableId, ViewRecord.DEFAULT_VIEW_NAME, ViewConfig.allVisible(tables.listColumns(tableId)));
    log.info("tabula.view created default id={} tableId={}", v.id(), tableId);
    return v;
  }

  public void deleteView(String viewId) {
    ViewRecord v = access.requireOwnedView(viewId);
    if (v.isDefault()) throw new ValidationException("The default view cannot be deleted");
    views.delete(viewId);
    log.info("tabula.view deleted id={} tableId={}", viewId, v.tableId());
  }

  public ViewPatchResult applyViewPatches(String viewId, int version, List<Patch> patches) {
    ViewRecord current = access.requireOwnedView(viewId);
    if (current.version() != version) {
      throw conflict(viewId, version, current.version());
    }
    ViewConfig next = ViewConfigPatcher.apply(current.config(), patches == null ? List.of() : patches);
    ViewRecord updated = views.compareAndSet(viewId, version, next)
        .orElseThrow(() -> views.find(viewId)
            .<RuntimeException>map(v -> conflict(viewId, version, v.version()))
            .orElseGet(() -> new NotFoundException("view", viewId)));
    if (log.isDebugEnabled()) {
      log.debug("tabula.view patched id={} patches={} version={}", viewId, patches == null ? 0 : patches.size(), updated.version());
    }
    return ViewPatchResult.of(updated);
  }

  private static VersionConflictException conflict(String viewId, int expected, int actual) {
    log.info("tabula.view conflict id={} expected={} actual={}", viewId, expected, actual);
    return new VersionConflictException(viewId, expected, actual);
  }

  static String validName(String name) {
    String n = (name == null) ? "" : name.trim();
    if (n.isEmpty() || n.length() > MAX_NAME_LENGTH) {
      throw new ValidationException("View name must be 1 to " + MAX_NAME_LENGTH + " characters");
    }
    return n;
  }
}
