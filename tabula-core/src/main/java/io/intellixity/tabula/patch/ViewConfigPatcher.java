package io.intellixity.tabula.patch;

import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.model.ViewConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies patches to a view configuration in client-timestamp order.\n
 *
 * <ul>
 *   <li>{@code set}: full replacement of the addressed field.</li>
 *   <li>{@code merge}: upsert-by-id for {@code filters}; plain replacement for every other path.</li>
 * </ul>
 */
public final class ViewConfigPatcher {
  private ViewConfigPatcher() {}

  public static ViewConfig apply(ViewConfig base, List<Patch> patches) {
    ViewConfig out = (base == null) ? ViewConfig.empty() : base;
    if (patches == null || patches.isEmpty()) return out;

    List<Patch> ordered = new ArrayList<>(patches);
    ordered.sort(Comparator.comparingLong(Patch::timestamp));
    for (Patch p : ordered) {
      out = applyOne(out, p);
    }
    return out;
  }

  private static ViewConfig applyOne(ViewConfig cfg, Patch p) {
    try {
      return switch (p.path()) {
        case FILTERS -> p.op() == PatchOp.MERGE
            ? cfg.withFilters(FilterMerge.upsertById(cfg.filters(), TabulaJson.readFilters(p.value())))
            : cfg.withFilters(TabulaJson.readFilters(p.value()));
        case SORT -> cfg.withSort(TabulaJson.readSort(p.value()));
        case COLUMNS -> cfg.withColumns(TabulaJson.readColumns(p.value()));
        case SEARCH -> cfg.withSearch(TabulaJson.readSearch(p.value()));
      };
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid value for path '" + p.path().wireName() + "': " + e.getMessage());
    }
  }
}
