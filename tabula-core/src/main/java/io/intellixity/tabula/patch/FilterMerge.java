package io.intellixity.tabula.patch;

import io.intellixity.tabula.model.FilterGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upsert-by-id merge for filter groups.\n
 *
 * Only filters have partial-update semantics; sort, columns and search are always replaced.\n
 */
public final class FilterMerge {
  private FilterMerge() {}

  /**
   * Replace groups whose id matches an incoming group (keeping their position) and append new ones.
   * An empty incoming list clears all filters.
   */
  public static List<FilterGroup> upsertById(List<FilterGroup> current, List<FilterGroup> incoming) {
    if (incoming == null || incoming.isEmpty()) return List.of();

    Map<String, FilterGroup> merged = new LinkedHashMap<>();
    if (current != null) {
      for (FilterGroup g : current) merged.put(g.id(), g);
    }
    for (FilterGroup g : incoming) merged.put(g.id(), g);
    return List.copyOf(new ArrayList<>(merged.values()));
  }
}
