package io.intellixity.tabula.store;

import io.intellixity.tabula.model.FilterGroup;
import io.intellixity.tabula.model.ViewConfig;

import java.util.List;
import java.util.Locale;

/**
 * Row-level narrowing applied by range and count queries.\n
 *
 * Search text is matched case-insensitively against the row's search string; filter groups are
 * combined with AND and evaluated against the row cache.\n
 */
public record RowFilter(String search, List<FilterGroup> filters) {
  private static final RowFilter NONE = new RowFilter("", List.of());

  public RowFilter {
    search = (search == null) ? "" : search.trim().toLowerCase(Locale.ROOT);
    filters = List.copyOf(filters == null ? List.of() : filters);
  }

  public static RowFilter none() {
    return NONE;
  }

  public static RowFilter of(ViewConfig config) {
    if (config == null) return NONE;
    return new RowFilter(config.search(), config.filters());
  }

  public boolean isEmpty() {
    return search.isEmpty() && filters.stream().allMatch(g -> g.conditions().isEmpty());
  }
}
