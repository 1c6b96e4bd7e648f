package io.intellixity.tabula.model;

import java.util.ArrayList;
import java.util.List;

/** Stored configuration of a named view: everything a patch can address. */
public record ViewConfig(List<FilterGroup> filters, List<SortSpec> sort, List<ColumnSetting> columns, String search) {
  public ViewConfig {
    filters = List.copyOf(filters == null ? List.of() : filters);
    sort = List.copyOf(sort == null ? List.of() : sort);
    columns = List.copyOf(columns == null ? List.of() : columns);
    search = (search == null) ? "" : search;
  }

  public static ViewConfig empty() {
    return new ViewConfig(List.of(), List.of(), List.of(), "");
  }

  /** "All columns visible, no filters/sort/search" in the given column order. */
  public static ViewConfig allVisible(List<Column> columns) {
    List<ColumnSetting> settings = new ArrayList<>();
    int order = 0;
    for (Column c : columns == null ? List.<Column>of() : columns) {
      settings.add(new ColumnSetting(c.id(), true, order++));
    }
    return new ViewConfig(List.of(), List.of(), settings, "");
  }

  public ViewConfig withFilters(List<FilterGroup> v) { return new ViewConfig(v, sort, columns, search); }
  public ViewConfig withSort(List<SortSpec> v) { return new ViewConfig(filters, v, columns, search); }
  public ViewConfig withColumns(List<ColumnSetting> v) { return new ViewConfig(filters, sort, v, search); }
  public ViewConfig withSearch(String v) { return new ViewConfig(filters, sort, columns, v); }
}
