package io.intellixity.tabula.model;

import java.util.Objects;

public record ColumnSetting(String columnId, boolean visible, int order) {
  public ColumnSetting {
    Objects.requireNonNull(columnId, "columnId");
  }
}
