package io.intellixity.tabula.model;

import java.util.Objects;

public record FilterCondition(String columnId, FilterOperator operator, Object value) {
  public FilterCondition {
    Objects.requireNonNull(columnId, "columnId");
    Objects.requireNonNull(operator, "operator");
  }
}
