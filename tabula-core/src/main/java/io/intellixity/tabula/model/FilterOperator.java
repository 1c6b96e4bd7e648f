package io.intellixity.tabula.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FilterOperator {
  @JsonProperty("equals") EQUALS(true),
  @JsonProperty("not_equals") NOT_EQUALS(true),
  @JsonProperty("contains") CONTAINS(true),
  @JsonProperty("not_contains") NOT_CONTAINS(true),
  @JsonProperty("greater_than") GREATER_THAN(true),
  @JsonProperty("less_than") LESS_THAN(true),
  @JsonProperty("is_empty") IS_EMPTY(false),
  @JsonProperty("is_not_empty") IS_NOT_EMPTY(false);

  private final boolean needsValue;

  FilterOperator(boolean needsValue) {
    this.needsValue = needsValue;
  }

  public boolean needsValue() {
    return needsValue;
  }
}
