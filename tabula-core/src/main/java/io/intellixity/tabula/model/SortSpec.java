package io.intellixity.tabula.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record SortSpec(String columnId, Direction direction) {
  public SortSpec {
    Objects.requireNonNull(columnId, "columnId");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    @JsonProperty("asc") ASC,
    @JsonProperty("desc") DESC
  }
}
