package io.intellixity.tabula.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;
import java.util.Objects;

/** A group of conditions joined by one logic operator; groups are matched by id when merged. */
public record FilterGroup(String id, @JsonAlias("logicOperator") LogicOperator logic, List<FilterCondition> conditions) {
  public FilterGroup {
    Objects.requireNonNull(id, "id");
    logic = (logic == null) ? LogicOperator.AND : logic;
    conditions = List.copyOf(conditions == null ? List.of() : conditions);
  }
}
