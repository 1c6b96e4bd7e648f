package io.intellixity.tabula.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public enum LogicOperator {
  @JsonProperty("and") @JsonAlias("AND") AND,
  @JsonProperty("or") @JsonAlias("OR") OR
}
