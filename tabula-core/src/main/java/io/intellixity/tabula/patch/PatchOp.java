package io.intellixity.tabula.patch;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PatchOp {
  @JsonProperty("set") SET,
  @JsonProperty("merge") MERGE
}
