package io.intellixity.tabula.patch;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The view configuration fields a patch may replace. */
public enum PatchPath {
  @JsonProperty("filters") FILTERS("filters"),
  @JsonProperty("sort") SORT("sort"),
  @JsonProperty("columns") COLUMNS("columns"),
  @JsonProperty("search") SEARCH("search");

  private final String wireName;

  PatchPath(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static PatchPath fromWireName(String name) {
    for (PatchPath p : values()) {
      if (p.wireName.equalsIgnoreCase(name)) return p;
    }
    throw new IllegalArgumentException("Unknown patch path: " + name);
  }
}
