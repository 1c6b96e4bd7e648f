package io.intellixity.tabula.model;

import java.time.Instant;
import java.util.Objects;

/** Server-held, version-stamped view. The server alone assigns {@code version}. */
public record ViewRecord(String id, String tableId, String name, ViewConfig config, int version,
                         Instant createdAt, Instant updatedAt) {
  public static final String DEFAULT_VIEW_NAME = "Grid view";
  public static final int INITIAL_VERSION = 1;

  public ViewRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tableId, "tableId");
    Objects.requireNonNull(name, "name");
    config = (config == null) ? ViewConfig.empty() : config;
    if (version < INITIAL_VERSION) throw new IllegalArgumentException("version must be >= 1");
  }

  public boolean isDefault() {
    return isDefaultName(name);
  }

  public static boolean isDefaultName(String name) {
    return DEFAULT_VIEW_NAME.equals(name);
  }
}
