package io.intellixity.tabula.sync;

import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;

import java.util.Objects;

/**
 * A view as the client knows it: either still being created or committed with a server id.\n
 *
 * Only committed views get a {@link PatchQueue}; a pending view's temporary id is never used
 * for sending.\n
 */
public interface ViewRef {
  String id();

  String tableId();

  String name();

  default boolean isDefault() {
    return ViewRecord.isDefaultName(name());
  }

  record PendingView(String id, String tableId, String name) implements ViewRef {
    public PendingView {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(tableId, "tableId");
      Objects.requireNonNull(name, "name");
    }
  }

  record CommittedView(String id, String tableId, String name, int version, ViewConfig config) implements ViewRef {
    public CommittedView {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(tableId, "tableId");
      Objects.requireNonNull(name, "name");
      config = (config == null) ? ViewConfig.empty() : config;
    }

    public static CommittedView of(ViewRecord r) {
      return new CommittedView(r.id(), r.tableId(), r.name(), r.version(), r.config());
    }
  }
}
