package io.intellixity.tabula.store;

import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;

import java.util.List;
import java.util.Optional;

public interface ViewStore {
  /** Views of a table in creation order. */
  List<ViewRecord> listByTable(String tableId);

  Optional<ViewRecord> find(String viewId);

  ViewRecord create(String tableId, String name, ViewConfig config);

  /**
   * Version-checked write.\n
   *
   * Stores {@code config} and increments the version by one only if the stored version still equals
   * {@code expectedVersion}. Returns the updated record, or empty when the version did not match
   * (including when the view no longer exists).
   */
  Optional<ViewRecord> compareAndSet(String viewId, int expectedVersion, ViewConfig config);

  boolean delete(String viewId);
}
