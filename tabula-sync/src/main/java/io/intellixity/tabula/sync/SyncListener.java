package io.intellixity.tabula.sync;

import io.intellixity.tabula.model.ViewRecord;

/** Callbacks from the coordinator's timeline. All methods default to no-ops. */
public interface SyncListener {
  SyncListener NONE = new SyncListener() {};

  default void onSynced(AppliedPatches result) {}

  /** A non-retryable rejection; {@code viewId} is the temporary id for a failed creation. */
  default void onFailed(String viewId, Throwable cause) {}

  default void onRetriesExhausted(String viewId, int attempts) {}

  default void onViewCommitted(String pendingId, ViewRecord committed) {}
}
