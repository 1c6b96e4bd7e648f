package io.intellixity.tabula.sync;

/** Per-view position in the sync cycle. */
public enum ViewSyncState {
  IDLE,
  DEBOUNCING,
  SENDING,
  /** Waiting for backoff or for the authoritative version after a conflict. */
  REFETCHING,
  /** Retries exhausted; the queue is frozen until the next patch for the view. */
  FAILED
}
