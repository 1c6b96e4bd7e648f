package io.intellixity.tabula.sync;

/** Coordinator-wide delivery mode. */
public enum SyncMode {
  ACTIVE,
  /** Patches are buffered and no queue starts processing. */
  SUSPENDED
}
