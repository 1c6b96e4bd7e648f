package io.intellixity.tabula.error;

/** A view patch was applied against a version the server no longer holds. */
public final class VersionConflictException extends TabulaException {
  private final String viewId;
  private final int expectedVersion;
  private final int actualVersion;

  public VersionConflictException(String viewId, int expectedVersion, int actualVersion) {
    super("Version conflict on view " + viewId + ": expected=" + expectedVersion + " actual=" + actualVersion);
    this.viewId = viewId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String viewId() { return viewId; }
  public int expectedVersion() { return expectedVersion; }
  /** Server version at the time of the rejection, or -1 when unknown. */
  public int actualVersion() { return actualVersion; }

  @Override public boolean retryable() { return true; }
}
