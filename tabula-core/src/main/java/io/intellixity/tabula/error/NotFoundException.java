package io.intellixity.tabula.error;

/**
 * A table, view, row or column is missing or not owned by the acting user.\n
 *
 * Both cases are reported identically so ownership is never leaked.\n
 */
public final class NotFoundException extends TabulaException {
  private final String kind;
  private final String id;

  public NotFoundException(String kind, String id) {
    super(kind + " not found: " + id);
    this.kind = kind;
    this.id = id;
  }

  public String kind() { return kind; }
  public String id() { return id; }

  @Override public boolean retryable() { return false; }
}
