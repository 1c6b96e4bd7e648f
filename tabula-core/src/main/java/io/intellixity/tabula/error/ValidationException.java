package io.intellixity.tabula.error;

/**
 * Raised when input is out of bounds or violates a structural rule (duplicate column name,
 * deleting the default view or the last table). The message is user-facing and surfaced verbatim.
 */
public final class ValidationException extends TabulaException {
  public ValidationException(String message) {
    super(message);
  }

  @Override public boolean retryable() { return false; }
}
