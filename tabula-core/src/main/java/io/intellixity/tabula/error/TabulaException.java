package io.intellixity.tabula.error;

/** Base of the unchecked error taxonomy shared by server and client. */
public abstract class TabulaException extends RuntimeException {
  protected TabulaException(String message) {
    super(message);
  }

  protected TabulaException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether an automatic retry can succeed without user action. */
  public abstract boolean retryable();
}
