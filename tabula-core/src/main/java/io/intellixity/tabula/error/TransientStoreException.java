package io.intellixity.tabula.error;

/** Network, timeout or connection failure while talking to a store. */
public final class TransientStoreException extends TabulaException {
  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransientStoreException(String message) {
    super(message);
  }

  @Override public boolean retryable() { return true; }
}
