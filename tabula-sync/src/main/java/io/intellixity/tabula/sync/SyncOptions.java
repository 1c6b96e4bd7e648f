package io.intellixity.tabula.sync;

/**
 * Timing knobs of the coordinator.\n
 *
 * Retry delays start at {@code retryBaseMillis} and double per attempt, capped at
 * {@code retryCapMillis}. After {@code maxRetries} attempts the view's queue freezes.\n
 */
public record SyncOptions(long debounceMillis, long retryBaseMillis, long retryCapMillis, int maxRetries) {
  public SyncOptions {
    if (debounceMillis < 0) throw new IllegalArgumentException("debounceMillis must be >= 0");
    if (retryBaseMillis <= 0) throw new IllegalArgumentException("retryBaseMillis must be > 0");
    if (retryCapMillis < retryBaseMillis) throw new IllegalArgumentException("retryCapMillis must be >= retryBaseMillis");
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
  }

  public static SyncOptions defaults() {
    return new SyncOptions(400, 250, 5_000, 5);
  }

  /** Delay before retry number {@code attempt} (1-based). */
  public long backoffMillis(int attempt) {
    if (attempt <= 1) return retryBaseMillis;
    int shift = Math.min(attempt - 1, 30);
    long d = retryBaseMillis << shift;
    return (d <= 0 || d > retryCapMillis) ? retryCapMillis : d;
  }
}
