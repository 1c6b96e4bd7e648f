package io.intellixity.tabula.page;

import io.intellixity.tabula.error.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded retry for store reads.\n
 *
 * Only {@link TransientStoreException} is retried; the wait doubles from {@code baseMillis} up to
 * {@code capMillis}. The last failure propagates once {@code maxAttempts} reads have failed.\n
 */
public final class ReadRetry {
  private static final Logger log = LoggerFactory.getLogger(ReadRetry.class);

  public static final int DEFAULT_ATTEMPTS = 3;
  public static final long DEFAULT_BASE_MILLIS = 100;
  public static final long DEFAULT_CAP_MILLIS = 2_000;

  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final int maxAttempts;
  private final long baseMillis;
  private final long capMillis;
  private final Sleeper sleeper;

  public ReadRetry(int maxAttempts, long baseMillis, long capMillis) {
    this(maxAttempts, baseMillis, capMillis, TimeUnit.MILLISECONDS::sleep);
  }

  public ReadRetry(int maxAttempts, long baseMillis, long capMillis, Sleeper sleeper) {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (baseMillis < 0) throw new IllegalArgumentException("baseMillis must be >= 0");
    if (capMillis < baseMillis) throw new IllegalArgumentException("capMillis must be >= baseMillis");
    this.maxAttempts = maxAttempts;
    this.baseMillis = baseMillis;
    this.capMillis = capMillis;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public static ReadRetry defaults() {
    return new ReadRetry(DEFAULT_ATTEMPTS, DEFAULT_BASE_MILLIS, DEFAULT_CAP_MILLIS);
  }

  public int maxAttempts() { return maxAttempts; }

  /** Wait before retry number {@code attempt} (1-based). */
  public long delayMillis(int attempt) {
    int shift = Math.min(Math.max(0, attempt - 1), 30);
    return Math.min(capMillis, baseMillis << shift);
  }

  public <T> T call(String op, Supplier<T> read) {
    for (int attempt = 1; ; attempt++) {
      try {
        return read.get();
      } catch (TransientStoreException e) {
        if (attempt >= maxAttempts) {
          log.warn("tabula.read retries_exhausted op={} attempts={} error={}", op, attempt, e.getMessage());
          throw e;
        }
        long wait = delayMillis(attempt);
        log.debug("tabula.read retry op={} attempt={} waitMs={} error={}", op, attempt, wait, e.getMessage());
        try {
          sleeper.sleep(wait);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
      }
    }
  }
}
