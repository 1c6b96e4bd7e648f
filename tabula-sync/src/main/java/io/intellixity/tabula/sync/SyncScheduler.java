package io.intellixity.tabula.sync;

/**
 * The single logical timeline all coordinator state changes run on.\n
 *
 * Implementations run tasks one at a time and in submission order; delayed tasks join the
 * same timeline when due.\n
 */
public interface SyncScheduler {
  void execute(Runnable task);

  Cancellable schedule(Runnable task, long delayMillis);

  long nowMillis();

  @FunctionalInterface
  interface Cancellable {
    void cancel();
  }
}
