package io.intellixity.tabula.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** {@link SyncScheduler} on one daemon thread. */
public final class ExecutorSyncScheduler implements SyncScheduler, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExecutorSyncScheduler.class);

  private final ScheduledExecutorService executor;

  public ExecutorSyncScheduler() {
    this("tabula-sync");
  }

  public ExecutorSyncScheduler(String threadName) {
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, threadName);
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMillis) {
    ScheduledFuture<?> f = executor.schedule(guarded(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
    return () -> f.cancel(false);
  }

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  // an escaping exception would otherwise vanish inside the executor
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        log.error("tabula.sync task failed", e);
      }
    };
  }
}
