package io.intellixity.tabula.sync;

import java.util.Comparator;
import java.util.PriorityQueue;

/** Deterministic timeline: immediate tasks run inline, timers run when {@link #advance} passes them. */
final class ManualScheduler implements SyncScheduler {
  private static final class Timer {
    final long due;
    final long seq;
    final Runnable task;

    Timer(long due, long seq, Runnable task) {
      this.due = due;
      this.seq = seq;
      this.task = task;
    }
  }

  private final PriorityQueue<Timer> timers =
      new PriorityQueue<>(Comparator.<Timer>comparingLong(t -> t.due).thenComparingLong(t -> t.seq));
  private long now = 1_000;
  private long seq;

  @Override
  public void execute(Runnable task) {
    task.run();
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMillis) {
    Timer t = new Timer(now + delayMillis, seq++, task);
    timers.add(t);
    return () -> timers.remove(t);
  }

  @Override
  public long nowMillis() {
    return now;
  }

  void advance(long millis) {
    long target = now + millis;
    while (!timers.isEmpty() && timers.peek().due <= target) {
      Timer t = timers.poll();
      now = t.due;
      t.task.run();
    }
    now = target;
  }

  int pendingTimers() {
    return timers.size();
  }
}
