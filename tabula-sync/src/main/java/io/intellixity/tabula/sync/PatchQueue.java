package io.intellixity.tabula.sync;

import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.patch.PatchCoalescer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sync state of one committed view.\n
 *
 * <p>Patches move pending (debouncing, one per path) to queued (append-only) to in-flight (the
 * exact coalesced batch last sent). The in-flight batch is kept until the server accepts it so a
 * version conflict resends the same set. {@code currentVersion} only moves forward and only on
 * server answers.</p>
 *
 * <p>Not thread-safe; owned by {@link ViewSyncCoordinator} and touched only on its timeline.</p>
 */
public final class PatchQueue {
  private final String viewId;
  private final List<Patch> pending = new ArrayList<>();
  private final List<Patch> queued = new ArrayList<>();
  private List<Patch> inFlight = List.of();

  private int currentVersion;
  private ViewSyncState state = ViewSyncState.IDLE;
  private boolean processing;
  private boolean frozen;
  private int retryCount;
  private long lastRetryTime;

  private SyncScheduler.Cancellable debounceTask;
  private SyncScheduler.Cancellable retryTask;

  PatchQueue(String viewId, int currentVersion) {
    this.viewId = Objects.requireNonNull(viewId, "viewId");
    this.currentVersion = currentVersion;
  }

  public String viewId() { return viewId; }
  public int currentVersion() { return currentVersion; }
  public ViewSyncState state() { return state; }
  public boolean isProcessing() { return processing; }
  public boolean isFrozen() { return frozen; }
  public int retryCount() { return retryCount; }
  public long lastRetryTime() { return lastRetryTime; }
  public List<Patch> pending() { return List.copyOf(pending); }
  public List<Patch> queued() { return List.copyOf(queued); }
  public List<Patch> inFlight() { return inFlight; }

  /** A newer patch replaces any pending one for the same path. A frozen queue restarts fresh. */
  void addPending(Patch p) {
    pending.removeIf(x -> x.path() == p.path());
    pending.add(p);
    thaw();
    if (!processing) state = ViewSyncState.DEBOUNCING;
  }

  void movePendingToQueued() {
    queued.addAll(pending);
    pending.clear();
  }

  /** Append patches flushed from the suspend buffer; like {@link #addPending}, they restart a frozen queue. */
  void enqueueAll(List<Patch> patches) {
    queued.addAll(patches);
    if (!patches.isEmpty()) thaw();
  }

  private void thaw() {
    if (!frozen) return;
    frozen = false;
    retryCount = 0;
  }

  boolean hasQueued() {
    return !queued.isEmpty();
  }

  boolean canStart() {
    return !processing && !frozen && !queued.isEmpty();
  }

  /** Coalesce everything queued into the in-flight batch. */
  List<Patch> beginSend() {
    inFlight = PatchCoalescer.coalesce(queued);
    queued.clear();
    processing = true;
    state = ViewSyncState.SENDING;
    return inFlight;
  }

  void completeSend(int serverVersion) {
    observeVersion(serverVersion);
    inFlight = List.of();
    processing = false;
    retryCount = 0;
    state = pending.isEmpty() ? ViewSyncState.IDLE : ViewSyncState.DEBOUNCING;
  }

  /** Drop the in-flight batch; queued work stays. */
  void abandonInFlight() {
    inFlight = List.of();
    processing = false;
    state = pending.isEmpty() ? ViewSyncState.IDLE : ViewSyncState.DEBOUNCING;
  }

  /** Put the in-flight batch back in front of the queue, ahead of newer patches. */
  void requeueInFlight() {
    queued.addAll(0, inFlight);
    inFlight = List.of();
    processing = false;
  }

  void observeVersion(int serverVersion) {
    if (serverVersion > currentVersion) currentVersion = serverVersion;
  }

  /** Count one retry; returns its attempt number. */
  int nextRetry(long now) {
    lastRetryTime = now;
    state = ViewSyncState.REFETCHING;
    return ++retryCount;
  }

  void markSending() {
    state = ViewSyncState.SENDING;
  }

  /** Retries exhausted: keep every patch, stop until new patches arrive. */
  void freeze() {
    requeueInFlight();
    frozen = true;
    state = ViewSyncState.FAILED;
  }

  /** The debounce timer ran; forget it without cancelling. */
  void debounceFired() {
    debounceTask = null;
  }

  void setDebounceTask(SyncScheduler.Cancellable task) {
    cancel(debounceTask);
    debounceTask = task;
  }

  void setRetryTask(SyncScheduler.Cancellable task) {
    cancel(retryTask);
    retryTask = task;
  }

  void cancelTimers() {
    setDebounceTask(null);
    setRetryTask(null);
  }

  private static void cancel(SyncScheduler.Cancellable task) {
    if (task != null) task.cancel();
  }
}
