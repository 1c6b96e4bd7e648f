package io.intellixity.tabula.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.TabulaException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnSetting;
import io.intellixity.tabula.model.FilterGroup;
import io.intellixity.tabula.model.SortSpec;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.FilterMerge;
import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.patch.PatchCoalescer;
import io.intellixity.tabula.patch.PatchOp;
import io.intellixity.tabula.patch.PatchPath;
import io.intellixity.tabula.patch.TabulaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Client-side synchronization of named views with their server-held, version-stamped records.\n
 *
 * <p>All state changes run on the {@link SyncScheduler}'s timeline; public mutators post to it
 * and network answers are re-posted to it. Each committed view owns a {@link PatchQueue}: patches
 * debounce per view, coalesce when the timer fires and go out one batch at a time tagged with the
 * last server version seen. A conflict refetches the version and resends the same batch with
 * bounded backoff. While {@link SyncMode#SUSPENDED} patches collect in a buffer (one per path)
 * and nothing starts sending; {@link #resume()} sends the buffer as one batch against a freshly
 * fetched version.</p>
 *
 * <p>Per-view UI state is kept by view id so switching back restores it locally. Selecting the
 * default view always resets its UI state to all columns visible with no filters, sort or
 * search.</p>
 */
public final class ViewSyncCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ViewSyncCoordinator.class);

  private final ViewSyncClient client;
  private final SyncScheduler scheduler;
  private final SyncOptions options;
  private final SyncListener listener;

  private final Map<String, PatchQueue> queues = new ConcurrentHashMap<>();
  private final Map<String, ViewConfig> uiStates = new ConcurrentHashMap<>();
  // written on the timeline, snapshotted from any thread
  private final Map<String, List<Patch>> parked = new ConcurrentHashMap<>();
  private final List<Patch> buffer = new CopyOnWriteArrayList<>();

  private volatile SyncMode mode = SyncMode.ACTIVE;
  private volatile String tableId;
  private volatile ViewRef currentView;

  public ViewSyncCoordinator(ViewSyncClient client, SyncScheduler scheduler) {
    this(client, scheduler, SyncOptions.defaults(), SyncListener.NONE);
  }

  public ViewSyncCoordinator(ViewSyncClient client, SyncScheduler scheduler, SyncOptions options, SyncListener listener) {
    this.client = Objects.requireNonNull(client, "client");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.options = Objects.requireNonNull(options, "options");
    this.listener = (listener == null) ? SyncListener.NONE : listener;
  }

  // ---- accessors (snapshots)

  public SyncMode mode() { return mode; }
  public String tableId() { return tableId; }
  public ViewRef currentView() { return currentView; }

  public ViewConfig uiState(String viewId) {
    return uiStates.getOrDefault(viewId, ViewConfig.empty());
  }

  public ViewSyncState state(String viewId) {
    PatchQueue q = queues.get(viewId);
    return (q == null) ? ViewSyncState.IDLE : q.state();
  }

  public Optional<PatchQueue> queue(String viewId) {
    return Optional.ofNullable(queues.get(viewId));
  }

  /** Patches held while suspended. */
  public List<Patch> buffered() {
    return List.copyOf(buffer);
  }

  /** Patches waiting for a pending view to be committed. */
  public List<Patch> parked(String pendingViewId) {
    return List.copyOf(parked.getOrDefault(pendingViewId, List.of()));
  }

  // ---- selection

  /** Switch tables: every queue, timer, buffer and stored UI state of the previous table is dropped. */
  public void selectTable(String tableId) {
    Objects.requireNonNull(tableId, "tableId");
    scheduler.execute(() -> {
      for (PatchQueue q : queues.values()) q.cancelTimers();
      queues.clear();
      uiStates.clear();
      parked.clear();
      buffer.clear();
      this.tableId = tableId;
      this.currentView = null;
      log.debug("tabula.sync select_table tableId={}", tableId);
    });
  }

  /**
   * Make {@code view} current.\n
   *
   * A view seen before gets its stored UI state back; a committed view seen for the first time
   * starts from its server config. The default view resets to all visible over {@code columns}.
   */
  public void selectView(ViewRef view, List<Column> columns) {
    Objects.requireNonNull(view, "view");
    scheduler.execute(() -> {
      currentView = view;
      if (view instanceof ViewRef.CommittedView committed) queueFor(committed);

      if (view.isDefault()) {
        uiStates.put(view.id(), ViewConfig.allVisible(columns));
      } else if (view instanceof ViewRef.CommittedView committed) {
        uiStates.putIfAbsent(view.id(), committed.config());
      } else {
        uiStates.putIfAbsent(view.id(), ViewConfig.allVisible(columns));
      }
      log.debug("tabula.sync select_view viewId={} default={}", view.id(), view.isDefault());
    });
  }

  // ---- UI operations: update local state, then emit the matching patch

  public void setSearch(String search) {
    String s = (search == null) ? "" : search;
    updateUi(c -> c.withSearch(s), PatchPath.SEARCH, s);
  }

  public void setSort(List<SortSpec> sort) {
    List<SortSpec> v = List.copyOf(sort == null ? List.of() : sort);
    updateUi(c -> c.withSort(v), PatchPath.SORT, v);
  }

  public void setColumnVisibility(String columnId, boolean visible) {
    Objects.requireNonNull(columnId, "columnId");
    long ts = scheduler.nowMillis();
    scheduler.execute(() -> {
      ViewRef v = currentView;
      if (v == null) {
        log.warn("tabula.sync ui_change_dropped reason=no_view path={}", PatchPath.COLUMNS.wireName());
        return;
      }
      List<ColumnSetting> cols = new ArrayList<>(uiState(v.id()).columns());
      int idx = indexOf(cols, columnId);
      if (idx >= 0) cols.set(idx, new ColumnSetting(columnId, visible, cols.get(idx).order()));
      else cols.add(new ColumnSetting(columnId, visible, cols.size()));
      uiStates.put(v.id(), uiState(v.id()).withColumns(cols));
      addPatchNow(Patch.set(PatchPath.COLUMNS, TabulaJson.toTree(cols), ts));
    });
  }

  /** Upsert filter groups by id into the current view; an empty list clears every filter. */
  public void upsertFilters(List<FilterGroup> incoming) {
    long ts = scheduler.nowMillis();
    scheduler.execute(() -> {
      ViewRef v = currentView;
      if (v == null) {
        log.warn("tabula.sync ui_change_dropped reason=no_view path={}", PatchPath.FILTERS.wireName());
        return;
      }
      List<FilterGroup> merged = FilterMerge.upsertById(uiState(v.id()).filters(), incoming);
      uiStates.put(v.id(), uiState(v.id()).withFilters(merged));
      addPatchNow(Patch.set(PatchPath.FILTERS, TabulaJson.toTree(merged), ts));
    });
  }

  private void updateUi(UnaryOperator<ViewConfig> change, PatchPath path, Object value) {
    long ts = scheduler.nowMillis();
    scheduler.execute(() -> {
      ViewRef v = currentView;
      if (v == null) {
        log.warn("tabula.sync ui_change_dropped reason=no_view path={}", path.wireName());
        return;
      }
      uiStates.put(v.id(), change.apply(uiState(v.id())));
      addPatchNow(Patch.set(path, TabulaJson.toTree(value), ts));
    });
  }

  private static int indexOf(List<ColumnSetting> cols, String columnId) {
    for (int i = 0; i < cols.size(); i++) {
      if (cols.get(i).columnId().equals(columnId)) return i;
    }
    return -1;
  }

  // ---- patches

  /** Record a change to the current view; the timestamp is taken now. */
  public void addPatch(PatchOp op, PatchPath path, JsonNode value) {
    Patch p = new Patch(op, path, value, scheduler.nowMillis());
    scheduler.execute(() -> addPatchNow(p));
  }

  private void addPatchNow(Patch p) {
    if (mode == SyncMode.SUSPENDED) {
      buffer.removeIf(x -> x.path() == p.path());
      buffer.add(p);
      log.debug("tabula.sync buffered path={} size={}", p.path().wireName(), buffer.size());
      return;
    }
    ViewRef v = currentView;
    if (v == null) {
      log.warn("tabula.sync patch_dropped reason=no_view path={}", p.path().wireName());
      return;
    }
    if (v instanceof ViewRef.CommittedView committed) {
      PatchQueue q = queueFor(committed);
      q.addPending(p);
      scheduleDebounce(q);
    } else {
      park(v.id(), p);
    }
  }

  private void park(String pendingId, Patch p) {
    List<Patch> list = parked.computeIfAbsent(pendingId, k -> new CopyOnWriteArrayList<>());
    list.removeIf(x -> x.path() == p.path());
    list.add(p);
  }

  private void scheduleDebounce(PatchQueue q) {
    q.setDebounceTask(scheduler.schedule(() -> onDebounce(q), options.debounceMillis()));
  }

  private void onDebounce(PatchQueue q) {
    if (!isLive(q)) return;
    q.debounceFired();
    q.movePendingToQueued();
    processNext(q);
  }

  /** Start the next batch unless one is in flight, the queue is frozen or delivery is suspended. */
  private void processNext(PatchQueue q) {
    if (!isLive(q) || mode == SyncMode.SUSPENDED || !q.canStart()) return;
    q.setRetryTask(null);
    send(q, q.beginSend());
  }

  private void send(PatchQueue q, List<Patch> batch) {
    String viewId = q.viewId();
    int version = q.currentVersion();
    if (log.isDebugEnabled()) {
      log.debug("tabula.sync send viewId={} version={} patches={} retry={}", viewId, version, batch.size(), q.retryCount());
    }
    call(() -> client.applyPatches(viewId, version, batch))
        .whenComplete((res, err) -> scheduler.execute(() -> onSent(q, res, err)));
  }

  private void onSent(PatchQueue q, AppliedPatches res, Throwable err) {
    if (!isLive(q)) {
      log.debug("tabula.sync answer_ignored viewId={} reason=queue_cleared", q.viewId());
      return;
    }
    if (err == null) {
      q.completeSend(res.version());
      log.debug("tabula.sync synced viewId={} version={}", q.viewId(), q.currentVersion());
      listener.onSynced(res);
      processNext(q);
      return;
    }

    Throwable cause = unwrap(err);
    if (cause instanceof VersionConflictException) {
      log.debug("tabula.sync conflict viewId={} version={}", q.viewId(), q.currentVersion());
      retryOrFreeze(q, () -> refetchAndResend(q));
    } else if (cause instanceof NotFoundException) {
      dropQueue(q, cause);
    } else if (cause instanceof TabulaException te && te.retryable()) {
      log.debug("tabula.sync transient_failure viewId={} error={}", q.viewId(), cause.getMessage());
      q.requeueInFlight();
      retryOrFreeze(q, () -> processNext(q));
    } else {
      log.warn("tabula.sync rejected viewId={} patches={} error={}", q.viewId(), q.inFlight().size(), cause.getMessage());
      q.abandonInFlight();
      listener.onFailed(q.viewId(), cause);
      processNext(q);
    }
  }

  private void retryOrFreeze(PatchQueue q, Runnable retry) {
    if (q.retryCount() >= options.maxRetries()) {
      q.freeze();
      log.warn("tabula.sync retries_exhausted viewId={} attempts={} keptPatches={}",
          q.viewId(), q.retryCount(), q.queued().size());
      listener.onRetriesExhausted(q.viewId(), q.retryCount());
      return;
    }
    int attempt = q.nextRetry(scheduler.nowMillis());
    long delay = options.backoffMillis(attempt);
    q.setRetryTask(scheduler.schedule(() -> {
      if (isLive(q)) retry.run();
    }, delay));
  }

  /** After a conflict: learn the server's version, then resend the same in-flight batch. */
  private void refetchAndResend(PatchQueue q) {
    String tid = tableId;
    call(() -> client.listViews(tid)).whenComplete((views, err) -> scheduler.execute(() -> {
      if (!isLive(q)) return;
      if (err != null) {
        Throwable cause = unwrap(err);
        if (cause instanceof NotFoundException) {
          dropQueue(q, cause);
        } else {
          log.debug("tabula.sync refetch_failed viewId={} error={}", q.viewId(), cause.getMessage());
          retryOrFreeze(q, () -> refetchAndResend(q));
        }
        return;
      }
      Optional<ViewRecord> server = findView(views, q.viewId());
      if (server.isEmpty()) {
        dropQueue(q, new NotFoundException("view", q.viewId()));
        return;
      }
      q.observeVersion(server.get().version());
      q.markSending();
      send(q, q.inFlight());
    }));
  }

  // ---- suspend / resume

  public void suspend() {
    scheduler.execute(() -> {
      if (mode == SyncMode.SUSPENDED) return;
      mode = SyncMode.SUSPENDED;
      log.info("tabula.sync suspended tableId={}", tableId);
    });
  }

  public void resume() {
    scheduler.execute(this::resumeNow);
  }

  private void resumeNow() {
    if (mode == SyncMode.ACTIVE) return;
    mode = SyncMode.ACTIVE;
    List<Patch> flush = PatchCoalescer.coalesce(buffer);
    buffer.clear();
    log.info("tabula.sync resumed tableId={} buffered={}", tableId, flush.size());

    PatchQueue target = null;
    ViewRef v = currentView;
    if (!flush.isEmpty()) {
      if (v instanceof ViewRef.CommittedView committed) {
        target = queueFor(committed);
        flushAgainstFreshVersion(target, flush);
      } else if (v != null) {
        for (Patch p : flush) park(v.id(), p);
      } else {
        log.warn("tabula.sync buffer_dropped reason=no_view patches={}", flush.size());
      }
    }
    // queues whose debounce fired while suspended
    for (PatchQueue q : List.copyOf(queues.values())) {
      if (q != target) processNext(q);
    }
  }

  private void flushAgainstFreshVersion(PatchQueue q, List<Patch> flush) {
    String tid = tableId;
    call(() -> client.listViews(tid)).whenComplete((views, err) -> scheduler.execute(() -> {
      if (!isLive(q)) return;
      if (err == null) {
        findView(views, q.viewId()).ifPresent(r -> q.observeVersion(r.version()));
      } else {
        log.warn("tabula.sync resume_refetch_failed viewId={} error={}", q.viewId(), unwrap(err).getMessage());
      }
      q.enqueueAll(flush);
      processNext(q);
    }));
  }

  // ---- view lifecycle

  /**
   * Create a view. The returned pending view can be selected and edited right away; its patches
   * are parked and move to the committed view's queue once the server assigns an id.
   */
  public ViewRef.PendingView createView(String name) {
    String tid = tableId;
    if (tid == null) throw new IllegalStateException("No table selected");
    ViewRef.PendingView pending = new ViewRef.PendingView("pending-" + UUID.randomUUID(), tid, name);
    scheduler.execute(() -> call(() -> client.createView(tid, name))
        .whenComplete((rec, err) -> scheduler.execute(() -> onCreated(pending, rec, err))));
    return pending;
  }

  private void onCreated(ViewRef.PendingView pending, ViewRecord rec, Throwable err) {
    List<Patch> waiting = parked.remove(pending.id());
    ViewConfig ui = uiStates.remove(pending.id());
    if (!pending.tableId().equals(tableId)) return;

    if (err != null) {
      Throwable cause = unwrap(err);
      log.warn("tabula.sync create_failed tableId={} name={} error={}", pending.tableId(), pending.name(), cause.getMessage());
      if (pending.equals(currentView)) currentView = null;
      listener.onFailed(pending.id(), cause);
      return;
    }

    ViewRef.CommittedView committed = ViewRef.CommittedView.of(rec);
    PatchQueue q = queueFor(committed);
    if (ui != null) uiStates.put(committed.id(), ui);
    if (pending.equals(currentView)) currentView = committed;
    log.debug("tabula.sync view_committed pendingId={} viewId={} parked={}",
        pending.id(), committed.id(), waiting == null ? 0 : waiting.size());
    listener.onViewCommitted(pending.id(), rec);

    if (waiting != null && !waiting.isEmpty()) {
      for (Patch p : waiting) q.addPending(p);
      scheduleDebounce(q);
    }
  }

  /** Delete a view on the server; on success its queue and UI state are forgotten. */
  public CompletableFuture<Void> deleteView(String viewId) {
    Objects.requireNonNull(viewId, "viewId");
    CompletableFuture<Void> out = new CompletableFuture<>();
    scheduler.execute(() -> call(() -> client.deleteView(viewId))
        .whenComplete((ok, err) -> scheduler.execute(() -> {
          if (err == null) {
            forgetView(viewId);
            out.complete(null);
          } else {
            Throwable cause = unwrap(err);
            listener.onFailed(viewId, cause);
            out.completeExceptionally(cause);
          }
        })));
    return out;
  }

  private void forgetView(String viewId) {
    PatchQueue q = queues.remove(viewId);
    if (q != null) q.cancelTimers();
    uiStates.remove(viewId);
    ViewRef v = currentView;
    if (v != null && v.id().equals(viewId)) currentView = null;
  }

  private void dropQueue(PatchQueue q, Throwable cause) {
    log.warn("tabula.sync queue_dropped viewId={} error={}", q.viewId(), cause.getMessage());
    q.cancelTimers();
    queues.remove(q.viewId(), q);
    uiStates.remove(q.viewId());
    listener.onFailed(q.viewId(), cause);
  }

  // ---- helpers

  private PatchQueue queueFor(ViewRef.CommittedView view) {
    PatchQueue q = queues.computeIfAbsent(view.id(), id -> new PatchQueue(id, view.version()));
    q.observeVersion(view.version());
    return q;
  }

  private boolean isLive(PatchQueue q) {
    return queues.get(q.viewId()) == q;
  }

  private static Optional<ViewRecord> findView(List<ViewRecord> views, String viewId) {
    return views.stream().filter(v -> v.id().equals(viewId)).findFirst();
  }

  private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> request) {
    try {
      return request.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  static Throwable unwrap(Throwable t) {
    Throwable c = t;
    while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
      c = c.getCause();
    }
    return c;
  }
}
