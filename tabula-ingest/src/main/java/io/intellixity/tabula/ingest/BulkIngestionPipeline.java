package io.intellixity.tabula.ingest;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Populates a table with synthetic rows using a bounded pool of batch writers.\n
 *
 * <ul>
 *   <li>Columns are read once; later schema changes do not affect a running ingestion.</li>
 *   <li>Workers pull unclaimed batches from a shared queue; batch order is not guaranteed.</li>
 *   <li>A failed batch stops further claims. In-flight siblings finish and stay committed.</li>
 *   <li>An interrupted caller stops further claims too, but still waits for in-flight batches so the
 *       reported committed count is final. The interrupt flag is restored before returning.</li>
 * </ul>
 */
public final class BulkIngestionPipeline {
  private static final Logger log = LoggerFactory.getLogger(BulkIngestionPipeline.class);
  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final TableStore tables;
  private final StreamingRowWriter writer;
  private final IngestOptions options;
  private final LongSupplier seeds;

  public BulkIngestionPipeline(TableStore tables, StreamingRowWriter writer, IngestOptions options) {
    this(tables, writer, options, new SecureRandom()::nextLong);
  }

  public BulkIngestionPipeline(TableStore tables, StreamingRowWriter writer, IngestOptions options, LongSupplier seeds) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.options = Objects.requireNonNull(options, "options");
    this.seeds = Objects.requireNonNull(seeds, "seeds");
  }

  public IngestionResult ingest(String tableId, int count) {
    return ingest(tableId, count, IngestionListener.NONE);
  }

  public IngestionResult ingest(String tableId, int count, IngestionListener listener) {
    Objects.requireNonNull(tableId, "tableId");
    IngestionListener l = (listener == null) ? IngestionListener.NONE : listener;
    if (count < 0 || count > IngestOptions.MAX_ROWS_PER_REQUEST) {
      throw new ValidationException("Row count must be between 0 and " + IngestOptions.MAX_ROWS_PER_REQUEST + ", got " + count);
    }
    if (count == 0) return IngestionResult.added(0);

    tables.findTable(tableId).orElseThrow(() -> new NotFoundException("table", tableId));
    List<Column> columns = List.copyOf(tables.listColumns(tableId));
    BatchPlanner.Plan plan = BatchPlanner.plan(count, options.batchSize(), options.maxConcurrency());

    log.info("tabula.ingest start tableId={} rows={} columns={} batches={} workers={}",
        tableId, count, columns.size(), plan.batches().size(), plan.workers());
    long t0 = System.nanoTime();

    Queue<BatchPlanner.Batch> unclaimed = new ConcurrentLinkedQueue<>(plan.batches());
    AtomicBoolean stop = new AtomicBoolean();
    AtomicInteger committed = new AtomicInteger();
    AtomicReference<Throwable> firstFailure = new AtomicReference<>();
    List<Integer> failedBatches = Collections.synchronizedList(new ArrayList<>());

    Callable<Void> worker = () -> {
      BatchPlanner.Batch b;
      while (!stop.get() && (b = unclaimed.poll()) != null) {
        try {
          long seed = seeds.getAsLong();
          int n = writer.writeBatch(tableId, columns, b.size(), seed);
          int total = committed.addAndGet(n);
          log.debug("tabula.ingest batch={} rows={} committedTotal={}", b.index(), n, total);
          l.onBatchCommitted(b, total, count);
        } catch (RuntimeException | Error e) {
          stop.set(true);
          failedBatches.add(b.index());
          firstFailure.compareAndSet(null, e);
          log.warn("tabula.ingest batch failed tableId={} batch={} rows={}", tableId, b.index(), b.size(), e);
          l.onBatchFailed(b, e);
        }
      }
      return null;
    };

    ExecutorService pool = Executors.newFixedThreadPool(plan.workers(), threadFactory());
    try {
      List<Future<Void>> futures = new ArrayList<>(plan.workers());
      for (int i = 0; i < plan.workers(); i++) futures.add(pool.submit(worker));
      for (Future<Void> f : futures) {
        awaitWorker(f, stop, firstFailure);
      }
    } finally {
      drain(pool);
    }

    Throwable failure = firstFailure.get();
    if (failure != null) {
      List<Integer> failed;
      synchronized (failedBatches) {
        failed = new ArrayList<>(failedBatches);
      }
      Collections.sort(failed);
      log.error("tabula.ingest failed tableId={} rowsCommitted={} requested={} failedBatches={}",
          tableId, committed.get(), count, failed);
      throw new BulkIngestionException(tableId, committed.get(), failed, failure);
    }

    log.info("tabula.ingest done tableId={} rows={} durationMs={}", tableId, count, (System.nanoTime() - t0) / 1_000_000);
    return IngestionResult.added(count);
  }

  private static void awaitWorker(Future<Void> f, AtomicBoolean stop, AtomicReference<Throwable> firstFailure) {
    try {
      f.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stop.set(true);
      firstFailure.compareAndSet(null, e);
    } catch (ExecutionException e) {
      firstFailure.compareAndSet(null, e.getCause());
    }
  }

  private static void drain(ExecutorService pool) {
    pool.shutdown();
    boolean interrupted = Thread.interrupted();
    try {
      while (true) {
        try {
          if (pool.awaitTermination(1, TimeUnit.SECONDS)) return;
          log.debug("tabula.ingest waiting for in-flight batches");
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory threadFactory() {
    int pool = POOL_SEQ.incrementAndGet();
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "tabula-ingest-" + pool + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
