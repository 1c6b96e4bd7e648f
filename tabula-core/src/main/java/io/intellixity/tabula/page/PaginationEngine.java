package io.intellixity.tabula.page;

import io.intellixity.tabula.model.Row;
import io.intellixity.tabula.store.RowFilter;
import io.intellixity.tabula.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Forward-only keyset pagination over a table's rows.\n
 *
 * <p>Each call reads N+1 rows ordered by {@code (createdAt, id)}; the extra row only signals that
 * another page exists. The cursor is the N-th row's key, so rows committed concurrently are either
 * before the cursor (already served or never visible) or after it (served later), never both.</p>
 *
 * <p>Store reads that fail transiently are retried through {@link ReadRetry}.</p>
 */
public final class PaginationEngine {
  private static final Logger log = LoggerFactory.getLogger(PaginationEngine.class);

  private final RowStore rows;
  private final PagePolicy policy;
  private final ReadRetry retry;

  public PaginationEngine(RowStore rows, PagePolicy policy) {
    this(rows, policy, ReadRetry.defaults());
  }

  public PaginationEngine(RowStore rows, PagePolicy policy, ReadRetry retry) {
    this.rows = Objects.requireNonNull(rows, "rows");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  /** Rows of the table matching {@code filter}. */
  public long count(String tableId, RowFilter filter) {
    RowFilter f = (filter == null) ? RowFilter.none() : filter;
    return retry.call("row.count", () -> rows.count(tableId, f));
  }

  public RowPage getPage(String tableId, String cursorToken, Integer limit) {
    return getPage(tableId, cursorToken, limit, RowFilter.none());
  }

  public RowPage getPage(String tableId, String cursorToken, Integer limit, RowFilter filter) {
    Objects.requireNonNull(tableId, "tableId");
    RowFilter f = (filter == null) ? RowFilter.none() : filter;

    Optional<Cursor> cursor = CursorCodec.decode(cursorToken);
    if (cursorToken != null && !cursorToken.isBlank() && cursor.isEmpty()) {
      log.debug("tabula.page malformed cursor, serving first page tableId={}", tableId);
    }
    Cursor after = cursor.orElse(null);

    long total = count(tableId, f);
    int pageSize = pageSize(tableId, after, limit, f);

    List<Row> fetched = retry.call("row.range", () -> rows.rangeAfter(tableId, after, pageSize + 1, f));
    boolean hasMore = fetched.size() > pageSize;
    List<Row> page = hasMore ? fetched.subList(0, pageSize) : fetched;
    String next = hasMore ? CursorCodec.encode(Cursor.of(page.get(page.size() - 1))) : null;

    if (log.isDebugEnabled()) {
      log.debug("tabula.page tableId={} after={} pageSize={} returned={} hasMore={} total={}",
          tableId, after, pageSize, page.size(), hasMore, total);
    }
    return new RowPage(page, next, hasMore, total);
  }

  private int pageSize(String tableId, Cursor after, Integer limit, RowFilter f) {
    if (limit != null) return policy.clamp(limit);
    if (after == null) return policy.firstPageSize();
    long remaining = retry.call("row.count_after", () -> rows.countAfter(tableId, after, f));
    return policy.clamp((int) Math.min(Integer.MAX_VALUE, Math.max(1L, remaining)));
  }
}
