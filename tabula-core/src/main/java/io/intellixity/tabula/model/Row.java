package io.intellixity.tabula.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row with its denormalized cell cache.\n
 *
 * <p>The cache maps column id to a scalar (String, Number or null). Columns added after the row was
 * last written are simply absent and read as null; rows are never rewritten to backfill them.</p>
 */
public record Row(String id, String tableId, Map<String, Object> cache, String search, Instant createdAt) {
  public Row {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tableId, "tableId");
    cache = (cache == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cache));
    search = (search == null) ? "" : search;
  }

  /** Cached value for a column; absent keys read as null. */
  public Object valueOf(String columnId) {
    return cache.get(columnId);
  }
}
