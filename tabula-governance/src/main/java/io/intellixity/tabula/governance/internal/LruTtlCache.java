package io.intellixity.tabula.governance.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache with expire-after-write.\n
 *
 * Expired entries are dropped lazily on access; the eldest entry is evicted once
 * {@code maxEntries} is exceeded. Null values are never cached.\n
 */
public final class LruTtlCache<K, V> {
  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<K, Stamped<V>> map;

  private record Stamped<V>(V value, long writtenAt) {}

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.map = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, Stamped<V>> eldest) {
        return size() > maxEntries;
      }
    };
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Stamped<V> s = map.get(key);
    if (s == null) return null;
    if (ttlMillis > 0 && nowMillis.getAsLong() - s.writtenAt() >= ttlMillis) {
      map.remove(key);
      return null;
    }
    return s.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    map.put(key, new Stamped<>(value, nowMillis.getAsLong()));
  }

  /** Returns the cached value or loads, caches and returns it. A null load is returned but not cached. */
  public synchronized V getOrLoad(K key, Supplier<V> loader) {
    Objects.requireNonNull(loader, "loader");
    V existing = get(key);
    if (existing != null) return existing;
    V loaded = loader.get();
    if (loaded != null) put(key, loaded);
    return loaded;
  }

  public synchronized void invalidate(K key) {
    map.remove(key);
  }

  public synchronized int size() {
    return map.size();
  }
}
