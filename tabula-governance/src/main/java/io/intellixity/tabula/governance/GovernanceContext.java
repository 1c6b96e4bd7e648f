package io.intellixity.tabula.governance;

import java.util.Map;
import java.util.Objects;

/**
 * Per-request governance context.\n
 *
 * The only key every store operation relies on is {@link #USER_ID}; other keys are carried for
 * logging and future scoping.\n
 */
public interface GovernanceContext {
  String USER_ID = "userId";

  /** Return a context value or null if absent. */
  Object get(String key);

  /** Stable cache identity for this context (used by the ownership cache). */
  String cacheKey();

  /** Return a required context value; throws if missing. */
  default Object getRequired(String key) {
    Objects.requireNonNull(key, "key");
    Object v = get(key);
    if (v == null) throw new IllegalStateException("Missing GovernanceContext key: " + key);
    return v;
  }

  /** The acting user; every table, view and row query is scoped by it. */
  default String userId() {
    return String.valueOf(getRequired(USER_ID));
  }

  static GovernanceContext forUser(String userId) {
    Objects.requireNonNull(userId, "userId");
    return of(Map.of(USER_ID, userId), "user:" + userId);
  }

  /** Simple map-backed context with an explicit stable cache key. */
  static GovernanceContext of(Map<String, ?> values, String cacheKey) {
    Map<String, ?> m = values == null ? Map.of() : Map.copyOf(values);
    String ck = (cacheKey == null || cacheKey.isBlank()) ? ("map:" + m.hashCode()) : cacheKey;
    return new GovernanceContext() {
      @Override public Object get(String key) { return m.get(key); }
      @Override public String cacheKey() { return ck; }
      @Override public String toString() { return "GovernanceContext[" + ck + "]"; }
    };
  }
}
