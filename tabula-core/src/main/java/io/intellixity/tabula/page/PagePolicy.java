package io.intellixity.tabula.page;

/** Page-size policy: fixed first page, follow-up pages sized to the remaining rows up to a ceiling. */
public record PagePolicy(int firstPageSize, int maxPageSize) {
  public static final int DEFAULT_FIRST_PAGE = 500;
  public static final int DEFAULT_MAX_PAGE = 100_000;

  public PagePolicy {
    if (firstPageSize <= 0) throw new IllegalArgumentException("firstPageSize must be > 0");
    if (maxPageSize < firstPageSize) throw new IllegalArgumentException("maxPageSize must be >= firstPageSize");
  }

  public static PagePolicy defaults() {
    return new PagePolicy(DEFAULT_FIRST_PAGE, DEFAULT_MAX_PAGE);
  }

  /** Caller-provided limits override the policy but are still clamped to {@code [1, maxPageSize]}. */
  public int clamp(int requested) {
    return Math.max(1, Math.min(requested, maxPageSize));
  }
}
