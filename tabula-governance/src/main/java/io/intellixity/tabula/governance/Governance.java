package io.intellixity.tabula.governance;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-bound acting-user context.\n
 *
 * Scopes nest: the previous context is restored when {@link #inContext} returns or throws.
 * Work handed to other threads must be wrapped with {@link #propagating(Runnable)}.\n
 */
public final class Governance {
  private Governance() {}

  private static final ThreadLocal<GovernanceContext> CTX = new ThreadLocal<>();

  /** Execute work within a governance context boundary. */
  public static <T> T inContext(GovernanceContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    GovernanceContext prev = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (prev == null) CTX.remove();
      else CTX.set(prev);
    }
  }

  public static void inContext(GovernanceContext ctx, Runnable work) {
    Objects.requireNonNull(work, "work");
    inContext(ctx, () -> {
      work.run();
      return null;
    });
  }

  /** Capture the caller's context so {@code work} sees it on whichever thread runs it. */
  public static Runnable propagating(Runnable work) {
    Objects.requireNonNull(work, "work");
    GovernanceContext captured = currentOrNull();
    if (captured == null) return work;
    return () -> inContext(captured, work);
  }

  public static GovernanceContext currentOrNull() {
    return CTX.get();
  }

  public static GovernanceContext currentOrThrow() {
    GovernanceContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("No GovernanceContext bound in current scope");
    return c;
  }
}
