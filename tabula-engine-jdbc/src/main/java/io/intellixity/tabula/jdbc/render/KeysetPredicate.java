package io.intellixity.tabula.jdbc.render;

import io.intellixity.tabula.jdbc.Bind;

import java.util.ArrayList;
import java.util.List;

/**
 * Strict lexicographic "after" predicate for ascending keyset pagination.\n
 *
 * For keys (a, b) and last-seen values (v1, v2) renders {@code (a > v1) OR (a = v1 AND b > v2)}.
 */
public final class KeysetPredicate {
  private KeysetPredicate() {}

  public static String after(List<String> exprs, List<Bind> lastSeen, RenderCtx ctx) {
    if (exprs.isEmpty() || exprs.size() != lastSeen.size()) {
      throw new IllegalArgumentException("keyset needs one value per key expression");
    }
    List<String> orTerms = new ArrayList<>();
    for (int i = 0; i < exprs.size(); i++) {
      List<String> andTerms = new ArrayList<>();
      for (int j = 0; j < i; j++) {
        andTerms.add(exprs.get(j) + " = " + ctx.add(lastSeen.get(j)));
      }
      andTerms.add(exprs.get(i) + " > " + ctx.add(lastSeen.get(i)));
      orTerms.add("(" + String.join(" AND ", andTerms) + ")");
    }
    return "(" + String.join(" OR ", orTerms) + ")";
  }
}
