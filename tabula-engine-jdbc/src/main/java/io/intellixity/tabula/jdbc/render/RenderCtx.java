package io.intellixity.tabula.jdbc.render;

import io.intellixity.tabula.jdbc.Bind;

import java.util.LinkedHashMap;
import java.util.Map;

/** Collects binds for a rendered fragment and hands out unique named placeholders. */
public final class RenderCtx {
  private final String prefix;
  private int n = 1;
  private final Map<String, Bind> params = new LinkedHashMap<>();

  public RenderCtx(String prefix) {
    this.prefix = prefix;
  }

  public String add(Bind b) {
    String name = prefix + (n++);
    params.put(name, b);
    return ":" + name;
  }

  /** Named binds in creation order; merge into the statement's parameter map. */
  public Map<String, Bind> params() {
    return params;
  }
}
