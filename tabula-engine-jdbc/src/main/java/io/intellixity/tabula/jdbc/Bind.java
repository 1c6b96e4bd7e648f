package io.intellixity.tabula.jdbc;

import java.time.Instant;
import java.util.Objects;

/** A typed JDBC parameter value. JSON binds carry the already-encoded document text. */
public record Bind(Object value, BindType type) {
  public Bind {
    Objects.requireNonNull(type, "type");
  }

  public static Bind text(String v) { return new Bind(v, BindType.TEXT); }
  public static Bind integer(int v) { return new Bind(v, BindType.INT); }
  public static Bind longValue(long v) { return new Bind(v, BindType.LONG); }
  public static Bind number(Double v) { return new Bind(v, BindType.DOUBLE); }
  public static Bind timestamp(Instant v) { return new Bind(v, BindType.TIMESTAMP); }
  public static Bind json(String v) { return new Bind(v, BindType.JSON); }
}
