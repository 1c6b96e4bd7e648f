package io.intellixity.tabula.ingest.copy;

/**
 * CSV line encoding for {@code COPY ... WITH (FORMAT csv, NULL '\N')}.\n
 *
 * Every non-null value is double-quoted with inner quotes doubled, so a quoted {@code "\N"} is the
 * literal text and only the unquoted {@code \N} token reads back as null.\n
 */
public final class CopyLineEncoder {
  public static final String NULL_TOKEN = "\\N";
  public static final String COPY_OPTIONS = "WITH (FORMAT csv, NULL '\\N')";

  private CopyLineEncoder() {}

  public static String line(Object... values) {
    StringBuilder sb = new StringBuilder(32 * Math.max(1, values.length));
    for (int i = 0; i < values.length; i++) {
      if (i > 0) sb.append(',');
      appendValue(sb, values[i]);
    }
    return sb.append('\n').toString();
  }

  static void appendValue(StringBuilder sb, Object v) {
    if (v == null) {
      sb.append(NULL_TOKEN);
      return;
    }
    String s = (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d))
        ? Long.toString(d.longValue())
        : String.valueOf(v);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '"') sb.append('"');
      sb.append(c);
    }
    sb.append('"');
  }
}
