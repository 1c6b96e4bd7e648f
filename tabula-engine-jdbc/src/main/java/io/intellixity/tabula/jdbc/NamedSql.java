package io.intellixity.tabula.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles SQL containing named parameters ({@code :tableId}) into JDBC SQL with {@code ?} binds.\n
 *
 * Rules:\n
 * - Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a SQL cast, not a param.\n
 * - Text inside single quotes is copied verbatim.\n
 * - A name used twice is bound twice.\n
 */
public final class NamedSql {
  private NamedSql() {}

  public static SqlStatement compile(String sql, Map<String, Bind> params, SqlStatement.ExecKind kind) {
    if (sql == null) throw new IllegalArgumentException("sql is required");
    Map<String, Bind> effective = (params == null) ? Map.of() : params;

    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Bind> binds = new ArrayList<>();
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          if (!effective.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
          binds.add(effective.get(name));
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }
    return new SqlStatement(out.toString(), binds, kind);
  }

  public static SqlStatement query(String sql, Map<String, Bind> params) {
    return compile(sql, params, SqlStatement.ExecKind.QUERY);
  }

  public static SqlStatement update(String sql, Map<String, Bind> params) {
    return compile(sql, params, SqlStatement.ExecKind.UPDATE);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
