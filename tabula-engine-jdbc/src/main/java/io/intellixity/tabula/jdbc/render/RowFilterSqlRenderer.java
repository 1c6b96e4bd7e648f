package io.intellixity.tabula.jdbc.render;

import io.intellixity.tabula.jdbc.Bind;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.FilterCondition;
import io.intellixity.tabula.model.FilterGroup;
import io.intellixity.tabula.model.LogicOperator;
import io.intellixity.tabula.store.RowFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link RowFilter} into a SQL predicate over the row cache.\n
 *
 * <p>Cell values are read as text with {@code cache ->> columnId}; a missing key, JSON null and
 * the empty string all count as empty. Text comparisons ignore case. Numeric operators parse
 * the cached text and never fail on non-numeric content. Groups are joined with AND; conditions
 * inside a group use the group's operator. A condition on an unknown column never matches.</p>
 */
public final class RowFilterSqlRenderer {
  private static final String NUMERIC = "'^\\s*-?[0-9]+(\\.[0-9]+)?([eE][-+]?[0-9]+)?\\s*$'";

  private final String cacheExpr;
  private final String searchExpr;

  public RowFilterSqlRenderer(String rowAlias) {
    String p = (rowAlias == null || rowAlias.isBlank()) ? "" : rowAlias + ".";
    this.cacheExpr = p + "cache";
    this.searchExpr = p + "search";
  }

  /** Returns an empty string when nothing narrows the rows. */
  public String render(RowFilter filter, Map<String, ColumnType> columnTypes, RenderCtx ctx) {
    if (filter == null || filter.isEmpty()) return "";
    List<String> terms = new ArrayList<>();
    if (!filter.search().isEmpty()) {
      terms.add("strpos(lower(" + searchExpr + "), " + ctx.add(Bind.text(filter.search())) + ") > 0");
    }
    for (FilterGroup g : filter.filters()) {
      String group = renderGroup(g, columnTypes, ctx);
      if (group != null) terms.add(group);
    }
    return String.join(" AND ", terms);
  }

  private String renderGroup(FilterGroup g, Map<String, ColumnType> types, RenderCtx ctx) {
    if (g.conditions().isEmpty()) return null;
    List<String> parts = new ArrayList<>();
    for (FilterCondition c : g.conditions()) parts.add(renderCondition(c, types.get(c.columnId()), ctx));
    String joiner = (g.logic() == LogicOperator.OR) ? " OR " : " AND ";
    return "(" + String.join(joiner, parts) + ")";
  }

  String renderCondition(FilterCondition c, ColumnType type, RenderCtx ctx) {
    if (type == null) return "FALSE";
    String v = "(" + cacheExpr + " ->> " + ctx.add(Bind.text(c.columnId())) + ")";
    String empty = "(" + v + " IS NULL OR " + v + " = '')";
    String num = "(CASE WHEN " + v + " ~ " + NUMERIC + " THEN CAST(" + v + " AS double precision) END)";

    return switch (c.operator()) {
      case IS_EMPTY -> empty;
      case IS_NOT_EMPTY -> "NOT " + empty;
      case EQUALS -> equalsSql(v, num, type, c.value(), ctx);
      case NOT_EQUALS -> "(" + empty + " OR NOT " + equalsSql(v, num, type, c.value(), ctx) + ")";
      case CONTAINS -> containsSql(v, c.value(), ctx);
      case NOT_CONTAINS -> "(" + empty + " OR NOT " + containsSql(v, c.value(), ctx) + ")";
      case GREATER_THAN -> compareSql(num, ">", c.value(), ctx);
      case LESS_THAN -> compareSql(num, "<", c.value(), ctx);
    };
  }

  private static String equalsSql(String v, String num, ColumnType type, Object value, RenderCtx ctx) {
    if (type == ColumnType.NUMBER) return compareSql(num, "=", value, ctx);
    String text = (value == null) ? "" : String.valueOf(value);
    return "COALESCE(lower(" + v + ") = " + ctx.add(Bind.text(text.toLowerCase(Locale.ROOT))) + ", FALSE)";
  }

  private static String containsSql(String v, Object value, RenderCtx ctx) {
    String text = (value == null) ? "" : String.valueOf(value).toLowerCase(Locale.ROOT);
    return "COALESCE(strpos(lower(" + v + "), " + ctx.add(Bind.text(text)) + ") > 0, FALSE)";
  }

  private static String compareSql(String num, String op, Object value, RenderCtx ctx) {
    Double d = toDouble(value);
    if (d == null) return "FALSE";
    return "COALESCE(" + num + " " + op + " " + ctx.add(Bind.number(d)) + ", FALSE)";
  }

  static Double toDouble(Object value) {
    if (value instanceof Number n) return n.doubleValue();
    if (value == null) return null;
    try {
      double d = Double.parseDouble(String.valueOf(value).trim());
      return Double.isFinite(d) ? d : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
