package io.intellixity.tabula.jdbc;

import java.util.List;

/** JDBC-ready SQL ({@code ?} placeholders) with binds in placeholder order. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (SELECT, COUNT and UPDATE ... RETURNING). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
