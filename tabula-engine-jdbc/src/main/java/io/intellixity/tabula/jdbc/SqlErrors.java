package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.error.TransientStoreException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

/** Maps driver failures onto the store error taxonomy. */
public final class SqlErrors {
  private SqlErrors() {}

  public static RuntimeException translate(String op, SQLException e) {
    if (isTransient(e)) {
      return new TransientStoreException("Store unavailable during " + op + ": " + e.getMessage(), e);
    }
    return new IllegalStateException("SQL failure during " + op + " (SQLState=" + e.getSQLState() + ")", e);
  }

  /** Connection loss (SQLState class 08), timeouts, cancellations and serialization retries. */
  public static boolean isTransient(SQLException e) {
    if (e instanceof SQLTimeoutException || e instanceof SQLTransientException) return true;
    String state = e.getSQLState();
    if (state == null) return false;
    return state.startsWith("08") || state.equals("57014") || state.equals("40001") || state.equals("40P01");
  }
}
