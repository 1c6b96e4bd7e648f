package io.intellixity.tabula.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Writes one {@link Bind} into a prepared statement; dialect modules override JSON handling. */
public interface JdbcBinder {
  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
