package io.intellixity.tabula.jdbc.postgres;

import io.intellixity.tabula.jdbc.DefaultJdbcBinder;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/** Binds JSON documents as native {@code jsonb} values. */
public final class PostgresJdbcBinder extends DefaultJdbcBinder {
  @Override
  protected void bindJson(PreparedStatement ps, int pos, String json) throws SQLException {
    if (json == null) {
      ps.setNull(pos, Types.OTHER);
      return;
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(json);
    ps.setObject(pos, obj);
  }
}
