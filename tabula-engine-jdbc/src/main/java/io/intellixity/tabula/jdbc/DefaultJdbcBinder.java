package io.intellixity.tabula.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Portable binder; JSON documents are bound as text. */
public class DefaultJdbcBinder implements JdbcBinder {
  @Override
  public void bind(PreparedStatement ps, int pos, Bind b) throws SQLException {
    Object v = b.value();
    switch (b.type()) {
      case TEXT -> {
        if (v == null) ps.setNull(pos, Types.VARCHAR);
        else ps.setString(pos, v.toString());
      }
      case INT -> {
        if (v == null) ps.setNull(pos, Types.INTEGER);
        else ps.setInt(pos, ((Number) v).intValue());
      }
      case LONG -> {
        if (v == null) ps.setNull(pos, Types.BIGINT);
        else ps.setLong(pos, ((Number) v).longValue());
      }
      case DOUBLE -> {
        if (v == null) ps.setNull(pos, Types.DOUBLE);
        else ps.setDouble(pos, ((Number) v).doubleValue());
      }
      case TIMESTAMP -> {
        if (v == null) ps.setNull(pos, Types.TIMESTAMP_WITH_TIMEZONE);
        else ps.setObject(pos, OffsetDateTime.ofInstant((Instant) v, ZoneOffset.UTC));
      }
      case JSON -> bindJson(ps, pos, v == null ? null : v.toString());
    }
  }

  protected void bindJson(PreparedStatement ps, int pos, String json) throws SQLException {
    if (json == null) ps.setNull(pos, Types.VARCHAR);
    else ps.setString(pos, json);
  }
}
