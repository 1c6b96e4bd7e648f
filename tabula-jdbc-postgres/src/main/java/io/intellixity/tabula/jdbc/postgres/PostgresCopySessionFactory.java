package io.intellixity.tabula.jdbc.postgres;

import io.intellixity.tabula.ingest.copy.BufferedCopyLineStream;
import io.intellixity.tabula.ingest.copy.CopySession;
import io.intellixity.tabula.ingest.copy.CopySessionFactory;
import io.intellixity.tabula.jdbc.SqlErrors;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyIn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Copy sessions over pooled Postgres connections.\n
 *
 * Each session takes its own connection, turns autocommit off and relaxes
 * {@code synchronous_commit} for that transaction only. Bulk rows are durable at commit time but
 * the commit does not wait for the WAL flush.\n
 */
public final class PostgresCopySessionFactory implements CopySessionFactory {
  private static final Logger log = LoggerFactory.getLogger(PostgresCopySessionFactory.class);

  private final DataSource ds;

  public PostgresCopySessionFactory(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public CopySession begin() {
    Connection c = null;
    try {
      c = ds.getConnection();
      c.setAutoCommit(false);
      try (Statement st = c.createStatement()) {
        st.execute("SET LOCAL synchronous_commit = off");
      }
      return new PgCopySession(c);
    } catch (SQLException e) {
      if (c != null) closeQuietly(c, e);
      throw SqlErrors.translate("copy.begin", e);
    }
  }

  private static void closeQuietly(Connection c, Exception cause) {
    try {
      c.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  static String label(String copySql) {
    String[] parts = copySql.trim().split("\\s+");
    return parts.length > 1 ? parts[1] : copySql;
  }

  private static final class PgCopySession implements CopySession {
    private final Connection c;

    PgCopySession(Connection c) {
      this.c = c;
    }

    @Override
    public BufferedCopyLineStream openCopy(String copySql, int highWaterMark) {
      try {
        CopyIn in = c.unwrap(PGConnection.class).getCopyAPI().copyIn(copySql);
        return new PgCopyLineStream(in, highWaterMark, label(copySql));
      } catch (SQLException e) {
        throw SqlErrors.translate("copy.open", e);
      }
    }

    @Override
    public void commit() {
      try {
        c.commit();
      } catch (SQLException e) {
        throw SqlErrors.translate("copy.commit", e);
      }
    }

    @Override
    public void rollback() {
      try {
        c.rollback();
      } catch (SQLException e) {
        throw SqlErrors.translate("copy.rollback", e);
      }
    }

    @Override
    public void close() {
      try {
        c.setAutoCommit(true);
      } catch (SQLException e) {
        log.debug("tabula.copy reset autocommit failed", e);
      }
      try {
        c.close();
      } catch (SQLException e) {
        log.warn("tabula.copy close failed", e);
      }
    }
  }
}
