package io.intellixity.tabula.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs {@link SqlStatement}s against a {@link DataSource}.\n
 *
 * <p>Statements outside {@link #inTx} use a pooled connection each (autocommit). Inside
 * {@code inTx} the thread's transaction connection is reused; nested calls join the outer
 * transaction.</p>
 */
public final class JdbcExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutor.class);

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final String id;
  private final DataSource ds;
  private final JdbcBinder binder;
  private final ThreadLocal<Connection> txConn = new ThreadLocal<>();

  public JdbcExecutor(String id, DataSource ds, JdbcBinder binder) {
    this.id = Objects.requireNonNull(id, "id");
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  public DataSource dataSource() {
    return ds;
  }

  public <T> T inTx(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    if (txConn.get() != null) return work.get();

    Connection c;
    try {
      c = ds.getConnection();
      c.setAutoCommit(false);
    } catch (SQLException e) {
      throw SqlErrors.translate("begin", e);
    }
    txConn.set(c);
    try {
      T out = work.get();
      c.commit();
      return out;
    } catch (SQLException e) {
      rollbackQuietly(c, e);
      throw SqlErrors.translate("commit", e);
    } catch (RuntimeException | Error e) {
      rollbackQuietly(c, e);
      throw e;
    } finally {
      txConn.remove();
      try {
        c.setAutoCommit(true);
        c.close();
      } catch (SQLException e) {
        log.warn("tabula.jdbc close failed id={}", id, e);
      }
    }
  }

  public void inTx(Runnable work) {
    inTx(() -> {
      work.run();
      return null;
    });
  }

  public <T> List<T> query(String op, SqlStatement ss, RowMapper<T> mapper) {
    return withConnection(op, c -> {
      long start = System.nanoTime();
      debugSql(op, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          List<T> out = new ArrayList<>();
          while (rs.next()) out.add(mapper.map(rs));
          debugDone(op, ss, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    });
  }

  public <T> Optional<T> queryOne(String op, SqlStatement ss, RowMapper<T> mapper) {
    List<T> rows = query(op, ss, mapper);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  public long queryLong(String op, SqlStatement ss) {
    return queryOne(op, ss, rs -> rs.getLong(1)).orElse(0L);
  }

  public long update(String op, SqlStatement ss) {
    if (ss.execKind() != SqlStatement.ExecKind.UPDATE) {
      throw new IllegalArgumentException("Invalid execKind=" + ss.execKind() + " for update; use query() for RETURNING");
    }
    return withConnection(op, c -> {
      long start = System.nanoTime();
      debugSql(op, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        long n = ps.executeUpdate();
        debugDone(op, ss, n, System.nanoTime() - start);
        return n;
      }
    });
  }

  @FunctionalInterface
  private interface ConnectionWork<T> {
    T run(Connection c) throws SQLException;
  }

  private <T> T withConnection(String op, ConnectionWork<T> work) {
    Connection bound = txConn.get();
    try {
      if (bound != null) return work.run(bound);
      try (Connection c = ds.getConnection()) {
        return work.run(c);
      }
    } catch (SQLException e) {
      throw SqlErrors.translate(op, e);
    }
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      binder.bind(ps, i + 1, ss.binds().get(i));
    }
  }

  private void rollbackQuietly(Connection c, Throwable cause) {
    try {
      c.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("tabula.jdbc op={} execKind={} bindCount={} id={} inTx={} sql={}",
        op, ss.execKind(), ss.binds().size(), id, txConn.get() != null, ss.sql());

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("tabula.jdbc bind index={} type={} valueType={} valueLen={}",
            idx++, b.type(), v == null ? "null" : v.getClass().getSimpleName(), vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tabula.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
