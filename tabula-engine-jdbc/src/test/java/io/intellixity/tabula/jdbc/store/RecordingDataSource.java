package io.intellixity.tabula.jdbc.store;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fake DataSource that records prepared SQL and bound values and replays queued result sets.\n
 * Rows are column-name maps; {@code getLong(1)} reads the first value of the row. Commits and
 * rollbacks are logged in {@link #txEvents}.
 */
final class RecordingDataSource {
  record Executed(String sql, Map<Integer, Object> binds) {}

  final List<Executed> executed = new ArrayList<>();
  final List<String> txEvents = new ArrayList<>();
  private final Deque<List<Map<String, Object>>> results = new ArrayDeque<>();
  int updateCount = 1;
  /** Statements whose SQL contains this text fail on execution. */
  String failOn;

  void enqueue(List<Map<String, Object>> rows) {
    results.addLast(rows);
  }

  Executed last() {
    return executed.get(executed.size() - 1);
  }

  DataSource dataSource() {
    return proxy(DataSource.class, (name, args) -> name.equals("getConnection") ? connection() : null);
  }

  private Connection connection() {
    return proxy(Connection.class, (name, args) -> {
      if (name.equals("prepareStatement")) return statement((String) args[0]);
      if (name.equals("commit") || name.equals("rollback")) txEvents.add(name);
      return null;
    });
  }

  private PreparedStatement statement(String sql) {
    Map<Integer, Object> binds = new TreeMap<>();
    executed.add(new Executed(sql, binds));
    return proxy(PreparedStatement.class, (name, args) -> {
      if (name.startsWith("set") && args != null && args.length >= 2 && args[0] instanceof Integer pos) {
        binds.put(pos, name.equals("setNull") ? null : args[1]);
        return null;
      }
      if (name.startsWith("execute") && failOn != null && sql.contains(failOn)) {
        throw new SQLException("forced failure", "23503");
      }
      if (name.equals("executeQuery")) return resultSet(results.isEmpty() ? List.of() : results.removeFirst());
      if (name.equals("executeUpdate")) return updateCount;
      return null;
    });
  }

  private ResultSet resultSet(List<Map<String, Object>> rows) {
    int[] cursor = {-1};
    Object[] lastRead = {null};
    return proxy(ResultSet.class, (name, args) -> {
      if (name.equals("next")) return ++cursor[0] < rows.size();
      if (name.equals("wasNull")) return lastRead[0] == null;
      if (!name.startsWith("get") || args == null || args.length == 0) return null;
      Map<String, Object> row = rows.get(cursor[0]);
      Object v = (args[0] instanceof Integer i) ? new ArrayList<>(row.values()).get(i - 1) : row.get((String) args[0]);
      lastRead[0] = v;
      return v;
    });
  }

  @FunctionalInterface
  private interface Handler {
    Object handle(String method, Object[] args) throws Exception;
  }

  private static <T> T proxy(Class<T> type, Handler handler) {
    Object p = Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] {type}, (self, m, args) -> {
      Object out = handler.handle(m.getName(), args);
      if (out != null || !m.getReturnType().isPrimitive()) return out;
      Class<?> r = m.getReturnType();
      if (r == boolean.class) return false;
      if (r == int.class) return 0;
      if (r == long.class) return 0L;
      if (r == double.class) return 0.0;
      return null;
    });
    return type.cast(p);
  }
}
