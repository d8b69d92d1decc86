package io.intellixity.strata.persistence.jdbc;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Scripted JDBC driver built from dynamic proxies.\n
 *
 * Records one event per call that matters (prepare, bind, execute, tx control); queries answer from
 * {@link #rows}; {@link #failOn} queues one-shot failures matched by SQL fragment.
 */
public final class FakeJdbc {
  public final List<String> events = new ArrayList<>();
  public Function<String, List<Object[]>> rows = sql -> List.of();

  private final List<Failure> failures = new ArrayList<>();
  private int connections;

  private record Failure(String sqlFragment, SQLException error) {}

  public FakeJdbc failOn(String sqlFragment, String sqlState) {
    failures.add(new Failure(sqlFragment, new SQLException("scripted failure on " + sqlFragment, sqlState)));
    return this;
  }

  public int connectionsOpened() { return connections; }

  /** Events starting with {@code prefix}, in order. */
  public List<String> events(String prefix) {
    List<String> out = new ArrayList<>();
    for (String e : events) if (e.startsWith(prefix)) out.add(e);
    return out;
  }

  public DataSource dataSource() {
    return proxy(DataSource.class, (p, m, args) -> {
      switch (m.getName()) {
        case "getConnection": return connection();
        case "toString": return "FakeDataSource";
        case "hashCode": return System.identityHashCode(p);
        case "equals": return p == args[0];
        default: throw new UnsupportedOperationException(m.getName());
      }
    });
  }

  private Connection connection() {
    connections++;
    boolean[] autoCommit = {true};
    return proxy(Connection.class, (p, m, args) -> {
      switch (m.getName()) {
        case "prepareStatement":
          events.add("prepare " + args[0]);
          return statement((String) args[0], (Connection) p);
        case "getAutoCommit": return autoCommit[0];
        case "setAutoCommit":
          autoCommit[0] = (Boolean) args[0];
          events.add("autoCommit " + args[0]);
          return null;
        case "setTransactionIsolation":
          events.add("isolation " + args[0]);
          return null;
        case "commit":
          events.add("commit");
          return null;
        case "rollback":
          events.add("rollback");
          return null;
        case "close":
          events.add("close");
          return null;
        case "createArrayOf":
          events.add("createArrayOf " + args[0] + " " + Arrays.toString((Object[]) args[1]));
          return array((String) args[0], (Object[]) args[1]);
        case "toString": return "FakeConnection";
        case "hashCode": return System.identityHashCode(p);
        case "equals": return p == args[0];
        default: return defaultValue(m.getReturnType());
      }
    });
  }

  private PreparedStatement statement(String sql, Connection connection) {
    return proxy(PreparedStatement.class, (p, m, args) -> {
      String name = m.getName();
      if (name.startsWith("set") && args != null && args.length >= 2) {
        events.add("bind " + args[0] + " " + render(args[1]));
        return null;
      }
      switch (name) {
        case "executeUpdate":
          failIfScripted(sql);
          events.add("executeUpdate");
          return 1;
        case "executeQuery":
          failIfScripted(sql);
          events.add("executeQuery");
          return resultSet(rows.apply(sql));
        case "getConnection": return connection;
        case "close": return null;
        case "toString": return "FakePreparedStatement[" + sql + "]";
        case "hashCode": return System.identityHashCode(p);
        case "equals": return p == args[0];
        default: return defaultValue(m.getReturnType());
      }
    });
  }

  private void failIfScripted(String sql) throws SQLException {
    Iterator<Failure> it = failures.iterator();
    while (it.hasNext()) {
      Failure f = it.next();
      if (sql.contains(f.sqlFragment())) {
        it.remove();
        events.add("fail " + f.error().getSQLState());
        throw f.error();
      }
    }
  }

  private static ResultSet resultSet(List<Object[]> data) {
    int[] cursor = {-1};
    return proxy(ResultSet.class, (p, m, args) -> {
      switch (m.getName()) {
        case "next": return ++cursor[0] < data.size();
        case "getObject": return data.get(cursor[0])[(Integer) args[0] - 1];
        case "close": return null;
        case "toString": return "FakeResultSet";
        case "hashCode": return System.identityHashCode(p);
        case "equals": return p == args[0];
        default: throw new UnsupportedOperationException(m.getName());
      }
    });
  }

  private static Array array(String type, Object[] elements) {
    return proxy(Array.class, (p, m, args) -> {
      switch (m.getName()) {
        case "getArray": return elements;
        case "getBaseTypeName": return type;
        case "toString": return type + Arrays.toString(elements);
        case "hashCode": return System.identityHashCode(p);
        case "equals": return p == args[0];
        default: return defaultValue(m.getReturnType());
      }
    });
  }

  private static String render(Object v) {
    if (v instanceof Object[] a) return Arrays.toString(a);
    return String.valueOf(v);
  }

  private static Object defaultValue(Class<?> type) {
    if (type == boolean.class) return false;
    if (type == int.class) return 0;
    if (type == long.class) return 0L;
    return null;
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, InvocationHandler h) {
    return (T) Proxy.newProxyInstance(FakeJdbc.class.getClassLoader(), new Class<?>[] {type}, h);
  }
}
