package io.intellixity.ybadapter.jdbc;

import io.intellixity.ybadapter.exec.ResultTable;
import io.intellixity.ybadapter.exec.StatementResult;
import io.intellixity.ybadapter.exec.handle.ConnectionHandle;
import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** JDBC-backed session (one {@link java.sql.Connection}). */
public final class JdbcConnectionHandle implements ConnectionHandle {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnectionHandle.class);

  private final String id;
  private final Connection connection;

  public JdbcConnectionHandle(String id, Connection connection) {
    this.id = Objects.requireNonNull(id, "id");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public String id() { return id; }
  public Connection connection() { return connection; }

  @Override
  public StatementResult execute(String sql, List<Object> bindings) throws SQLException {
    Objects.requireNonNull(sql, "sql");
    long start = System.nanoTime();
    if (bindings == null || bindings.isEmpty()) {
      try (Statement st = connection.createStatement()) {
        return done(sql, st.execute(sql), st, start);
      }
    }
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      for (int i = 0; i < bindings.size(); i++) ps.setObject(i + 1, bindings.get(i));
      return done(sql, ps.execute(), ps, start);
    }
  }

  private StatementResult done(String sql, boolean hasResultSet, Statement st, long start) throws SQLException {
    StatementResult result;
    if (hasResultSet) {
      try (ResultSet rs = st.getResultSet()) {
        ResultTable table = readTable(rs);
        result = new StatementResult(CommandTags.of(sql, table.size()), table.size(), table);
      }
    } else {
      long n = st.getLargeUpdateCount();
      result = StatementResult.of(CommandTags.of(sql, n), n);
    }
    if (log.isDebugEnabled()) {
      log.debug("ybadapter.jdbc_done handleId={} status={} durationMs={}",
          id, result.statusMessage(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return result;
  }

  private static ResultTable readTable(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> cols = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) cols.add(md.getColumnLabel(i));
    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) row.add(rs.getObject(i));
      rows.add(row);
    }
    return new ResultTable(cols, rows);
  }

  @Override
  public void setAutoCommit(boolean autoCommit) throws SQLException {
    connection.setAutoCommit(autoCommit);
  }

  /** In auto-commit mode transactions are opened with an explicit BEGIN, so they are closed the same way. */
  @Override
  public void rollback() throws SQLException {
    if (connection.getAutoCommit()) {
      try (Statement st = connection.createStatement()) {
        st.execute("ROLLBACK");
      }
    } else {
      connection.rollback();
    }
  }

  @Override
  public int backendPid() throws SQLException {
    return connection.unwrap(PGConnection.class).getBackendPID();
  }

  @Override
  public boolean isClosed() {
    try {
      return connection.isClosed();
    } catch (SQLException e) {
      log.debug("ybadapter.jdbc op=is_closed handleId={} error={}", id, e.getMessage());
      return true;
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }

  @Override
  public String toString() { return "JdbcConnectionHandle{" + id + "}"; }
}
