package io.intellixity.ybadapter.exec.handle;

import io.intellixity.ybadapter.exec.StatementResult;

import java.sql.SQLException;
import java.util.List;

/**
 * One physical database session.\n
 *
 * A handle is owned by exactly one {@link io.intellixity.ybadapter.exec.Connection} and is never shared
 * between threads. All failures reported by the server or the driver surface as {@link SQLException}.\n
 */
public interface ConnectionHandle extends AutoCloseable {
  /** Execute one statement and buffer its result (if any). */
  StatementResult execute(String sql, List<Object> bindings) throws SQLException;

  default StatementResult execute(String sql) throws SQLException {
    return execute(sql, List.of());
  }

  /** Session-level auto-commit. Transactions are then driven with explicit BEGIN/COMMIT statements. */
  void setAutoCommit(boolean autoCommit) throws SQLException;

  /** Roll back whatever the server considers open on this session. */
  void rollback() throws SQLException;

  /** Server-side process id of this session, used for out-of-band cancellation. */
  int backendPid() throws SQLException;

  boolean isClosed();

  @Override
  void close() throws SQLException;
}
