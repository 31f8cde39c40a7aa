package io.intellixity.ybadapter.jdbc.yugabyte;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.function.Predicate;

/**
 * Failures worth retrying while opening a connection.\n
 *
 * Broad connection-level failures are retried: those without a SQLSTATE, and those in class
 * {@code 08} (connection exception). Anything carrying a specific server diagnostic
 * (bad password, unknown database, ...) is not.\n
 */
public final class TransientConnectErrors implements Predicate<Throwable> {
  public static final TransientConnectErrors INSTANCE = new TransientConnectErrors();

  private TransientConnectErrors() {}

  @Override
  public boolean test(Throwable t) {
    if (t instanceof SQLTransientConnectionException) return true;
    if (!(t instanceof SQLException e)) return false;
    String state = e.getSQLState();
    return state == null || state.isBlank() || state.startsWith("08");
  }
}
