package io.intellixity.ybadapter.jdbc.yugabyte;

import io.intellixity.ybadapter.error.AdapterRuntimeException;
import io.intellixity.ybadapter.error.DatabaseException;
import io.intellixity.ybadapter.events.AdapterEventListener;
import io.intellixity.ybadapter.exec.AdapterResponse;
import io.intellixity.ybadapter.exec.Connection;
import io.intellixity.ybadapter.exec.Credentials;
import io.intellixity.ybadapter.exec.StatementResult;
import io.intellixity.ybadapter.exec.handle.ConnectionHandle;
import io.intellixity.ybadapter.exec.handle.SessionFactory;
import io.intellixity.ybadapter.jdbc.JdbcSessionFactory;
import io.intellixity.ybadapter.spi.exec.AbstractConnectionManager;
import io.intellixity.ybadapter.spi.exec.RetryPolicy;
import io.intellixity.ybadapter.spi.exec.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection manager for YugabyteDB (YSQL).\n
 *
 * Sessions run in auto-commit mode; transactions are driven with explicit BEGIN/COMMIT statements
 * and can be switched off entirely with {@code enable_transaction: false}.\n
 */
public final class YugabyteConnectionManager extends AbstractConnectionManager<YugabyteCredentials> {
  private static final Logger log = LoggerFactory.getLogger(YugabyteConnectionManager.class);

  private final SessionFactory sessions;

  public YugabyteConnectionManager(YugabyteCredentials credentials) {
    this(credentials, new JdbcSessionFactory(), null, Sleeper.SYSTEM);
  }

  public YugabyteConnectionManager(YugabyteCredentials credentials,
                                   SessionFactory sessions,
                                   AdapterEventListener events,
                                   Sleeper sleeper) {
    super(credentials, events, sleeper);
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  @Override
  public String type() { return YugabyteCredentials.TYPE; }

  static YugabyteCredentials getCredentials(Credentials credentials) {
    if (credentials instanceof YugabyteCredentials yc) return yc;
    throw new IllegalArgumentException("Expected " + YugabyteCredentials.TYPE + " credentials, got "
        + (credentials == null ? "null" : credentials.type()));
  }

  static RetryPolicy retryPolicy(YugabyteCredentials credentials) {
    return new RetryPolicy(credentials.retries(), RetryPolicy::quadraticBackoff, TransientConnectErrors.INSTANCE);
  }

  @Override
  public Connection open(Connection connection) {
    if (connection.isOpen()) {
      log.debug("Connection is already open, skipping open.");
      return connection;
    }

    YugabyteCredentials credentials = getCredentials(connection.credentials());
    YugabyteSessionOptions options = YugabyteSessionOptions.from(credentials);
    String url = options.jdbcUrl();
    Properties props = options.toJdbcProperties();

    return retryConnection(connection, () -> connect(url, props, credentials), retryPolicy(credentials));
  }

  private ConnectionHandle connect(String url, Properties props, YugabyteCredentials credentials) throws SQLException {
    ConnectionHandle handle = sessions.connect(url, props);
    try {
      handle.setAutoCommit(true);
      if (credentials.role() != null && !credentials.role().isEmpty()) {
        handle.execute("set role " + credentials.role());
      }
      return handle;
    } catch (SQLException | RuntimeException e) {
      try {
        handle.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  /**
   * Start a transaction on the calling thread's connection.\n
   *
   * YugabyteDB can report a transaction as still in progress on a session where none was begun.
   * A COMMIT is therefore issued before BEGIN, and whatever it raises is ignored. Local state moves to
   * "transaction open" even when transactions are disabled.\n
   */
  @Override
  public Connection begin() {
    Connection connection = getThreadConnection();
    requireNoTransaction(connection);
    // open failures must surface here, not be mistaken for a failed pre-commit
    ensureOpen(connection);

    if (getCredentials(connection.credentials()).enableTransaction()) {
      try {
        addCommitQuery();
      } catch (RuntimeException e) {
        log.debug("ybadapter.connection op=pre_begin_commit name={} ignored={}", connection.name(), e.getMessage());
      }
      addBeginQuery();
    }

    connection.transactionOpen(true);
    return connection;
  }

  @Override
  public Connection commit() {
    Connection connection = getThreadConnection();
    requireTransaction(connection);

    if (getCredentials(connection.credentials()).enableTransaction()) {
      events().sqlCommit(connection.name());
      addCommitQuery();
    }

    connection.transactionOpen(false);
    return connection;
  }

  /**
   * Database errors are reported with the server's message after a best-effort rollback whose own
   * failure is only logged. Any other failure triggers a rollback that is allowed to fail loudly;
   * adapter runtime errors then pass through unchanged and everything else is wrapped.
   */
  @Override
  protected <T> T exceptionHandler(String sql, SqlWork<T> work) {
    try {
      return work.run();
    } catch (SQLException e) {
      log.debug("Yugabytedb error: {}", e.getMessage());
      try {
        rollbackIfOpen();
      } catch (RuntimeException rollbackError) {
        log.debug("Failed to release connection!", rollbackError);
      }
      throw new DatabaseException(describe(e), e);
    } catch (Exception e) {
      log.debug("Error running SQL: {}", sql);
      log.debug("Rolling back transaction.");
      rollbackIfOpen();
      if (e instanceof AdapterRuntimeException are) throw are;
      throw new AdapterRuntimeException(describe(e), e);
    }
  }

  /**
   * Ask the server to terminate the backend running {@code connection}. The request goes over the calling
   * thread's own connection. Termination is advisory: any failure while requesting it is logged and dropped.
   */
  @Override
  public void cancel(Connection connection) {
    String name = connection.name();
    ConnectionHandle handle = connection.handle();
    if (handle == null || handle.isClosed()) {
      log.debug("Connection {} was already closed", name);
      return;
    }

    int pid;
    try {
      pid = handle.backendPid();
    } catch (SQLException e) {
      if (handle.isClosed()) {
        log.debug("Connection {} was already closed", name);
        return;
      }
      throw new DatabaseException(describe(e), e);
    }

    try {
      String sql = "select pg_terminate_backend(" + pid + ")";
      log.debug("Cancelling query '{}' ({})", name, pid);
      StatementResult result = addQuery(sql, true, List.of());
      log.debug("Cancel query '{}': {}", name, result.table().firstRow().orElse(List.of()));
    } catch (RuntimeException e) {
      log.debug("ybadapter.connection op=cancel name={} pid={} ignored={}", name, pid, e.getMessage());
    }
  }

  /** Response with the numeric tokens of the status message dropped from the code ({@code INSERT 0 1} -> {@code INSERT}). */
  @Override
  public AdapterResponse getResponse(StatementResult result) {
    String message = (result.statusMessage() == null) ? "" : result.statusMessage();
    List<String> words = new ArrayList<>();
    for (String part : message.trim().split("\\s+")) {
      if (!part.isEmpty() && !isDigits(part)) words.add(part);
    }
    return new AdapterResponse(message, String.join(" ", words), result.rowCount());
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) return false;
    }
    return true;
  }
}
