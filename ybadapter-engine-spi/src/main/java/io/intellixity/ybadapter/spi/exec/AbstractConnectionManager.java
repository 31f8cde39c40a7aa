package io.intellixity.ybadapter.spi.exec;

import io.intellixity.ybadapter.error.ConnectionException;
import io.intellixity.ybadapter.error.DatabaseException;
import io.intellixity.ybadapter.error.InternalException;
import io.intellixity.ybadapter.error.InvalidConnectionException;
import io.intellixity.ybadapter.events.AdapterEventListener;
import io.intellixity.ybadapter.events.LoggingAdapterEventListener;
import io.intellixity.ybadapter.exec.AdapterResponse;
import io.intellixity.ybadapter.exec.Connection;
import io.intellixity.ybadapter.exec.ConnectionState;
import io.intellixity.ybadapter.exec.Credentials;
import io.intellixity.ybadapter.exec.ExecutionResult;
import io.intellixity.ybadapter.exec.ResultTable;
import io.intellixity.ybadapter.exec.StatementResult;
import io.intellixity.ybadapter.exec.handle.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template-method base for connection managers.\n
 *
 * Responsibilities:\n
 * - One {@link Connection} per thread, registered via {@link #setConnectionName(String)}\n
 * - Lazy open on first use, with bounded retries ({@link #retryConnection})\n
 * - Transaction state machine ({@link #begin()} / {@link #commit()} / {@link #rollbackIfOpen()})\n
 * - Statement execution routed through the backend's {@link #exceptionHandler}\n
 *
 * Backends supply open/cancel, error translation and response normalization.\n
 */
public abstract class AbstractConnectionManager<C extends Credentials> {
  private static final Logger log = LoggerFactory.getLogger(AbstractConnectionManager.class);

  private final C credentials;
  private final AdapterEventListener events;
  private final Sleeper sleeper;
  private final Map<Long, Connection> threadConnections = new ConcurrentHashMap<>();
  private final Object lock = new Object();

  protected AbstractConnectionManager(C credentials, AdapterEventListener events, Sleeper sleeper) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.events = (events == null) ? new LoggingAdapterEventListener() : events;
    this.sleeper = (sleeper == null) ? Sleeper.SYSTEM : sleeper;
  }

  protected AbstractConnectionManager(C credentials) {
    this(credentials, new LoggingAdapterEventListener(), Sleeper.SYSTEM);
  }

  /** Adapter type tag (e.g. {@code yugabytedb}). */
  public abstract String type();

  /** Open {@code connection}; returns it unchanged when it is already open. */
  public abstract Connection open(Connection connection);

  /** Best-effort request to stop whatever {@code connection} is running on the server. */
  public abstract void cancel(Connection connection);

  /** Run one unit of SQL work, translating failures into the adapter's error taxonomy. */
  protected abstract <T> T exceptionHandler(String sql, SqlWork<T> work);

  public abstract AdapterResponse getResponse(StatementResult result);

  /** Unit of work run under {@link #exceptionHandler}. */
  @FunctionalInterface
  public interface SqlWork<T> {
    T run() throws Exception;
  }

  /** One attempt at establishing a session. */
  @FunctionalInterface
  public interface Connector {
    ConnectionHandle connect() throws Exception;
  }

  public final C credentials() { return credentials; }

  protected final AdapterEventListener events() { return events; }

  // ---------------------------------------------------------------------------------------------
  // Thread registry
  // ---------------------------------------------------------------------------------------------

  protected static long currentThreadKey() {
    return Thread.currentThread().getId();
  }

  /** Connection registered for the calling thread, or null. */
  public Connection getIfExists() {
    return threadConnections.get(currentThreadKey());
  }

  public Connection getThreadConnection() {
    long key = currentThreadKey();
    Connection c = threadConnections.get(key);
    if (c == null) throw new InvalidConnectionException(key, connectionNames());
    return c;
  }

  /**
   * Register (or rename) the calling thread's connection. A new connection starts in
   * {@link ConnectionState#INIT} and is opened lazily by the first statement.
   */
  public Connection setConnectionName(String name) {
    String connName = (name == null) ? "master" : name;
    long key = currentThreadKey();
    Connection conn = threadConnections.get(key);
    if (conn == null) {
      conn = new Connection(type(), connName, credentials);
      threadConnections.put(key, conn);
      events.newConnection(type(), connName);
      return conn;
    }
    String previous = conn.name();
    if (!connName.equals(previous)) {
      conn.rename(connName);
      events.connectionReused(connName, previous);
    }
    return conn;
  }

  /** Close the calling thread's connection. A connection that fails to close is dropped from the registry. */
  public void releaseConnection() {
    synchronized (lock) {
      Connection conn = getIfExists();
      if (conn == null) return;
      try {
        close(conn);
      } catch (RuntimeException e) {
        threadConnections.remove(currentThreadKey());
        throw e;
      }
    }
  }

  /** Close every registered connection and forget them. */
  public void cleanupAll() {
    synchronized (lock) {
      for (Connection c : threadConnections.values()) {
        if (c.isOpen()) log.debug("ybadapter.connection op=cleanup name={} state=open", c.name());
        close(c);
      }
      threadConnections.clear();
    }
  }

  /** Cancel every open connection except the caller's; returns the names of the cancelled ones. */
  public List<String> cancelOpen() {
    Connection current = getIfExists();
    List<String> names = new ArrayList<>();
    synchronized (lock) {
      for (Connection c : threadConnections.values()) {
        if (c == current) continue;
        if (c.handle() != null && c.isOpen()) {
          cancel(c);
          if (c.name() != null) names.add(c.name());
        }
      }
    }
    return names;
  }

  private List<String> connectionNames() {
    List<String> names = new ArrayList<>();
    for (Connection c : threadConnections.values()) names.add(String.valueOf(c.name()));
    return names;
  }

  // ---------------------------------------------------------------------------------------------
  // Open / close
  // ---------------------------------------------------------------------------------------------

  protected final Connection ensureOpen(Connection connection) {
    if (!connection.isOpen()) open(connection);
    return connection;
  }

  /**
   * Attach a session produced by {@code connect}, retrying failures the policy deems transient.\n
   *
   * The delay before retry {@code n} (0-based) is {@code policy.delayFor(n)}. Non-retryable failures and
   * exhaustion of the budget leave the connection in {@link ConnectionState#FAIL} and raise {@link ConnectionException};
   * so does a negative delay.\n
   */
  protected Connection retryConnection(Connection connection, Connector connect, RetryPolicy policy) {
    Objects.requireNonNull(connect, "connect");
    Objects.requireNonNull(policy, "policy");
    if (connection.isOpen()) {
      log.debug("Connection is already open, skipping open.");
      return connection;
    }

    int retriesLeft = policy.retryLimit();
    if (retriesLeft < 0) {
      connection.failed();
      throw new ConnectionException("retry limit cannot be negative: " + retriesLeft);
    }

    int attempt = 0;
    while (true) {
      try {
        connection.opened(connect.connect());
        log.debug("ybadapter.connection op=open type={} name={} attempts={}", type(), connection.name(), attempt + 1);
        return connection;
      } catch (Exception e) {
        if (!policy.isRetryable(e) || retriesLeft <= 0) {
          connection.failed();
          throw new ConnectionException(describe(e), e);
        }
        Duration delay;
        try {
          delay = policy.delayFor(attempt);
        } catch (ConnectionException invalid) {
          connection.failed();
          invalid.addSuppressed(e);
          throw invalid;
        }
        log.debug("Got a retryable error when attempting to open a {} connection. {} attempts remaining. "
                + "Retrying in {} seconds. Error: {}",
            type(), retriesLeft, delay.toSeconds(), describe(e));
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          connection.failed();
          throw new ConnectionException("Interrupted while waiting to reconnect " + connection.name(), ie);
        }
        retriesLeft--;
        attempt++;
      }
    }
  }

  /**
   * Close {@code connection}, rolling back an open transaction first. Rollback failures are logged;
   * a failure to close the session itself is raised as {@link DatabaseException}.
   */
  public Connection close(Connection connection) {
    if (connection.state() == ConnectionState.INIT || connection.state() == ConnectionState.CLOSED) {
      return connection;
    }
    if (connection.transactionOpen() && connection.handle() != null) {
      log.debug("On {}: ROLLBACK", connection.name());
      try {
        rollback(connection);
      } catch (DatabaseException e) {
        log.debug("ybadapter.connection op=close_rollback_failed name={} error={}", connection.name(), e.getMessage());
      }
    }
    ConnectionHandle h = connection.handle();
    try {
      if (h != null) h.close();
    } catch (SQLException e) {
      throw new DatabaseException(describe(e), e);
    } finally {
      connection.closed();
      events.connectionClosed(connection.name());
    }
    return connection;
  }

  // ---------------------------------------------------------------------------------------------
  // Transactions
  // ---------------------------------------------------------------------------------------------

  protected static void requireNoTransaction(Connection connection) {
    if (connection.transactionOpen()) {
      throw new InternalException("Tried to begin a new transaction on connection \"" + connection.name()
          + "\", but it already had one open!");
    }
  }

  protected static void requireTransaction(Connection connection) {
    if (!connection.transactionOpen()) {
      throw new InternalException("Tried to commit transaction on connection \"" + connection.name()
          + "\", but it does not have one open!");
    }
  }

  public Connection begin() {
    Connection connection = getThreadConnection();
    requireNoTransaction(connection);
    addBeginQuery();
    connection.transactionOpen(true);
    return connection;
  }

  public Connection commit() {
    Connection connection = getThreadConnection();
    requireTransaction(connection);
    events.sqlCommit(connection.name());
    addCommitQuery();
    connection.transactionOpen(false);
    return connection;
  }

  public Connection commitIfHasConnection() {
    Connection connection = getIfExists();
    if (connection != null) commit();
    return connection;
  }

  /** Roll back the calling thread's transaction, if it has a session and an open transaction. */
  public void rollbackIfOpen() {
    Connection connection = getIfExists();
    if (connection != null && connection.handle() != null && connection.transactionOpen()) {
      rollback(connection);
    }
  }

  /** Roll back {@code connection}; a session-level failure is raised as {@link DatabaseException}. */
  protected void rollback(Connection connection) {
    if (!connection.transactionOpen()) {
      throw new InternalException("Tried to rollback transaction on connection \"" + connection.name()
          + "\", but it does not have one open!");
    }
    events.rollback(connection.name());
    try {
      connection.handle().rollback();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to rollback '" + connection.name() + "': " + describe(e), e);
    } finally {
      connection.transactionOpen(false);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Statements
  // ---------------------------------------------------------------------------------------------

  /**
   * Run {@code sql} on the calling thread's connection, opening it if needed. With {@code autoBegin},
   * a transaction is started first when none is open.
   */
  public StatementResult addQuery(String sql, boolean autoBegin, List<Object> bindings) {
    Connection connection = getThreadConnection();
    if (autoBegin && !connection.transactionOpen()) begin();
    events.sqlQuery(connection.name(), sql);

    List<Object> binds = (bindings == null) ? List.of() : bindings;
    return exceptionHandler(sql, () -> {
      ConnectionHandle h = ensureOpen(connection).handle();
      long start = System.nanoTime();
      StatementResult result = h.execute(sql, binds);
      events.sqlQueryStatus(connection.name(), getResponse(result), (System.nanoTime() - start) / 1_000_000_000.0);
      return result;
    });
  }

  public StatementResult addQuery(String sql) {
    return addQuery(sql, true, List.of());
  }

  public StatementResult addBeginQuery() {
    return addQuery("BEGIN", false, List.of());
  }

  public StatementResult addCommitQuery() {
    return addQuery("COMMIT", false, List.of());
  }

  /** Run {@code sql} and report the normalized response, plus up to {@code limit} rows when {@code fetch}. */
  public ExecutionResult execute(String sql, boolean autoBegin, boolean fetch, Integer limit) {
    StatementResult result = addQuery(sql, autoBegin, List.of());
    AdapterResponse response = getResponse(result);
    ResultTable table = fetch ? result.table().limit(limit) : ResultTable.empty();
    return new ExecutionResult(response, table);
  }

  public ExecutionResult execute(String sql) {
    return execute(sql, false, false, null);
  }

  protected static String describe(Throwable t) {
    String m = t.getMessage();
    return (m == null || m.isBlank()) ? t.getClass().getName() : m.strip();
  }
}
