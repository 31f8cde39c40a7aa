package io.intellixity.ybadapter.spi.exec;

import io.intellixity.ybadapter.error.AdapterRuntimeException;
import io.intellixity.ybadapter.error.ConnectionException;
import io.intellixity.ybadapter.error.DatabaseException;
import io.intellixity.ybadapter.error.InternalException;
import io.intellixity.ybadapter.error.InvalidConnectionException;
import io.intellixity.ybadapter.events.AdapterEventListener;
import io.intellixity.ybadapter.exec.AdapterResponse;
import io.intellixity.ybadapter.exec.Connection;
import io.intellixity.ybadapter.exec.ConnectionState;
import io.intellixity.ybadapter.exec.Credentials;
import io.intellixity.ybadapter.exec.ExecutionResult;
import io.intellixity.ybadapter.exec.ResultTable;
import io.intellixity.ybadapter.exec.StatementResult;
import io.intellixity.ybadapter.exec.handle.ConnectionHandle;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractConnectionManagerTest {

  private record TestCredentials() implements Credentials {
    @Override public String type() { return "test"; }
    @Override public String uniqueField() { return "localhost"; }
    @Override public String database() { return "db"; }
    @Override public String schema() { return "public"; }
    @Override public List<String> connectionKeys() { return List.of("database", "schema"); }
  }

  private static final class FakeHandle implements ConnectionHandle {
    final List<String> statements = new ArrayList<>();
    StatementResult nextQueryResult = StatementResult.of("SELECT 0", 0);
    SQLException closeFailure;
    int rollbacks;
    boolean closed;

    @Override
    public StatementResult execute(String sql, List<Object> bindings) {
      statements.add(sql);
      return sql.startsWith("select") ? nextQueryResult : StatementResult.of(sql, -1);
    }

    @Override public void setAutoCommit(boolean autoCommit) {}
    @Override public void rollback() { rollbacks++; }
    @Override public int backendPid() { return 1; }
    @Override public boolean isClosed() { return closed; }

    @Override
    public void close() throws SQLException {
      if (closeFailure != null) throw closeFailure;
      closed = true;
    }
  }

  private static final class RecordingEvents implements AdapterEventListener {
    final List<String> events = new ArrayList<>();
    @Override public void newConnection(String connType, String connName) { events.add("new:" + connName); }
    @Override public void connectionReused(String connName, String previousName) { events.add("reuse:" + previousName + "->" + connName); }
    @Override public void sqlCommit(String connName) { events.add("commit:" + connName); }
    @Override public void connectionClosed(String connName) { events.add("closed:" + connName); }
  }

  private static final class TestManager extends AbstractConnectionManager<TestCredentials> {
    final List<FakeHandle> handles = new ArrayList<>();
    final AtomicInteger opens = new AtomicInteger();
    RetryPolicy policy = RetryPolicy.noRetry();
    Connector connector = () -> {
      FakeHandle h = new FakeHandle();
      handles.add(h);
      return h;
    };

    TestManager(AdapterEventListener events) {
      super(new TestCredentials(), events, d -> {});
    }

    @Override public String type() { return "test"; }

    @Override
    public Connection open(Connection connection) {
      opens.incrementAndGet();
      return retryConnection(connection, connector, policy);
    }

    @Override public void cancel(Connection connection) {}

    @Override
    protected <T> T exceptionHandler(String sql, SqlWork<T> work) {
      try {
        return work.run();
      } catch (SQLException e) {
        throw new DatabaseException(e.getMessage(), e);
      } catch (AdapterRuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new AdapterRuntimeException(e.getMessage(), e);
      }
    }

    @Override
    public AdapterResponse getResponse(StatementResult result) {
      return new AdapterResponse(result.statusMessage(), result.statusMessage(), result.rowCount());
    }

    FakeHandle lastHandle() { return handles.get(handles.size() - 1); }
  }

  @Test
  void threadConnection_requiresRegistration() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    assertNull(m.getIfExists());
    assertThrows(InvalidConnectionException.class, m::getThreadConnection);
  }

  @Test
  void setConnectionName_createsOnceThenRenames() {
    RecordingEvents events = new RecordingEvents();
    TestManager m = new TestManager(events);

    Connection first = m.setConnectionName("model.a");
    Connection second = m.setConnectionName("model.b");

    assertSame(first, second);
    assertEquals("model.b", second.name());
    assertEquals(ConnectionState.INIT, second.state());
    assertEquals(List.of("new:model.a", "reuse:model.a->model.b"), events.events);
  }

  @Test
  void setConnectionName_defaultsToMaster() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    assertEquals("master", m.setConnectionName(null).name());
  }

  @Test
  void connectionIsOpenedLazilyByFirstStatement() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    Connection c = m.setConnectionName("model.a");
    assertEquals(0, m.opens.get());

    m.addQuery("select 1", false, List.of());
    m.addQuery("select 2", false, List.of());

    assertTrue(c.isOpen());
    assertEquals(1, m.handles.size());
    assertEquals(List.of("select 1", "select 2"), m.lastHandle().statements);
  }

  @Test
  void baseBeginAndCommit_issueStatementsAndTrackState() {
    RecordingEvents events = new RecordingEvents();
    TestManager m = new TestManager(events);
    Connection c = m.setConnectionName("model.a");

    m.begin();
    assertTrue(c.transactionOpen());
    assertThrows(InternalException.class, m::begin);

    m.commit();
    assertFalse(c.transactionOpen());
    assertThrows(InternalException.class, m::commit);

    assertEquals(List.of("BEGIN", "COMMIT"), m.lastHandle().statements);
    assertTrue(events.events.contains("commit:model.a"));
  }

  @Test
  void autoBegin_startsTransactionOnlyWhenNoneIsOpen() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    m.setConnectionName("model.a");

    m.addQuery("select 1", true, List.of());
    m.addQuery("select 2", true, List.of());

    assertEquals(List.of("BEGIN", "select 1", "select 2"), m.lastHandle().statements);
    assertTrue(m.getThreadConnection().transactionOpen());
  }

  @Test
  void execute_reportsResponseAndLimitsFetchedRows() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    m.setConnectionName("model.a");
    m.addQuery("begin-open", false, List.of());
    m.lastHandle().nextQueryResult = new StatementResult("SELECT 3", 3,
        new ResultTable(List.of("id"), List.of(List.of(1), List.of(2), List.of(3))));

    ExecutionResult fetched = m.execute("select id from t", false, true, 2);
    assertEquals("SELECT 3", fetched.response().message());
    assertEquals(3, fetched.response().rowsAffected());
    assertEquals(2, fetched.table().size());

    ExecutionResult notFetched = m.execute("select id from t", false, false, null);
    assertTrue(notFetched.table().isEmpty());
  }

  @Test
  void rollbackIfOpen_isNoOpWithoutTransaction() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    m.rollbackIfOpen();

    m.setConnectionName("model.a");
    m.addQuery("select 1", false, List.of());
    m.rollbackIfOpen();
    assertEquals(0, m.lastHandle().rollbacks);

    m.begin();
    m.rollbackIfOpen();
    assertEquals(1, m.lastHandle().rollbacks);
    assertFalse(m.getThreadConnection().transactionOpen());
  }

  @Test
  void releaseConnection_rollsBackAndCloses() {
    RecordingEvents events = new RecordingEvents();
    TestManager m = new TestManager(events);
    Connection c = m.setConnectionName("model.a");
    m.begin();

    m.releaseConnection();

    assertEquals(ConnectionState.CLOSED, c.state());
    assertFalse(c.transactionOpen());
    assertEquals(1, m.lastHandle().rollbacks);
    assertTrue(m.lastHandle().closed);
    assertTrue(events.events.contains("closed:model.a"));
    assertSame(c, m.getThreadConnection());
  }

  @Test
  void releaseConnection_dropsConnectionThatFailsToClose() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    m.setConnectionName("model.a");
    m.addQuery("select 1", false, List.of());
    m.lastHandle().closeFailure = new SQLException("socket gone");

    DatabaseException ex = assertThrows(DatabaseException.class, m::releaseConnection);
    assertEquals("socket gone", ex.getMessage());
    assertNull(m.getIfExists());
  }

  @Test
  void close_ignoresConnectionsThatWereNeverOpened() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    Connection c = m.setConnectionName("model.a");
    m.close(c);
    assertEquals(ConnectionState.INIT, c.state());
  }

  @Test
  void cleanupAll_closesEverythingAndForgetsIt() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    Connection c = m.setConnectionName("model.a");
    m.addQuery("select 1", false, List.of());

    m.cleanupAll();

    assertEquals(ConnectionState.CLOSED, c.state());
    assertNull(m.getIfExists());
  }

  @Test
  void retryConnection_rejectsNegativeLimit() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    m.policy = new RetryPolicy(-1, RetryPolicy::quadraticBackoff, t -> true);
    Connection c = m.setConnectionName("model.a");

    assertThrows(ConnectionException.class, () -> m.open(c));
    assertEquals(ConnectionState.FAIL, c.state());
    assertNull(c.handle());
  }

  @Test
  void retryConnection_wrapsNonRetryableFailureWithoutRetrying() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    AtomicInteger attempts = new AtomicInteger();
    m.policy = new RetryPolicy(5, RetryPolicy::quadraticBackoff, t -> false);
    m.connector = () -> {
      attempts.incrementAndGet();
      throw new SQLException("password authentication failed", "28P01");
    };
    Connection c = m.setConnectionName("model.a");

    ConnectionException ex = assertThrows(ConnectionException.class, () -> m.open(c));
    assertEquals("password authentication failed", ex.getMessage());
    assertEquals(1, attempts.get());
    assertEquals(ConnectionState.FAIL, c.state());
  }

  @Test
  void retryConnection_failsOnNegativeBackoff() {
    TestManager m = new TestManager(AdapterEventListener.NOOP);
    AtomicInteger attempts = new AtomicInteger();
    m.policy = new RetryPolicy(3, n -> Duration.ofSeconds(-1), t -> true);
    m.connector = () -> {
      attempts.incrementAndGet();
      throw new SQLException("connection refused", "08001");
    };
    Connection c = m.setConnectionName("model.a");

    ConnectionException ex = assertThrows(ConnectionException.class, () -> m.open(c));

    assertTrue(ex.getMessage().startsWith("retry timeout cannot be negative"));
    assertEquals(1, attempts.get());
    assertEquals(ConnectionState.FAIL, c.state());
    assertEquals(1, ex.getSuppressed().length);
  }

  @Test
  void quadraticBackoff_isAttemptSquaredSeconds() {
    for (int n = 0; n <= 6; n++) {
      assertEquals(Duration.ofSeconds((long) n * n), RetryPolicy.quadraticBackoff(n));
    }
  }
}
