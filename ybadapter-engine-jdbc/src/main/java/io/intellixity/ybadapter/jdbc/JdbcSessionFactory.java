package io.intellixity.ybadapter.jdbc;

import io.intellixity.ybadapter.exec.handle.ConnectionHandle;
import io.intellixity.ybadapter.exec.handle.SessionFactory;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

/** Opens sessions through {@link DriverManager}; the PostgreSQL driver registers itself on the classpath. */
public final class JdbcSessionFactory implements SessionFactory {
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public ConnectionHandle connect(String url, Properties properties) throws SQLException {
    java.sql.Connection c = DriverManager.getConnection(url, properties);
    return new JdbcConnectionHandle("jdbc-" + sequence.incrementAndGet(), c);
  }
}
