package io.intellixity.ybadapter.exec.handle;

import java.sql.SQLException;
import java.util.Properties;

/** Opens physical sessions. The JDBC implementation goes through the driver manager. */
@FunctionalInterface
public interface SessionFactory {
  ConnectionHandle connect(String url, Properties properties) throws SQLException;
}
