package io.intellixity.ybadapter.events;

import io.intellixity.ybadapter.exec.AdapterResponse;

/**
 * Telemetry hooks fired by the connection managers.\n
 *
 * All methods default to no-ops so listeners only override what they record.\n
 */
public interface AdapterEventListener {
  AdapterEventListener NOOP = new AdapterEventListener() {};

  default void newConnection(String connType, String connName) {}

  default void connectionReused(String connName, String previousName) {}

  default void sqlQuery(String connName, String sql) {}

  default void sqlQueryStatus(String connName, AdapterResponse response, double elapsedSeconds) {}

  default void sqlCommit(String connName) {}

  default void rollback(String connName) {}

  default void connectionClosed(String connName) {}
}
