package io.intellixity.ybadapter.events;

import io.intellixity.ybadapter.exec.AdapterResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default listener: writes every event as a structured debug line. */
public final class LoggingAdapterEventListener implements AdapterEventListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingAdapterEventListener.class);

  @Override
  public void newConnection(String connType, String connName) {
    log.debug("ybadapter.event new_connection type={} name={}", connType, connName);
  }

  @Override
  public void connectionReused(String connName, String previousName) {
    log.debug("ybadapter.event connection_reused name={} previous={}", connName, previousName);
  }

  @Override
  public void sqlQuery(String connName, String sql) {
    log.debug("ybadapter.event sql_query name={} sql={}", connName, sql);
  }

  @Override
  public void sqlQueryStatus(String connName, AdapterResponse response, double elapsedSeconds) {
    if (!log.isDebugEnabled()) return;
    log.debug("ybadapter.event sql_status name={} status={} elapsedSec={}",
        connName, response, String.format("%.2f", elapsedSeconds));
  }

  @Override
  public void sqlCommit(String connName) {
    log.debug("ybadapter.event sql_commit name={}", connName);
  }

  @Override
  public void rollback(String connName) {
    log.debug("ybadapter.event rollback name={}", connName);
  }

  @Override
  public void connectionClosed(String connName) {
    log.debug("ybadapter.event connection_closed name={}", connName);
  }
}
